package com.bit.hydro.ledger;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.env.BlockEnv;
import com.bit.hydro.token.TokenManager;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次调用的执行环境：事务层、区块信息、当前生效的配置与轮次
 */
@Getter
@AllArgsConstructor
public class LedgerContext {
    private final DataBase db;
    private final BlockEnv env;
    private final Constants constants;
    private final long currentRound;
    private final TokenManager tokenManager;

    public long height() {
        return env.getHeight();
    }

    public long now() {
        return env.getTimeNanos();
    }

    public String sender() {
        return env.getSender();
    }

    public void ensureNotPaused() {
        if (constants.isPaused()) {
            throw new HydroException(ErrorType.PAUSED, "Paused");
        }
    }
}
