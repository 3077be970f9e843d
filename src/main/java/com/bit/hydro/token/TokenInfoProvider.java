package com.bit.hydro.token;

import com.bit.hydro.database.DataBase;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 代币信息提供方：LSM 验证人份额、流动性衍生品、基础代币
 */
public interface TokenInfoProvider {

    enum ProviderType { LSM, DERIVATIVE, BASE }

    ProviderType getType();

    /**
     * 解析币种所属的代币组，无法解析时抛出 HydroException
     */
    String resolveDenom(DataBase db, long roundId, String denom);

    /**
     * 本提供方不负责该代币组时返回 empty
     */
    Optional<BigDecimal> getTokenGroupRatio(DataBase db, long roundId, String tokenGroupId);

    boolean ownsTokenGroup(String tokenGroupId);
}
