package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.DecimalUtil;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * 全局计数器与锁仓总量
 */
@Component
public class MetadataStore {

    private static final byte[] LOCK_ID_KEY = "lock_id".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PROPOSAL_ID_KEY = "proposal_id".getBytes(StandardCharsets.UTF_8);
    private static final byte[] TRANCHE_ID_KEY = "tranche_id".getBytes(StandardCharsets.UTF_8);
    private static final byte[] LOCKED_TOKENS_KEY = "locked_tokens".getBytes(StandardCharsets.UTF_8);
    private static final byte[] INITIALIZED_KEY = "initialized".getBytes(StandardCharsets.UTF_8);

    public long nextLockId(DataBase db) {
        return next(db, LOCK_ID_KEY);
    }

    public long nextProposalId(DataBase db) {
        return next(db, PROPOSAL_ID_KEY);
    }

    /**
     * tranche 从 1 开始编号
     */
    public long nextTrancheId(DataBase db) {
        return next(db, TRANCHE_ID_KEY) + 1;
    }

    public BigInteger lockedTokens(DataBase db) {
        byte[] bytes = db.get(TableEnum.METADATA, LOCKED_TOKENS_KEY);
        return bytes == null ? BigInteger.ZERO : new BigInteger(new String(bytes, StandardCharsets.UTF_8));
    }

    public void saveLockedTokens(DataBase db, BigInteger amount) {
        DecimalUtil.checkAmount(amount);
        db.insert(TableEnum.METADATA, LOCKED_TOKENS_KEY, amount.toString().getBytes(StandardCharsets.UTF_8));
    }

    public boolean isInitialized(DataBase db) {
        return db.isExist(TableEnum.METADATA, INITIALIZED_KEY);
    }

    public void markInitialized(DataBase db) {
        db.insert(TableEnum.METADATA, INITIALIZED_KEY, new byte[]{1});
    }

    private long next(DataBase db, byte[] key) {
        byte[] bytes = db.get(TableEnum.METADATA, key);
        long current = bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
        db.insert(TableEnum.METADATA, key, ByteUtils.longToBytes(current + 1));
        return current;
    }
}
