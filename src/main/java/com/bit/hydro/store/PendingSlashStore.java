package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.DecimalUtil;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * lockId -> 未达阈值的累计待罚没数量（以锁仓当前币种计）
 */
@Component
public class PendingSlashStore {

    public Optional<BigInteger> load(DataBase db, long lockId) {
        byte[] bytes = db.get(TableEnum.LOCK_PENDING_SLASH, ByteUtils.longToBytes(lockId));
        return bytes == null ? Optional.empty() : Optional.of(new BigInteger(new String(bytes, StandardCharsets.UTF_8)));
    }

    public BigInteger loadOrZero(DataBase db, long lockId) {
        return load(db, lockId).orElse(BigInteger.ZERO);
    }

    public void save(DataBase db, long lockId, BigInteger amount) {
        DecimalUtil.checkAmount(amount);
        db.insert(TableEnum.LOCK_PENDING_SLASH, ByteUtils.longToBytes(lockId),
                amount.toString().getBytes(StandardCharsets.UTF_8));
    }

    public void remove(DataBase db, long lockId) {
        db.delete(TableEnum.LOCK_PENDING_SLASH, ByteUtils.longToBytes(lockId));
    }

    public boolean has(DataBase db, long lockId) {
        return db.isExist(TableEnum.LOCK_PENDING_SLASH, ByteUtils.longToBytes(lockId));
    }
}
