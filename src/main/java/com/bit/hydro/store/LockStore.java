package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.database.snapshot.SnapshotMap;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.util.ByteUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 锁仓存储：最新值 + 按高度的历史，另维护 owner -> lockIds 索引
 */
@Component
public class LockStore {

    private static final byte[] EMPTY = new byte[0];

    private final SnapshotMap<LockEntry> locks =
            new SnapshotMap<>(TableEnum.LOCK, TableEnum.LOCK_CHANGELOG, LockEntry.class);

    public Optional<LockEntry> load(DataBase db, long lockId) {
        return locks.loadLatest(db, key(lockId));
    }

    /**
     * 高度 height 之前的锁仓状态
     */
    public Optional<LockEntry> loadAtHeight(DataBase db, long lockId, long height) {
        return locks.loadAtHeight(db, key(lockId), height);
    }

    public void save(DataBase db, LockEntry lock, long height) {
        locks.save(db, key(lock.getLockId()), lock, height);
    }

    public void remove(DataBase db, long lockId, long height) {
        locks.remove(db, key(lockId), height);
    }

    public void addUserLock(DataBase db, String owner, long lockId) {
        db.insert(TableEnum.USER_LOCKS, userLockKey(owner, lockId), EMPTY);
    }

    public void removeUserLock(DataBase db, String owner, long lockId) {
        db.delete(TableEnum.USER_LOCKS, userLockKey(owner, lockId));
    }

    public List<Long> userLockIds(DataBase db, String owner) {
        byte[] prefix = ByteUtils.stringSegment(owner);
        List<Long> ids = new ArrayList<>();
        for (DataBase.KeyValue<byte[]> kv : db.rangeQuery(TableEnum.USER_LOCKS, prefix, ByteUtils.prefixEnd(prefix))) {
            ids.add(ByteUtils.bytesToLong(kv.getKey(), prefix.length));
        }
        return ids;
    }

    public List<LockEntry> userLocks(DataBase db, String owner) {
        List<LockEntry> result = new ArrayList<>();
        for (Long lockId : userLockIds(db, owner)) {
            load(db, lockId).ifPresent(result::add);
        }
        return result;
    }

    private static byte[] key(long lockId) {
        return ByteUtils.longToBytes(lockId);
    }

    private static byte[] userLockKey(String owner, long lockId) {
        return ByteUtils.combine(ByteUtils.stringSegment(owner), ByteUtils.longToBytes(lockId));
    }
}
