package com.bit.hydro.database.snapshot;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.JsonUtil;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 按区块高度留存历史的映射
 * 最新值存 latestTable，每次写入同时在 changelogTable 记录 (key + height) -> 新值，空字节表示删除
 * loadAtHeight(key, h) 返回高度 h 之前（即 h-1 结束时）的值
 * 键必须定长，否则 (key + height) 的前缀会相互覆盖
 */
public class SnapshotMap<V> {

    private static final byte[] ACTIVATION_HEIGHT_KEY = "snapshot_activation_height".getBytes(StandardCharsets.UTF_8);
    private static final byte[] REMOVED = new byte[0];

    private final TableEnum latestTable;
    private final TableEnum changelogTable;
    private final Class<V> type;

    public SnapshotMap(TableEnum latestTable, TableEnum changelogTable, Class<V> type) {
        this.latestTable = latestTable;
        this.changelogTable = changelogTable;
        this.type = type;
    }

    public Optional<V> loadLatest(DataBase db, byte[] key) {
        byte[] bytes = db.get(latestTable, key);
        return bytes == null ? Optional.empty() : Optional.of(JsonUtil.fromBytes(bytes, type));
    }

    public boolean has(DataBase db, byte[] key) {
        return db.isExist(latestTable, key);
    }

    public Optional<V> loadAtHeight(DataBase db, byte[] key, long height) {
        long activation = activationHeight(db);
        if (height < activation) {
            throw new HydroException(ErrorType.SNAPSHOT_UNAVAILABLE,
                    "高度 " + height + " 早于快照启用高度 " + activation);
        }
        if (height == 0) {
            return Optional.empty();
        }
        DataBase.KeyValue<byte[]> entry = db.floorEntry(changelogTable,
                ByteUtils.combine(key, ByteUtils.longToBytes(0)),
                ByteUtils.combine(key, ByteUtils.longToBytes(height - 1)));
        if (entry == null || entry.getValue().length == 0) {
            return Optional.empty();
        }
        return Optional.of(JsonUtil.fromBytes(entry.getValue(), type));
    }

    public void save(DataBase db, byte[] key, V value, long height) {
        byte[] bytes = JsonUtil.toBytes(value);
        db.insert(latestTable, key, bytes);
        db.insert(changelogTable, ByteUtils.combine(key, ByteUtils.longToBytes(height)), bytes);
    }

    public void remove(DataBase db, byte[] key, long height) {
        db.delete(latestTable, key);
        db.insert(changelogTable, ByteUtils.combine(key, ByteUtils.longToBytes(height)), REMOVED);
    }

    public static long activationHeight(DataBase db) {
        byte[] bytes = db.get(TableEnum.METADATA, ACTIVATION_HEIGHT_KEY);
        return bytes == null ? 0 : ByteUtils.bytesToLong(bytes);
    }

    public static void markActivationHeight(DataBase db, long height) {
        db.insert(TableEnum.METADATA, ACTIVATION_HEIGHT_KEY, ByteUtils.longToBytes(height));
    }
}
