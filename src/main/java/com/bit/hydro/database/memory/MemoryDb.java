package com.bit.hydro.database.memory;

import com.bit.hydro.config.SystemConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.KeyValueHandler;
import com.bit.hydro.database.rocksDb.RocksDb;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.google.common.primitives.UnsignedBytes;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存实现 每张表一个按无符号字节序排序的 TreeMap，与 RocksDB 默认比较器一致
 */
@Slf4j
public class MemoryDb implements DataBase {

    private final Map<TableEnum, NavigableMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new TreeMap<>(UnsignedBytes.lexicographicalComparator()));
        }
    }

    @Override
    public boolean createDatabase(SystemConfig config) {
        log.info("使用内存数据库，进程退出后数据不保留");
        return true;
    }

    @Override
    public boolean closeDatabase() {
        close();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).put(key.clone(), value.clone());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).remove(key);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            byte[] value = tables.get(table).get(key);
            return value == null ? null : value.clone();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try {
            return tables.get(table).size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        clear();
    }

    /**
     * 清空所有表
     */
    public void clear() {
        rwLock.writeLock().lock();
        try {
            tables.values().forEach(Map::clear);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean dataTransaction(List<RocksDb.DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return true;
        }
        rwLock.writeLock().lock();
        try {
            for (RocksDb.DbOperation op : operations) {
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        tables.get(op.table).put(op.key.clone(), op.value.clone());
                        break;
                    case DELETE:
                        tables.get(op.table).remove(op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("不支持的操作类型: " + op.type);
                }
            }
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public List<KeyValue<byte[]>> rangeQuery(TableEnum table, byte[] startKey, byte[] endKey) {
        return rangeQueryWithLimit(table, startKey, endKey, Integer.MAX_VALUE);
    }

    @Override
    public List<KeyValue<byte[]>> rangeQueryWithLimit(TableEnum table, byte[] startKey, byte[] endKey, int limit) {
        if (table == null || limit <= 0) {
            throw new IllegalArgumentException("无效参数：表名不能为空或limit必须为正数");
        }
        rwLock.readLock().lock();
        try {
            List<KeyValue<byte[]>> result = new ArrayList<>();
            for (Map.Entry<byte[], byte[]> entry : subMap(table, startKey, endKey).entrySet()) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(new KeyValue<>(entry.getKey().clone(), entry.getValue().clone()));
            }
            return result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public KeyValue<byte[]> floorEntry(TableEnum table, byte[] lowerKey, byte[] key) {
        rwLock.readLock().lock();
        try {
            NavigableMap<byte[], byte[]> map = tables.get(table);
            Map.Entry<byte[], byte[]> entry = map.floorEntry(key);
            if (entry == null || (lowerKey != null && map.comparator().compare(entry.getKey(), lowerKey) < 0)) {
                return null;
            }
            return new KeyValue<>(entry.getKey().clone(), entry.getValue().clone());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void clearCache(TableEnum table) {
        // 无缓存层
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        for (KeyValue<byte[]> kv : rangeQuery(table, null, null)) {
            if (!handler.handle(kv.getKey(), kv.getValue())) {
                break;
            }
        }
    }

    private NavigableMap<byte[], byte[]> subMap(TableEnum table, byte[] startKey, byte[] endKey) {
        NavigableMap<byte[], byte[]> map = tables.get(table);
        if (startKey != null && endKey != null) {
            if (map.comparator().compare(startKey, endKey) >= 0) {
                return Collections.emptyNavigableMap();
            }
            return map.subMap(startKey, true, endKey, false);
        }
        if (startKey != null) {
            return map.tailMap(startKey, true);
        }
        if (endKey != null) {
            return map.headMap(endKey, false);
        }
        return map;
    }
}
