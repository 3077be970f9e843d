package com.bit.hydro.database.tx;

import com.bit.hydro.config.SystemConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.KeyValueHandler;
import com.bit.hydro.database.rocksDb.RocksDb;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.google.common.primitives.UnsignedBytes;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 单次调用的写缓冲层：读穿透到底层库并叠加本次写入，commit 时一次性原子提交，失败时直接丢弃
 */
@Slf4j
public class TxDataBase implements DataBase {

    private static final Comparator<byte[]> KEY_ORDER = UnsignedBytes.lexicographicalComparator();

    // 删除标记，按引用比较；写入的值都会 clone，不会与它同一引用
    private static final byte[] TOMBSTONE = new byte[0];

    private final DataBase parent;
    private final Map<TableEnum, NavigableMap<byte[], byte[]>> writes = new EnumMap<>(TableEnum.class);
    private boolean finished;

    public TxDataBase(DataBase parent) {
        this.parent = parent;
    }

    @Override
    public boolean createDatabase(SystemConfig config) {
        throw new UnsupportedOperationException("事务层不能创建数据库");
    }

    @Override
    public boolean closeDatabase() {
        rollback();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("值不能为空, table=" + table);
        }
        buffer(table).put(key.clone(), value.clone());
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        buffer(table).put(key.clone(), TOMBSTONE);
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        checkActive();
        NavigableMap<byte[], byte[]> buffered = writes.get(table);
        if (buffered != null && buffered.containsKey(key)) {
            byte[] value = buffered.get(key);
            return value == TOMBSTONE ? null : value.clone();
        }
        return parent.get(table, key);
    }

    @Override
    public int count(TableEnum table) {
        return rangeQuery(table, null, null).size();
    }

    @Override
    public void close() {
        rollback();
    }

    /**
     * 嵌套事务：直接并入当前缓冲
     */
    @Override
    public boolean dataTransaction(List<RocksDb.DbOperation> operations) {
        for (RocksDb.DbOperation op : operations) {
            if (op.type == RocksDb.DbOperation.OpType.DELETE) {
                delete(op.table, op.key);
            } else {
                insert(op.table, op.key, op.value);
            }
        }
        return true;
    }

    @Override
    public List<KeyValue<byte[]>> rangeQuery(TableEnum table, byte[] startKey, byte[] endKey) {
        return rangeQueryWithLimit(table, startKey, endKey, Integer.MAX_VALUE);
    }

    @Override
    public List<KeyValue<byte[]>> rangeQueryWithLimit(TableEnum table, byte[] startKey, byte[] endKey, int limit) {
        checkActive();
        List<KeyValue<byte[]>> base = parent.rangeQuery(table, startKey, endKey);
        NavigableMap<byte[], byte[]> buffered = writes.get(table);
        if (buffered == null || buffered.isEmpty()) {
            return base.size() > limit ? new ArrayList<>(base.subList(0, limit)) : base;
        }

        Iterator<Map.Entry<byte[], byte[]>> overlay = slice(buffered, startKey, endKey).entrySet().iterator();
        Iterator<KeyValue<byte[]>> under = base.iterator();
        Map.Entry<byte[], byte[]> o = overlay.hasNext() ? overlay.next() : null;
        KeyValue<byte[]> u = under.hasNext() ? under.next() : null;

        // 两路有序归并，缓冲层同键覆盖底层
        List<KeyValue<byte[]>> result = new ArrayList<>();
        while ((o != null || u != null) && result.size() < limit) {
            int cmp = o == null ? 1 : u == null ? -1 : KEY_ORDER.compare(o.getKey(), u.getKey());
            if (cmp <= 0) {
                if (o.getValue() != TOMBSTONE) {
                    result.add(new KeyValue<>(o.getKey().clone(), o.getValue().clone()));
                }
                if (cmp == 0) {
                    u = under.hasNext() ? under.next() : null;
                }
                o = overlay.hasNext() ? overlay.next() : null;
            } else {
                result.add(u);
                u = under.hasNext() ? under.next() : null;
            }
        }
        return result;
    }

    @Override
    public void clearCache(TableEnum table) {
        parent.clearCache(table);
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        for (KeyValue<byte[]> kv : rangeQuery(table, null, null)) {
            if (!handler.handle(kv.getKey(), kv.getValue())) {
                break;
            }
        }
    }

    /**
     * 提交：把缓冲写入转换为一个原子批次
     */
    public void commit() {
        checkActive();
        List<RocksDb.DbOperation> operations = new ArrayList<>();
        for (Map.Entry<TableEnum, NavigableMap<byte[], byte[]>> tableWrites : writes.entrySet()) {
            for (Map.Entry<byte[], byte[]> entry : tableWrites.getValue().entrySet()) {
                if (entry.getValue() == TOMBSTONE) {
                    operations.add(new RocksDb.DbOperation(tableWrites.getKey(), entry.getKey(), null,
                            RocksDb.DbOperation.OpType.DELETE));
                } else {
                    operations.add(new RocksDb.DbOperation(tableWrites.getKey(), entry.getKey(), entry.getValue(),
                            RocksDb.DbOperation.OpType.INSERT));
                }
            }
        }
        finished = true;
        if (!parent.dataTransaction(operations)) {
            throw new HydroException(ErrorType.STORAGE, "事务提交失败，操作数: " + operations.size());
        }
        log.debug("事务提交成功，操作数: {}", operations.size());
    }

    /**
     * 回滚：丢弃全部缓冲写入
     */
    public void rollback() {
        writes.clear();
        finished = true;
    }

    public int pendingWrites() {
        return writes.values().stream().mapToInt(Map::size).sum();
    }

    private NavigableMap<byte[], byte[]> buffer(TableEnum table) {
        checkActive();
        return writes.computeIfAbsent(table, t -> new TreeMap<>(KEY_ORDER));
    }

    private void checkActive() {
        if (finished) {
            throw new IllegalStateException("事务已结束");
        }
    }

    private static NavigableMap<byte[], byte[]> slice(NavigableMap<byte[], byte[]> map, byte[] startKey, byte[] endKey) {
        if (startKey != null && endKey != null) {
            if (KEY_ORDER.compare(startKey, endKey) >= 0) {
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
