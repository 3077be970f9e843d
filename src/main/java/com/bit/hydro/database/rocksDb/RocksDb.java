package com.bit.hydro.database.rocksDb;

import com.bit.hydro.config.SystemConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.KeyValueHandler;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.primitives.UnsignedBytes;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;

import java.io.File;
import java.nio.ByteBuffer;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * RocksDB 实现：每张表一个列族，按表隔离的 Caffeine 读缓存
 */
@Slf4j
public class RocksDb implements DataBase {

    private static final Comparator<byte[]> KEY_ORDER = UnsignedBytes.lexicographicalComparator();

    // 缓存键用 ByteBuffer 包装，byte[] 没有按内容比较的 equals
    private final Map<TableEnum, Cache<ByteBuffer, byte[]>> tableCaches = new ConcurrentHashMap<>();

    private final RTable rTable = new RTable();
    private RocksDB db;
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(SystemConfig config) {
        String path = config.getPath();
        if (path == null) {
            return false;
        }
        dbPath = path;

        for (TableEnum table : TableEnum.values()) {
            Cache<ByteBuffer, byte[]> cache = Caffeine.newBuilder()
                    .maximumSize(table.getCacheSize())
                    .expireAfterWrite(table.getCacheTL(), TimeUnit.SECONDS)
                    .build();
            tableCaches.put(table, cache);
        }

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(
                    RocksDB.DEFAULT_COLUMN_FAMILY,
                    new ColumnFamilyOptions()
            ));

            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            DBOptions options = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(options, dbPath, cfDescriptors, cfHandles);

            if (cfHandles.size() != cfDescriptors.size()) {
                throw new HydroException(ErrorType.STORAGE, "列族句柄数量与描述符不匹配，初始化失败");
            }

            // 自定义列族从索引1开始绑定
            for (int i = 0; i < tableEnums.size(); i++) {
                TableEnum table = tableEnums.get(i);
                rTable.setColumnFamilyHandle(table, cfHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", table, i + 1);
            }

            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    @Override
    public boolean closeDatabase() {
        close();
        log.info("数据库已关闭");
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
            db.put(requireHandle(table), key, value);
            tableCaches.get(table).put(ByteBuffer.wrap(key.clone()), value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new HydroException(ErrorType.STORAGE, "插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            db.delete(requireHandle(table), key);
            tableCaches.get(table).invalidate(ByteBuffer.wrap(key));
        } catch (RocksDBException e) {
            log.error("删除数据失败, table={}", table, e);
            throw new HydroException(ErrorType.STORAGE, "删除数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        // RocksDB的更新就是覆盖写入
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        Cache<ByteBuffer, byte[]> cache = tableCaches.get(table);
        byte[] cached = cache.getIfPresent(ByteBuffer.wrap(key));
        if (cached != null) {
            return cached;
        }
        rwLock.readLock().lock();
        try {
            byte[] value = db.get(requireHandle(table), key);
            if (value != null) {
                cache.put(ByteBuffer.wrap(key.clone()), value);
            }
            return value;
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new HydroException(ErrorType.STORAGE, "获取数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekToFirst();
            int count = 0;
            while (iterator.isValid()) {
                count++;
                iterator.next();
            }
            return count;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeAll();
                db.close();
                db = null;
                tableCaches.values().forEach(Cache::invalidateAll);
                log.info("RocksDB连接已关闭");
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 执行跨列族事务（原子操作）
     * @param operations 事务操作列表（包含多个表的增删改）
     * @return 事务是否成功
     */
    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.debug("事务操作列表为空，无需执行");
            return true;
        }

        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
            writeOptions.setSync(true);

            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = requireHandle(op.table);
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        writeBatch.put(cfHandle, op.key, op.value);
                        break;
                    case DELETE:
                        writeBatch.delete(cfHandle, op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("不支持的操作类型: " + op.type);
                }
            }

            // WriteBatch 要么全成功，要么全失败
            db.write(writeOptions, writeBatch);

            for (DbOperation op : operations) {
                Cache<ByteBuffer, byte[]> cache = tableCaches.get(op.table);
                if (op.type == DbOperation.OpType.DELETE) {
                    cache.invalidate(ByteBuffer.wrap(op.key));
                } else {
                    cache.put(ByteBuffer.wrap(op.key.clone()), op.value);
                }
            }
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } catch (RocksDBException e) {
            log.error("事务执行失败", e);
            return false;
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
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            List<KeyValue<byte[]>> result = new ArrayList<>();

            if (startKey != null && startKey.length > 0) {
                iterator.seek(startKey);
            } else {
                iterator.seekToFirst();
            }

            // 遍历范围 [startKey, endKey)
            while (iterator.isValid() && result.size() < limit) {
                byte[] currentKey = iterator.key();
                if (endKey != null && KEY_ORDER.compare(currentKey, endKey) >= 0) {
                    break;
                }
                result.add(new KeyValue<>(currentKey, iterator.value()));
                iterator.next();
            }
            return result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public KeyValue<byte[]> floorEntry(TableEnum table, byte[] lowerKey, byte[] key) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekForPrev(key);
            if (!iterator.isValid()) {
                return null;
            }
            byte[] currentKey = iterator.key();
            if (lowerKey != null && KEY_ORDER.compare(currentKey, lowerKey) < 0) {
                return null;
            }
            return new KeyValue<>(currentKey, iterator.value());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void clearCache(TableEnum table) {
        if (table == null) {
            tableCaches.values().forEach(Cache::invalidateAll);
        } else {
            tableCaches.get(table).invalidateAll();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        if (table == null || handler == null) {
            log.warn("迭代表失败：表名或处理器不能为空");
            return;
        }
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                // 调用处理器处理键值对，返回false则停止迭代
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private ColumnFamilyHandle requireHandle(TableEnum table) {
        if (db == null) {
            throw new HydroException(ErrorType.STORAGE, "数据库未打开: " + dbPath);
        }
        ColumnFamilyHandle cfHandle = rTable.getColumnFamilyHandle(table);
        if (cfHandle == null) {
            throw new IllegalArgumentException("表不存在: " + table);
        }
        return cfHandle;
    }

    // 内部静态类：封装事务中的单个操作
    public static class DbOperation {
        public enum OpType { INSERT, UPDATE, DELETE }

        public final TableEnum table; // 表枚举
        public final byte[] key;      // 键
        public final byte[] value;    // 值（DELETE 操作可为 null）
        public final OpType type;     // 操作类型

        public DbOperation(TableEnum table, byte[] key, byte[] value, OpType type) {
            this.table = table;
            this.key = key;
            this.value = value;
            this.type = type;
        }
    }
}
