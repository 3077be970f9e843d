package com.bit.hydro.database;

import com.bit.hydro.config.SystemConfig;
import com.bit.hydro.database.rocksDb.RocksDb;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.util.ByteUtils;

import java.util.List;

//KV数据库操作 键按字节序有序
public interface DataBase {

    /**
     * 创建数据库
     * @param config
     * @return
     */
    boolean createDatabase(SystemConfig config);

    /**
     * 关闭数据库
     * @return
     */
    boolean closeDatabase();

    boolean isExist(TableEnum table, byte[] key);

    void insert(TableEnum table, byte[] key, byte[] value);

    void delete(TableEnum table, byte[] key);

    void update(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据
     * @return 不存在返回 null
     */
    byte[] get(TableEnum table, byte[] key);

    int count(TableEnum table);

    void close();

    /**
     * 事务完成 要么全部成功 要么全部失败
     */
    boolean dataTransaction(List<RocksDb.DbOperation> operations);

    /**
     * 按键范围查询数据（[startKey, endKey)）
     * @param startKey 起始键（包含，null 表示最小键）
     * @param endKey 结束键（不包含，null 表示最大键）
     */
    List<KeyValue<byte[]>> rangeQuery(TableEnum table, byte[] startKey, byte[] endKey);

    /**
     * 按键范围查询并限制条数
     */
    List<KeyValue<byte[]>> rangeQueryWithLimit(TableEnum table, byte[] startKey, byte[] endKey, int limit);

    /**
     * 在 [lowerKey, key] 范围内取键最大的一条
     * @return 不存在返回 null
     */
    default KeyValue<byte[]> floorEntry(TableEnum table, byte[] lowerKey, byte[] key) {
        List<KeyValue<byte[]>> range = rangeQuery(table, lowerKey, ByteUtils.successor(key));
        return range.isEmpty() ? null : range.get(range.size() - 1);
    }

    // 辅助类：封装键值对（用于范围查询返回结果）
    class KeyValue<T> {
        private byte[] key;
        private T value;

        public KeyValue() {
        }

        public KeyValue(byte[] key, T value) {
            this.key = key;
            this.value = value;
        }

        public byte[] getKey() { return key; }
        public void setKey(byte[] key) { this.key = key; }
        public T getValue() { return value; }
        public void setValue(T value) { this.value = value; }
    }

    /**
     * 清理指定表的本地缓存
     * @param table 表名（null 表示清理所有表缓存）
     */
    void clearCache(TableEnum table);

    /**
     * 迭代器遍历（返回 false 停止）
     */
    void iterate(TableEnum table, KeyValueHandler handler);
}
