package com.bit.hydro.database.rocksDb;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyOptions;


/**
 * 表枚举（集中管理所有表的元信息，作为唯一数据源）
 * 键统一大端编码，保证按字节序遍历即按数值序遍历
 */
public enum TableEnum {
    // 系统元数据：锁仓ID计数器、提案ID计数器、锁仓总量、快照启用高度
    METADATA((short) 1, "metadata", new ColumnFamilyOptions(), 1_000, 60 * 60),
    // 激活时间戳 -> Constants
    CONSTANTS((short) 2, "constants", new ColumnFamilyOptions(), 1_000, 60 * 60),
    WHITELIST_ADMINS((short) 3, "whitelist_admins", new ColumnFamilyOptions(), 1_000, 60 * 60),
    WHITELIST((short) 4, "whitelist", new ColumnFamilyOptions(), 1_000, 60 * 60),
    TRANCHE((short) 5, "tranche", new ColumnFamilyOptions(), 1_000, 60 * 60),

    // 锁仓最新值 lockId -> LockEntry
    LOCK(
            (short) 10,
            "lock",
            new ColumnFamilyOptions()
                    .setTableFormatConfig(new BlockBasedTableConfig()
                            .setBlockCacheSize(64 * 1024 * 1024)  // 64MB缓存
                            .setCacheIndexAndFilterBlocks(true)),
            100_000,
            60 * 10
    ),
    // 锁仓变更日志 lockId + height -> LockEntry（空值为删除标记）
    LOCK_CHANGELOG((short) 11, "lock_changelog", new ColumnFamilyOptions(), 10_000, 60),
    // owner + 0x00 + lockId -> 空
    USER_LOCKS((short) 12, "user_locks", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // 父锁仓 -> 后继锁仓及份额
    LOCK_ID_TRACKING((short) 13, "lock_id_tracking", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // 子锁仓 -> 父锁仓
    REVERSE_LOCK_ID_TRACKING((short) 14, "reverse_lock_id_tracking", new ColumnFamilyOptions(), 10_000, 60 * 10),
    LOCK_PENDING_SLASH((short) 15, "lock_pending_slash", new ColumnFamilyOptions(), 10_000, 60 * 10),

    // round + tranche + lockId -> Vote
    VOTE((short) 20, "vote", new ColumnFamilyOptions(), 100_000, 60 * 10),
    // tranche + lockId -> round
    VOTING_ALLOWED_ROUND((short) 21, "voting_allowed_round", new ColumnFamilyOptions(), 10_000, 60 * 10),

    // round + tranche + proposalId -> Proposal
    PROPOSAL((short) 30, "proposal", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // proposalId -> Decimal
    PROPOSAL_TOTAL_POWER((short) 31, "proposal_total_power", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // proposalId + tokenGroup -> Decimal
    PROPOSAL_SCALED_SHARES((short) 32, "proposal_scaled_shares", new ColumnFamilyOptions(), 10_000, 60 * 10),

    // round + tokenGroup -> Decimal
    ROUND_SCALED_SHARES((short) 40, "round_scaled_shares", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // round -> u128 最新值
    ROUND_TOTAL_POWER((short) 41, "round_total_power", new ColumnFamilyOptions(), 10_000, 60 * 10),
    // round + height -> u128
    ROUND_TOTAL_POWER_CHANGELOG((short) 42, "round_total_power_changelog", new ColumnFamilyOptions(), 1_000, 60),
    // round -> HeightRange
    ROUND_HEIGHT_RANGE((short) 43, "round_height_range", new ColumnFamilyOptions(), 1_000, 60 * 10),
    // height -> round
    HEIGHT_ROUND((short) 44, "height_round", new ColumnFamilyOptions(), 1_000, 60),

    // tokenGroup + 0x00 + round -> Decimal
    TOKEN_GROUP_RATIO((short) 50, "token_group_ratio", new ColumnFamilyOptions(), 10_000, 60 * 10);

    @Getter private final short code;  // 表唯一标识（short类型）
    @Getter private final String columnFamilyName;  // 列族实际存储名称
    @Getter private final ColumnFamilyOptions columnFamilyOptions;  // 列族配置
    @Getter private final long cacheSize;  // 缓存条数
    @Getter private final long cacheTL;  // 缓存时长 单位秒

    TableEnum(short code, String columnFamilyName, ColumnFamilyOptions columnFamilyOptions, long cacheSize, long cacheTL) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
        this.columnFamilyOptions = columnFamilyOptions;
        this.cacheSize = cacheSize;
        this.cacheTL = cacheTL;
    }

    // 缓存：标识 -> 枚举实例（提高查询效率）
    private static final Map<Short, TableEnum> CODE_TO_ENUM = new HashMap<>();

    static {
        for (TableEnum table : values()) {
            CODE_TO_ENUM.put(table.code, table);
        }
    }

    public static TableEnum getByCode(short code) {
        return CODE_TO_ENUM.get(code);
    }
}
