package com.bit.hydro.store;

import com.bit.hydro.common.Fraction;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockSuccessor;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.JsonUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 锁仓拆分/合并形成的有向无环图
 * 正向边 parent -> [(child, 份额)]，反向边 child -> [parent]，节点之间只用ID引用
 */
@Slf4j
@Component
public class LockCompositionResolver {

    private static final TypeReference<List<LockSuccessor>> SUCCESSORS = new TypeReference<>() {
    };
    private static final TypeReference<List<Long>> PARENTS = new TypeReference<>() {
    };

    public void recordSuccessors(DataBase db, long parentId, List<LockSuccessor> successors) {
        byte[] key = ByteUtils.longToBytes(parentId);
        if (db.isExist(TableEnum.LOCK_ID_TRACKING, key)) {
            throw new HydroException(ErrorType.LINEAGE_CORRUPTED, "锁仓 " + parentId + " 已有后继，不能再次拆分或合并");
        }
        db.insert(TableEnum.LOCK_ID_TRACKING, key, JsonUtil.toBytes(successors));
        for (LockSuccessor successor : successors) {
            List<Long> parents = new ArrayList<>(parents(db, successor.getLockId()));
            if (!parents.contains(parentId)) {
                parents.add(parentId);
            }
            db.insert(TableEnum.REVERSE_LOCK_ID_TRACKING, ByteUtils.longToBytes(successor.getLockId()),
                    JsonUtil.toBytes(parents));
        }
    }

    public List<LockSuccessor> successors(DataBase db, long lockId) {
        byte[] bytes = db.get(TableEnum.LOCK_ID_TRACKING, ByteUtils.longToBytes(lockId));
        return bytes == null ? Collections.emptyList() : JsonUtil.fromBytes(bytes, SUCCESSORS);
    }

    public List<Long> parents(DataBase db, long lockId) {
        byte[] bytes = db.get(TableEnum.REVERSE_LOCK_ID_TRACKING, ByteUtils.longToBytes(lockId));
        return bytes == null ? Collections.emptyList() : JsonUtil.fromBytes(bytes, PARENTS);
    }

    /**
     * 原始锁仓当前由哪些叶子锁仓承载，及各自占原始价值的份额，按 lockId 升序
     * 没有后继的锁仓返回自身、份额为 1；叶子锁仓是否仍存在由调用方判断
     * 同一叶子可经多条路径到达（拆分后又合并），份额按路径累加
     */
    public List<LockComposition> getCurrentLockComposition(DataBase db, long lockId) {
        Map<Long, Fraction> leaves = new TreeMap<>();
        walk(db, lockId, Fraction.ONE, new HashSet<>(), leaves);

        List<LockComposition> result = new ArrayList<>(leaves.size());
        leaves.forEach((id, fraction) -> result.add(new LockComposition(id, fraction)));
        return result;
    }

    /**
     * 祖先链的最大长度，没有父锁仓为 0
     */
    public int depth(DataBase db, long lockId) {
        return depth(db, lockId, new HashMap<>(), new HashSet<>());
    }

    private void walk(DataBase db, long lockId, Fraction fraction, Set<Long> path, Map<Long, Fraction> leaves) {
        if (!path.add(lockId)) {
            throw new HydroException(ErrorType.LINEAGE_CORRUPTED, "锁仓后继关系存在环, lockId=" + lockId);
        }
        List<LockSuccessor> successors = successors(db, lockId);
        if (successors.isEmpty()) {
            leaves.merge(lockId, fraction, Fraction::add);
        } else {
            for (LockSuccessor successor : successors) {
                walk(db, successor.getLockId(), fraction.multiply(successor.getFraction()), path, leaves);
            }
        }
        path.remove(lockId);
    }

    private int depth(DataBase db, long lockId, Map<Long, Integer> memo, Set<Long> path) {
        Integer known = memo.get(lockId);
        if (known != null) {
            return known;
        }
        if (!path.add(lockId)) {
            throw new HydroException(ErrorType.LINEAGE_CORRUPTED, "锁仓祖先关系存在环, lockId=" + lockId);
        }
        int max = 0;
        for (Long parent : parents(db, lockId)) {
            max = Math.max(max, depth(db, parent, memo, path) + 1);
        }
        path.remove(lockId);
        memo.put(lockId, max);
        return max;
    }
}
