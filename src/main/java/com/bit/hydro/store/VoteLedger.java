package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * (round, tranche, lockId) -> Vote，以及 (tranche, lockId) -> 允许再次投票的轮次
 */
@Component
public class VoteLedger {

    public Optional<Vote> load(DataBase db, long roundId, long trancheId, long lockId) {
        byte[] bytes = db.get(TableEnum.VOTE, ByteUtils.combine(roundId, trancheId, lockId));
        return bytes == null ? Optional.empty() : Optional.of(JsonUtil.fromBytes(bytes, Vote.class));
    }

    public void save(DataBase db, long roundId, long trancheId, long lockId, Vote vote) {
        db.insert(TableEnum.VOTE, ByteUtils.combine(roundId, trancheId, lockId), JsonUtil.toBytes(vote));
    }

    public void remove(DataBase db, long roundId, long trancheId, long lockId) {
        db.delete(TableEnum.VOTE, ByteUtils.combine(roundId, trancheId, lockId));
    }

    /**
     * 按 lockId 升序跳过 startFrom 条后取 limit 条
     */
    public Map<Long, Vote> range(DataBase db, long roundId, long trancheId, long startFrom, long limit) {
        Map<Long, Vote> result = new LinkedHashMap<>();
        if (limit <= 0) {
            return result;
        }
        byte[] prefix = ByteUtils.combine(roundId, trancheId);
        long wanted = startFrom + limit;
        int fetch = wanted > Integer.MAX_VALUE || wanted < 0 ? Integer.MAX_VALUE : (int) wanted;
        List<DataBase.KeyValue<byte[]>> entries =
                db.rangeQueryWithLimit(TableEnum.VOTE, prefix, ByteUtils.prefixEnd(prefix), fetch);
        for (int i = (int) Math.min(startFrom, entries.size()); i < entries.size(); i++) {
            DataBase.KeyValue<byte[]> kv = entries.get(i);
            result.put(ByteUtils.bytesToLong(kv.getKey(), prefix.length), JsonUtil.fromBytes(kv.getValue(), Vote.class));
        }
        return result;
    }

    public Map<Long, Vote> all(DataBase db, long roundId, long trancheId) {
        return range(db, roundId, trancheId, 0, Long.MAX_VALUE);
    }

    public Optional<Long> votingAllowedRound(DataBase db, long trancheId, long lockId) {
        byte[] bytes = db.get(TableEnum.VOTING_ALLOWED_ROUND, ByteUtils.combine(trancheId, lockId));
        return bytes == null ? Optional.empty() : Optional.of(ByteUtils.bytesToLong(bytes));
    }

    public void saveVotingAllowedRound(DataBase db, long trancheId, long lockId, long roundId) {
        db.insert(TableEnum.VOTING_ALLOWED_ROUND, ByteUtils.combine(trancheId, lockId), ByteUtils.longToBytes(roundId));
    }

    public void removeVotingAllowedRound(DataBase db, long trancheId, long lockId) {
        db.delete(TableEnum.VOTING_ALLOWED_ROUND, ByteUtils.combine(trancheId, lockId));
    }
}
