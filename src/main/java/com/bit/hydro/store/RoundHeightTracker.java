package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.structure.round.HeightRange;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 每笔交易都会更新 round -> 高度区间 与 height -> round
 */
@Component
public class RoundHeightTracker {

    public void update(DataBase db, long roundId, long height) {
        byte[] key = ByteUtils.longToBytes(roundId);
        HeightRange range = heightRange(db, roundId)
                .map(existing -> new HeightRange(existing.getLowestKnownHeight(), height))
                .orElse(new HeightRange(height, height));
        db.insert(TableEnum.ROUND_HEIGHT_RANGE, key, JsonUtil.toBytes(range));
        db.insert(TableEnum.HEIGHT_ROUND, ByteUtils.longToBytes(height), key);
    }

    public Optional<HeightRange> heightRange(DataBase db, long roundId) {
        byte[] bytes = db.get(TableEnum.ROUND_HEIGHT_RANGE, ByteUtils.longToBytes(roundId));
        return bytes == null ? Optional.empty() : Optional.of(JsonUtil.fromBytes(bytes, HeightRange.class));
    }

    /**
     * 该轮最后一笔交易的高度，没有记录时为 0
     */
    public long highestKnownHeightForRound(DataBase db, long roundId) {
        return heightRange(db, roundId).map(HeightRange::getHighestKnownHeight).orElse(0L);
    }

    public Optional<Long> roundForHeight(DataBase db, long height) {
        byte[] bytes = db.get(TableEnum.HEIGHT_ROUND, ByteUtils.longToBytes(height));
        return bytes == null ? Optional.empty() : Optional.of(ByteUtils.bytesToLong(bytes));
    }
}
