package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.DecimalUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * (tokenGroup, round) -> 对基础代币的比率
 * 某轮没有记录时沿用更早轮次的最新记录，更新只写当前轮，历史轮次不回填
 */
@Component
public class TokenGroupRatioStore {

    public Optional<BigDecimal> ratio(DataBase db, String tokenGroupId, long roundId) {
        byte[] prefix = ByteUtils.stringSegment(tokenGroupId);
        DataBase.KeyValue<byte[]> entry = db.floorEntry(TableEnum.TOKEN_GROUP_RATIO,
                ByteUtils.combine(prefix, ByteUtils.longToBytes(0)),
                ByteUtils.combine(prefix, ByteUtils.longToBytes(roundId)));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(new String(entry.getValue(), StandardCharsets.UTF_8)));
    }

    public void save(DataBase db, String tokenGroupId, long roundId, BigDecimal ratio) {
        DecimalUtil.checkDecimal(ratio);
        db.insert(TableEnum.TOKEN_GROUP_RATIO,
                ByteUtils.combine(ByteUtils.stringSegment(tokenGroupId), ByteUtils.longToBytes(roundId)),
                DecimalUtil.normalize(ratio).toPlainString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 所有代币组在 roundId 生效的比率
     */
    public Map<String, BigDecimal> allRatios(DataBase db, long roundId) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        db.iterate(TableEnum.TOKEN_GROUP_RATIO, (key, value) -> {
            String group = ByteUtils.readStringSegment(key, 0);
            if (!result.containsKey(group)) {
                ratio(db, group, roundId).ifPresent(ratio -> result.put(group, ratio));
            }
            return true;
        });
        return result;
    }
}
