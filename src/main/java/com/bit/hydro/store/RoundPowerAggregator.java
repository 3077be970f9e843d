package com.bit.hydro.store;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.rocksDb.TableEnum;
import com.bit.hydro.database.snapshot.SnapshotMap;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.round.RoundClock;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.power.LockPowerChange;
import com.bit.hydro.token.TokenRatioOracle;
import com.bit.hydro.util.ByteUtils;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 每轮每个代币组的时间加权份额，以及每轮总投票权（按高度留存历史）
 * 总投票权 = ceil(Σ 份额 × 当前轮比率)，只存整数
 */
@Slf4j
@Component
public class RoundPowerAggregator {

    private final SnapshotMap<BigInteger> totalPower =
            new SnapshotMap<>(TableEnum.ROUND_TOTAL_POWER, TableEnum.ROUND_TOTAL_POWER_CHANGELOG, BigInteger.class);

    public BigDecimal roundShares(DataBase db, long roundId, String tokenGroupId) {
        byte[] bytes = db.get(TableEnum.ROUND_SCALED_SHARES, sharesKey(roundId, tokenGroupId));
        return bytes == null ? DecimalUtil.ZERO : new BigDecimal(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * 该轮所有代币组的份额
     */
    public Map<String, BigDecimal> roundShares(DataBase db, long roundId) {
        byte[] prefix = ByteUtils.longToBytes(roundId);
        Map<String, BigDecimal> result = new TreeMap<>();
        for (DataBase.KeyValue<byte[]> kv : db.rangeQuery(TableEnum.ROUND_SCALED_SHARES, prefix, ByteUtils.prefixEnd(prefix))) {
            result.put(ByteUtils.readStringSegment(kv.getKey(), prefix.length),
                    new BigDecimal(new String(kv.getValue(), StandardCharsets.UTF_8)));
        }
        return result;
    }

    public Optional<BigInteger> totalPower(DataBase db, long roundId) {
        return totalPower.loadLatest(db, ByteUtils.longToBytes(roundId));
    }

    public BigInteger totalPowerOrZero(DataBase db, long roundId) {
        return totalPower(db, roundId).orElse(BigInteger.ZERO);
    }

    /**
     * 高度 height 之前该轮的总投票权
     */
    public BigInteger totalPowerAtHeight(DataBase db, long roundId, long height) {
        return totalPower.loadAtHeight(db, ByteUtils.longToBytes(roundId), height).orElse(BigInteger.ZERO);
    }

    /**
     * 锁仓变化后重算当前轮及之后 maxRounds 轮的份额和总投票权
     * 每轮先累加所有锁仓在各代币组上的份额差，再按 (轮次, 代币组) 一次性落库
     * 比率取当前轮；比率为 0 的代币组只更新份额，不计入总投票权
     */
    public void reconcile(DataBase db, TokenRatioOracle oracle, Constants constants, long currentRound, long height,
                          List<LockPowerChange> changes) {
        long lastRound = currentRound + constants.getRoundLockPowerSchedule().getMaximumRoundsToLock();

        // round -> tokenGroup -> (旧份额 - 新份额)
        Map<Long, Map<String, BigDecimal>> diffs = new TreeMap<>();
        for (LockPowerChange change : changes) {
            LockEntry reference = change.getAfter() != null ? change.getAfter() : change.getBefore();
            Optional<String> tokenGroup = oracle.findTokenGroup(currentRound, reference.getFunds().getDenom());
            if (tokenGroup.isEmpty()) {
                log.warn("无法解析锁仓币种所属代币组，跳过投票权更新, lockId={}, denom={}",
                        reference.getLockId(), reference.getFunds().getDenom());
                continue;
            }
            for (long round = currentRound; round <= lastRound; round++) {
                long roundEnd = RoundClock.computeRoundEnd(constants, round);
                if (expiredBy(change.getBefore(), roundEnd) && expiredBy(change.getAfter(), roundEnd)) {
                    break;
                }
                BigInteger before = shares(constants, roundEnd, change.getBefore());
                BigInteger after = shares(constants, roundEnd, change.getAfter());
                BigInteger diff = before.subtract(after);
                if (diff.signum() == 0) {
                    continue;
                }
                diffs.computeIfAbsent(round, r -> new TreeMap<>())
                        .merge(tokenGroup.get(), new BigDecimal(diff), BigDecimal::add);
            }
        }

        for (Map.Entry<Long, Map<String, BigDecimal>> roundDiffs : diffs.entrySet()) {
            long round = roundDiffs.getKey();
            BigDecimal powerChange = BigDecimal.ZERO;

            for (Map.Entry<String, BigDecimal> groupDiff : roundDiffs.getValue().entrySet()) {
                String group = groupDiff.getKey();
                BigDecimal diff = groupDiff.getValue();
                BigDecimal oldShares = roundShares(db, round, group);
                BigDecimal newShares = oldShares.compareTo(diff) > 0 ? oldShares.subtract(diff) : DecimalUtil.ZERO;
                saveRoundShares(db, round, group, newShares);

                BigDecimal ratio = oracle.getTokenGroupRatio(currentRound, group);
                if (ratio.signum() == 0) {
                    log.warn("代币组比率为 0，总投票权不计入该组, round={}, tokenGroup={}", round, group);
                    continue;
                }
                powerChange = powerChange.add(oldShares.multiply(ratio)).subtract(newShares.multiply(ratio));
            }

            BigDecimal oldTotal = new BigDecimal(totalPowerOrZero(db, round));
            BigDecimal newTotal = oldTotal.subtract(powerChange);
            if (newTotal.signum() < 0) {
                newTotal = BigDecimal.ZERO;
            }
            BigInteger total = DecimalUtil.ceil(newTotal.setScale(DecimalUtil.SCALE, RoundingMode.DOWN));
            totalPower.save(db, ByteUtils.longToBytes(round), total, height);
            log.debug("轮次总投票权更新, round={}, {} -> {}", round, oldTotal.toBigInteger(), total);
        }
    }

    /**
     * 代币组比率变化后从当前轮开始更新总投票权，遇到没有总投票权记录或该组没有份额的轮次即停止
     */
    public void applyRatioChange(DataBase db, long currentRound, long height, String tokenGroupId,
                                 BigDecimal oldRatio, BigDecimal newRatio) {
        for (long round = currentRound; ; round++) {
            Optional<BigInteger> total = totalPower(db, round);
            if (total.isEmpty()) {
                break;
            }
            BigDecimal shares = roundShares(db, round, tokenGroupId);
            if (shares.signum() == 0) {
                break;
            }
            BigDecimal updated = new BigDecimal(total.get())
                    .add(shares.multiply(newRatio))
                    .subtract(shares.multiply(oldRatio));
            if (updated.signum() < 0) {
                throw HydroException.arithmetic("Total power cannot be negative");
            }
            BigInteger newTotal = DecimalUtil.ceil(updated.setScale(DecimalUtil.SCALE, RoundingMode.DOWN));
            if (!newTotal.equals(total.get())) {
                totalPower.save(db, ByteUtils.longToBytes(round), newTotal, height);
            }
        }
    }

    private void saveRoundShares(DataBase db, long roundId, String tokenGroupId, BigDecimal shares) {
        db.insert(TableEnum.ROUND_SCALED_SHARES, sharesKey(roundId, tokenGroupId),
                DecimalUtil.normalize(shares).toPlainString().getBytes(StandardCharsets.UTF_8));
    }

    private static boolean expiredBy(LockEntry lock, long roundEnd) {
        return lock == null || lock.getLockEnd() < roundEnd;
    }

    private static BigInteger shares(Constants constants, long roundEnd, LockEntry lock) {
        return lock == null ? BigInteger.ZERO : RoundClock.lockTimeWeightedShares(constants, roundEnd, lock);
    }

    private static byte[] sharesKey(long roundId, String tokenGroupId) {
        return ByteUtils.combine(ByteUtils.longToBytes(roundId), ByteUtils.stringSegment(tokenGroupId));
    }
}
