package com.bit.hydro.structure.constants;

import com.bit.hydro.exception.HydroException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 锁定轮数 -> 投票权倍数，按轮数升序且去重
 */
@Data
@NoArgsConstructor
public class RoundLockPowerSchedule {

    private List<LockPowerEntry> entries = new ArrayList<>();

    public RoundLockPowerSchedule(List<LockPowerEntry> entries) {
        // 同一轮数后出现的覆盖先出现的
        Map<Long, BigDecimal> dedup = new TreeMap<>();
        for (LockPowerEntry entry : entries) {
            dedup.put(entry.getLockedRounds(), entry.getPowerScalingFactor());
        }
        List<LockPowerEntry> sorted = new ArrayList<>();
        dedup.forEach((rounds, factor) -> sorted.add(new LockPowerEntry(rounds, factor)));
        sorted.sort(Comparator.comparingLong(LockPowerEntry::getLockedRounds));
        this.entries = sorted;
    }

    @JsonIgnore
    public long getMaximumRoundsToLock() {
        if (entries.isEmpty()) {
            throw HydroException.validation("锁仓倍数表为空");
        }
        return entries.get(entries.size() - 1).getLockedRounds();
    }

    /**
     * 剩余锁定时长对应的倍数：第一个 lockupTime <= lockedRounds * epochLength 的条目，否则取最后一项
     */
    public BigDecimal factorFor(long lockEpochLength, long lockupTime) {
        if (entries.isEmpty()) {
            throw HydroException.validation("锁仓倍数表为空");
        }
        for (LockPowerEntry entry : entries) {
            if (lockupTime <= entry.getLockedRounds() * lockEpochLength) {
                return entry.getPowerScalingFactor();
            }
        }
        return entries.get(entries.size() - 1).getPowerScalingFactor();
    }

    public boolean allowsLockedRounds(long lockedRounds) {
        return entries.stream().anyMatch(entry -> entry.getLockedRounds() == lockedRounds);
    }
}
