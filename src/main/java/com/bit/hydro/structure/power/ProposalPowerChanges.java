package com.bit.hydro.structure.power;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 提案 -> 代币组 -> 份额变化（可为负），同一提案同一代币组的变化先累加再一次性落库
 */
public class ProposalPowerChanges {

    private final Map<Long, Map<String, BigDecimal>> changes = new TreeMap<>();

    public void add(long proposalId, String tokenGroupId, BigDecimal shares) {
        if (shares.signum() == 0) {
            return;
        }
        changes.computeIfAbsent(proposalId, id -> new TreeMap<>()).merge(tokenGroupId, shares, BigDecimal::add);
    }

    public void subtract(long proposalId, String tokenGroupId, BigDecimal shares) {
        add(proposalId, tokenGroupId, shares.negate());
    }

    public void addAll(ProposalPowerChanges other) {
        other.changes.forEach((proposalId, groups) ->
                groups.forEach((group, shares) -> add(proposalId, group, shares)));
    }

    /**
     * 去掉累加后为零的条目
     */
    public Map<Long, Map<String, BigDecimal>> effective() {
        Map<Long, Map<String, BigDecimal>> result = new TreeMap<>();
        changes.forEach((proposalId, groups) -> groups.forEach((group, shares) -> {
            if (shares.signum() != 0) {
                result.computeIfAbsent(proposalId, id -> new TreeMap<>()).put(group, shares);
            }
        }));
        return Collections.unmodifiableMap(result);
    }

    public boolean isEmpty() {
        return effective().isEmpty();
    }
}
