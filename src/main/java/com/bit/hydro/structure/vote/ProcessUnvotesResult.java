package com.bit.hydro.structure.vote;

import com.bit.hydro.structure.power.ProposalPowerChanges;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
public class ProcessUnvotesResult {
    private Map<Long, Vote> removedVotes = new LinkedHashMap<>();
    /**
     * 已投给目标提案、无需重新投票的锁仓
     */
    private Set<Long> keptLockIds = new LinkedHashSet<>();
    private ProposalPowerChanges powerChanges = new ProposalPowerChanges();
}
