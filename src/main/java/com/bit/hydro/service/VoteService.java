package com.bit.hydro.service;

import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.power.ProposalPowerChanges;
import com.bit.hydro.structure.vote.ProcessUnvotesResult;
import com.bit.hydro.structure.vote.ProcessVotesResult;
import com.bit.hydro.structure.vote.ProposalToLockups;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.structure.vote.VoteResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface VoteService {

    VoteResult vote(LedgerContext context, long trancheId, List<ProposalToLockups> proposalVotes);

    /**
     * @return 实际撤销了投票的锁仓
     */
    List<Long> unvote(LedgerContext context, long trancheId, List<Long> lockIds);

    /**
     * 撤销当前轮的投票，targets 中 lockId 对应的提案与已有投票一致时保留该投票
     */
    ProcessUnvotesResult processUnvotes(LedgerContext context, long trancheId, Collection<Long> lockIds,
                                        Map<Long, Long> targets);

    /**
     * 以当前轮、锁仓当前数量投票，不校验所有者
     */
    ProcessVotesResult processVotes(LedgerContext context, long trancheId, Map<Long, List<LockEntry>> proposalLocks);

    void applyProposalChanges(LedgerContext context, long trancheId, ProposalPowerChanges changes);

    /**
     * 拆分/合并后把父锁仓的投票状态转移到子锁仓
     */
    void carryOverVotes(LedgerContext context, List<LockEntry> parents, List<LockEntry> children);

    Map<Long, Vote> userVotes(LedgerContext context, long roundId, long trancheId, String address);

    Optional<Long> votingAllowedRound(LedgerContext context, long trancheId, long lockId);
}
