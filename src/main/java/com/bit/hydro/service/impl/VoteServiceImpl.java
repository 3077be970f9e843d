package com.bit.hydro.service.impl;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.round.RoundClock;
import com.bit.hydro.service.VoteService;
import com.bit.hydro.store.LockStore;
import com.bit.hydro.store.ProposalStore;
import com.bit.hydro.store.VoteLedger;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.power.ProposalPowerChanges;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.vote.ProcessUnvotesResult;
import com.bit.hydro.structure.vote.ProcessVotesResult;
import com.bit.hydro.structure.vote.ProposalToLockups;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.structure.vote.VoteResult;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.*;

@Slf4j
@Service
public class VoteServiceImpl implements VoteService {

    @Autowired
    private VoteLedger voteLedger;

    @Autowired
    private LockStore lockStore;

    @Autowired
    private ProposalStore proposalStore;

    @Override
    public VoteResult vote(LedgerContext context, long trancheId, List<ProposalToLockups> proposalVotes) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        long round = context.getCurrentRound();
        proposalStore.requireTranche(db, trancheId);

        Set<Long> proposalIds = new HashSet<>();
        Set<Long> lockIds = new LinkedHashSet<>();
        Map<Long, Long> targets = new HashMap<>();
        Map<Long, LockEntry> locks = new HashMap<>();
        for (ProposalToLockups entry : proposalVotes) {
            if (!proposalIds.add(entry.getProposalId())) {
                throw HydroException.validation("Duplicate proposal ID " + entry.getProposalId() + " provided");
            }
            proposalStore.requireProposal(db, round, trancheId, entry.getProposalId());
            for (Long lockId : entry.getLockIds()) {
                if (!lockIds.add(lockId)) {
                    throw HydroException.validation("Duplicate lock ID " + lockId + " provided");
                }
                LockEntry lock = lockStore.load(db, lockId)
                        .orElseThrow(() -> HydroException.notFound("Lock with id " + lockId + " not found"));
                if (!lock.getOwner().equals(context.sender())) {
                    throw HydroException.unauthorized("Lock " + lockId + " is not owned by " + context.sender());
                }
                targets.put(lockId, entry.getProposalId());
                locks.put(lockId, lock);
            }
        }
        if (lockIds.isEmpty()) {
            throw HydroException.validation("Must provide at least one lock_id to vote with");
        }

        ProcessUnvotesResult unvotes = processUnvotes(context, trancheId, lockIds, targets);

        Map<Long, List<LockEntry>> toVote = new LinkedHashMap<>();
        for (ProposalToLockups entry : proposalVotes) {
            for (Long lockId : entry.getLockIds()) {
                if (!unvotes.getKeptLockIds().contains(lockId)) {
                    toVote.computeIfAbsent(entry.getProposalId(), id -> new ArrayList<>()).add(locks.get(lockId));
                }
            }
        }
        ProcessVotesResult votes = processVotes(context, trancheId, toVote);

        ProposalPowerChanges changes = new ProposalPowerChanges();
        changes.addAll(unvotes.getPowerChanges());
        changes.addAll(votes.getPowerChanges());
        applyProposalChanges(context, trancheId, changes);

        VoteResult result = new VoteResult();
        result.getVotedLockIds().addAll(votes.getVotedLockIds());
        result.getVotedLockIds().addAll(unvotes.getKeptLockIds());
        result.getSkippedLockIds().addAll(votes.getSkippedLockIds());
        result.getUnvotedLockIds().addAll(unvotes.getRemovedVotes().keySet());
        log.info("投票完成, round={}, tranche={}, sender={}, 投票锁仓: {}, 跳过: {}", round, trancheId,
                context.sender(), result.getVotedLockIds(), result.getSkippedLockIds());
        return result;
    }

    @Override
    public List<Long> unvote(LedgerContext context, long trancheId, List<Long> lockIds) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        proposalStore.requireTranche(db, trancheId);
        Set<Long> unique = new LinkedHashSet<>(lockIds);
        for (Long lockId : unique) {
            LockEntry lock = lockStore.load(db, lockId)
                    .orElseThrow(() -> HydroException.notFound("Lock with id " + lockId + " not found"));
            if (!lock.getOwner().equals(context.sender())) {
                throw HydroException.unauthorized("Lock " + lockId + " is not owned by " + context.sender());
            }
        }
        ProcessUnvotesResult unvotes = processUnvotes(context, trancheId, unique, Collections.emptyMap());
        applyProposalChanges(context, trancheId, unvotes.getPowerChanges());
        return new ArrayList<>(unvotes.getRemovedVotes().keySet());
    }

    @Override
    public ProcessUnvotesResult processUnvotes(LedgerContext context, long trancheId, Collection<Long> lockIds,
                                               Map<Long, Long> targets) {
        DataBase db = context.getDb();
        long round = context.getCurrentRound();
        ProcessUnvotesResult result = new ProcessUnvotesResult();
        for (Long lockId : lockIds) {
            Optional<Vote> existing = voteLedger.load(db, round, trancheId, lockId);
            if (existing.isEmpty()) {
                continue;
            }
            Vote vote = existing.get();
            Long target = targets.get(lockId);
            if (target != null && target == vote.getPropId()) {
                result.getKeptLockIds().add(lockId);
                continue;
            }
            voteLedger.remove(db, round, trancheId, lockId);
            result.getRemovedVotes().put(lockId, vote);
            // 占位投票不带投票权，也不是它设置的禁投轮次
            if (vote.getTimeWeightedShares().signum() > 0) {
                voteLedger.removeVotingAllowedRound(db, trancheId, lockId);
                result.getPowerChanges().subtract(vote.getPropId(), vote.getTokenGroupId(),
                        vote.getTimeWeightedShares());
            }
        }
        return result;
    }

    @Override
    public ProcessVotesResult processVotes(LedgerContext context, long trancheId,
                                           Map<Long, List<LockEntry>> proposalLocks) {
        DataBase db = context.getDb();
        long round = context.getCurrentRound();
        long roundEnd = RoundClock.computeRoundEnd(context.getConstants(), round);
        ProcessVotesResult result = new ProcessVotesResult();

        for (Map.Entry<Long, List<LockEntry>> entry : proposalLocks.entrySet()) {
            Proposal proposal = proposalStore.requireProposal(db, round, trancheId, entry.getKey());
            long deploymentEnd = RoundClock.computeRoundEnd(context.getConstants(),
                    round + proposal.getDeploymentDuration() - 1);

            for (LockEntry lock : entry.getValue()) {
                long lockId = lock.getLockId();
                Optional<Long> allowedRound = voteLedger.votingAllowedRound(db, trancheId, lockId);
                if (allowedRound.isPresent() && allowedRound.get() > round) {
                    throw HydroException.validation("Not allowed to vote with lock_id " + lockId + " in tranche "
                            + trancheId + ". Cannot vote again with this lock_id until round " + allowedRound.get() + ".");
                }
                Optional<String> tokenGroup = context.getTokenManager().findTokenGroup(round, lock.getFunds().getDenom());
                if (tokenGroup.isEmpty()) {
                    log.warn("锁仓币种无法解析，跳过投票, lockId={}, denom={}", lockId, lock.getFunds().getDenom());
                    result.getSkippedLockIds().add(lockId);
                    continue;
                }
                BigInteger shares = RoundClock.lockTimeWeightedShares(context.getConstants(), roundEnd, lock);
                if (shares.signum() == 0 || lock.getLockEnd() < deploymentEnd) {
                    log.debug("锁仓投票权为 0 或锁定期不足, 跳过, lockId={}", lockId);
                    result.getSkippedLockIds().add(lockId);
                    continue;
                }
                Vote vote = new Vote(proposal.getProposalId(), tokenGroup.get(), DecimalUtil.of(shares));
                voteLedger.save(db, round, trancheId, lockId, vote);
                voteLedger.saveVotingAllowedRound(db, trancheId, lockId, round + proposal.getDeploymentDuration());
                result.getPowerChanges().add(proposal.getProposalId(), tokenGroup.get(), vote.getTimeWeightedShares());
                result.getVotedLockIds().add(lockId);
            }
        }
        return result;
    }

    @Override
    public void applyProposalChanges(LedgerContext context, long trancheId, ProposalPowerChanges changes) {
        if (changes.isEmpty()) {
            return;
        }
        proposalStore.applyProposalChanges(context.getDb(), context.getTokenManager(), context.getCurrentRound(),
                trancheId, changes);
    }

    @Override
    public void carryOverVotes(LedgerContext context, List<LockEntry> parents, List<LockEntry> children) {
        DataBase db = context.getDb();
        long round = context.getCurrentRound();
        List<Long> parentIds = new ArrayList<>();
        parents.forEach(parent -> parentIds.add(parent.getLockId()));

        for (Long trancheId : proposalStore.trancheIds(db)) {
            ProcessUnvotesResult unvotes = processUnvotes(context, trancheId, parentIds, Collections.emptyMap());
            Optional<Long> revoteProposal = commonProposal(parentIds, unvotes.getRemovedVotes());

            ProposalPowerChanges changes = new ProposalPowerChanges();
            changes.addAll(unvotes.getPowerChanges());
            if (revoteProposal.isPresent()) {
                ProcessVotesResult votes = processVotes(context, trancheId,
                        Collections.singletonMap(revoteProposal.get(), children));
                changes.addAll(votes.getPowerChanges());
            } else {
                blockChildren(db, round, trancheId, parentIds, children);
            }
            applyProposalChanges(context, trancheId, changes);
        }
    }

    @Override
    public Map<Long, Vote> userVotes(LedgerContext context, long roundId, long trancheId, String address) {
        Map<Long, Vote> result = new TreeMap<>();
        for (Long lockId : lockStore.userLockIds(context.getDb(), address)) {
            voteLedger.load(context.getDb(), roundId, trancheId, lockId).ifPresent(vote -> result.put(lockId, vote));
        }
        return result;
    }

    @Override
    public Optional<Long> votingAllowedRound(LedgerContext context, long trancheId, long lockId) {
        return voteLedger.votingAllowedRound(context.getDb(), trancheId, lockId);
    }

    /**
     * 所有父锁仓在当前轮都投给了同一个提案时返回该提案
     */
    private static Optional<Long> commonProposal(List<Long> parentIds, Map<Long, Vote> removedVotes) {
        Long proposalId = null;
        for (Long parentId : parentIds) {
            Vote vote = removedVotes.get(parentId);
            if (vote == null || vote.getTimeWeightedShares().signum() == 0) {
                return Optional.empty();
            }
            if (proposalId != null && proposalId != vote.getPropId()) {
                return Optional.empty();
            }
            proposalId = vote.getPropId();
        }
        return Optional.ofNullable(proposalId);
    }

    /**
     * 父锁仓在更早轮次的投票仍限制再次投票时，子锁仓继承最晚的禁投轮次，并在那一轮写入 0 份额占位投票
     */
    private void blockChildren(DataBase db, long round, long trancheId, List<Long> parentIds, List<LockEntry> children) {
        long blockedUntil = round;
        long blockingParent = -1;
        for (Long parentId : parentIds) {
            Optional<Long> allowed = voteLedger.votingAllowedRound(db, trancheId, parentId);
            if (allowed.isPresent() && allowed.get() > blockedUntil) {
                blockedUntil = allowed.get();
                blockingParent = parentId;
            }
        }
        if (blockingParent < 0) {
            return;
        }
        for (long voteRound = round - 1; voteRound >= 0; voteRound--) {
            Optional<Vote> vote = voteLedger.load(db, voteRound, trancheId, blockingParent);
            if (vote.isPresent()) {
                Vote placeholder = new Vote(vote.get().getPropId(), vote.get().getTokenGroupId(), DecimalUtil.ZERO);
                for (LockEntry child : children) {
                    voteLedger.save(db, voteRound, trancheId, child.getLockId(), placeholder);
                }
                break;
            }
        }
        for (LockEntry child : children) {
            voteLedger.saveVotingAllowedRound(db, trancheId, child.getLockId(), blockedUntil);
        }
        log.debug("子锁仓继承禁投轮次, tranche={}, 父锁仓={}, 禁投至={}", trancheId, blockingParent, blockedUntil);
    }
}
