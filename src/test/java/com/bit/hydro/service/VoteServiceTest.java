package com.bit.hydro.service;

import com.bit.hydro.LedgerTestSupport;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.vote.ProposalToLockups;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.structure.vote.VoteResult;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class VoteServiceTest extends LedgerTestSupport {

    @BeforeEach
    void setUpRatio() {
        setRatio(VALIDATOR_1, "1");
    }

    @Test
    void voteMovesPowerBetweenProposals() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal first = createProposal("first", 1);
        Proposal second = createProposal("second", 1);

        VoteResult initial = vote(USER, first.getProposalId(), lock.getLockId());
        assertEquals(List.of(lock.getLockId()), initial.getVotedLockIds());
        assertEquals(BigInteger.valueOf(1500), proposalPower(0, first.getProposalId()));

        VoteResult switched = vote(USER, second.getProposalId(), lock.getLockId());
        assertEquals(List.of(lock.getLockId()), switched.getUnvotedLockIds());
        assertEquals(BigInteger.ZERO, proposalPower(0, first.getProposalId()));
        assertEquals(BigInteger.valueOf(1500), proposalPower(0, second.getProposalId()));

        // 已投给同一提案的锁仓保持原投票
        VoteResult repeated = vote(USER, second.getProposalId(), lock.getLockId());
        assertEquals(List.of(lock.getLockId()), repeated.getVotedLockIds());
        assertTrue(repeated.getUnvotedLockIds().isEmpty());
        assertEquals(BigInteger.valueOf(1500), proposalPower(0, second.getProposalId()));

        List<Long> unvoted = exec(USER, context -> voteService.unvote(context, TRANCHE_ID, List.of(lock.getLockId())));
        assertEquals(List.of(lock.getLockId()), unvoted);
        assertEquals(BigInteger.ZERO, proposalPower(0, second.getProposalId()));
        assertEquals(Optional.empty(),
                query(context -> voteService.votingAllowedRound(context, TRANCHE_ID, lock.getLockId())));
    }

    @Test
    void deploymentDurationBlocksNextRounds() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("long deployment", 2);
        vote(USER, proposal.getProposalId(), lock.getLockId());
        assertEquals(Optional.of(2L),
                query(context -> voteService.votingAllowedRound(context, TRANCHE_ID, lock.getLockId())));

        atRound(1);
        Proposal next = createProposal("next round", 1);
        HydroException e = assertHydroError(ErrorType.VALIDATION, () -> vote(USER, next.getProposalId(),
                lock.getLockId()));
        assertTrue(e.getDetail().contains("until round 2"));

        atRound(2);
        Proposal later = createProposal("round two", 1);
        assertEquals(List.of(lock.getLockId()), vote(USER, later.getProposalId(), lock.getLockId()).getVotedLockIds());
    }

    @Test
    void lockEndingBeforeDeploymentIsSkipped() {
        LockEntry shortLock = lock(USER, 1000, VALIDATOR_1_DENOM, 1);
        Proposal proposal = createProposal("long deployment", 2);

        VoteResult result = vote(USER, proposal.getProposalId(), shortLock.getLockId());
        assertEquals(List.of(shortLock.getLockId()), result.getSkippedLockIds());
        assertTrue(result.getVotedLockIds().isEmpty());
        assertEquals(BigInteger.ZERO, proposalPower(0, proposal.getProposalId()));
    }

    @Test
    void invalidVotesAreRejected() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal", 1);

        assertHydroError(ErrorType.UNAUTHORIZED, () -> vote(USER_2, proposal.getProposalId(), lock.getLockId()));
        assertHydroError(ErrorType.NOT_FOUND, () -> vote(USER, proposal.getProposalId(), 99L));
        assertHydroError(ErrorType.NOT_FOUND, () -> vote(USER, 99, lock.getLockId()));
        assertHydroError(ErrorType.VALIDATION, () -> vote(USER, proposal.getProposalId()));
        assertHydroError(ErrorType.VALIDATION, () -> vote(USER, proposal.getProposalId(), lock.getLockId(),
                lock.getLockId()));
        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context -> voteService.vote(context, TRANCHE_ID,
                List.of(new ProposalToLockups(proposal.getProposalId(), List.of(lock.getLockId())),
                        new ProposalToLockups(proposal.getProposalId(), List.of())))));
        assertHydroError(ErrorType.NOT_FOUND, () -> exec(USER, context -> voteService.vote(context, 5,
                List.of(new ProposalToLockups(proposal.getProposalId(), List.of(lock.getLockId()))))));
        assertEquals(BigInteger.ZERO, proposalPower(0, proposal.getProposalId()));
    }

    @Test
    void splitInLaterRoundInheritsVotingRestriction() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("long deployment", 2);
        vote(USER, proposal.getProposalId(), lock.getLockId());

        atRound(1);
        List<LockEntry> children = exec(USER, context ->
                lockService.splitLock(context, lock.getLockId(), BigInteger.valueOf(400)));

        Map<Long, Vote> roundZeroVotes = query(context -> voteService.userVotes(context, 0, TRANCHE_ID, USER));
        assertEquals(2, roundZeroVotes.size());
        for (LockEntry child : children) {
            Vote placeholder = roundZeroVotes.get(child.getLockId());
            assertEquals(proposal.getProposalId(), placeholder.getPropId());
            assertEquals(0, placeholder.getTimeWeightedShares().signum());
            assertEquals(Optional.of(2L),
                    query(context -> voteService.votingAllowedRound(context, TRANCHE_ID, child.getLockId())));
        }
        // 占位投票不计入提案投票权
        assertEquals(BigInteger.valueOf(1500), proposalPower(0, proposal.getProposalId()));
    }

    @Test
    void mergeRevotesOnlyWhenAllParentsAgree() {
        LockEntry first = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        LockEntry second = lock(USER, 2000, VALIDATOR_1_DENOM, 3);
        LockEntry third = lock(USER, 500, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal", 1);
        Proposal other = createProposal("other", 1);
        vote(USER, proposal.getProposalId(), first.getLockId(), second.getLockId());
        vote(USER, other.getProposalId(), third.getLockId());

        LockEntry merged = exec(USER, context ->
                lockService.mergeLocks(context, List.of(first.getLockId(), second.getLockId())));
        assertEquals(BigInteger.valueOf(4500), proposalPower(0, proposal.getProposalId()));
        assertEquals(proposal.getProposalId(), query(context ->
                voteService.userVotes(context, 0, TRANCHE_ID, USER)).get(merged.getLockId()).getPropId());

        LockEntry mixed = exec(USER, context ->
                lockService.mergeLocks(context, List.of(merged.getLockId(), third.getLockId())));
        assertEquals(BigInteger.ZERO, proposalPower(0, proposal.getProposalId()));
        assertEquals(BigInteger.ZERO, proposalPower(0, other.getProposalId()));
        assertFalse(query(context -> voteService.userVotes(context, 0, TRANCHE_ID, USER))
                .containsKey(mixed.getLockId()));
    }

    @Test
    void pausedLedgerRejectsVotes() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal", 1);
        exec(ADMIN, context -> {
            governanceService.pause(context);
            return null;
        });

        assertHydroError(ErrorType.PAUSED, () -> vote(USER, proposal.getProposalId(), lock.getLockId()));
        assertHydroError(ErrorType.PAUSED, () -> lock(USER, 1000, VALIDATOR_1_DENOM, 3));
    }
}
