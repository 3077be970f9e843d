package com.bit.hydro.service;

import com.bit.hydro.LedgerTestSupport;
import com.bit.hydro.common.Fraction;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.structure.bank.BankSend;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.proposal.Proposal;
import com.bit.hydro.structure.slash.SlashProposalVotersResult;
import com.bit.hydro.structure.slash.SlashedLockup;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SlashingServiceTest extends LedgerTestSupport {

    @Test
    void pendingSlashAccumulatesUntilThreshold() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), lock.getLockId());
        assertEquals(BigInteger.valueOf(1500), proposalPower(0, proposal.getProposalId()));

        SlashProposalVotersResult first = slash(0, proposal.getProposalId(), "0.11");
        assertEquals(List.of(lock.getLockId()), first.getPendingSlashesAdded());
        assertTrue(first.getSlashedLockups().isEmpty());
        assertTrue(first.getBankMessages().isEmpty());
        assertEquals(BigInteger.valueOf(110), pendingSlashStore.loadOrZero(dataBase, lock.getLockId()));
        assertEquals(BigInteger.valueOf(1000), lockAmount(lock.getLockId()));

        slash(0, proposal.getProposalId(), "0.375");
        assertEquals(BigInteger.valueOf(485), pendingSlashStore.loadOrZero(dataBase, lock.getLockId()));
        assertEquals(BigInteger.valueOf(1000), lockAmount(lock.getLockId()));

        SlashProposalVotersResult applied = slash(0, proposal.getProposalId(), "0.05");
        log.info("罚没结果: {}", applied);
        assertEquals(1, applied.getSlashedLockups().size());
        assertEquals(BigInteger.valueOf(535), applied.getSlashedLockups().get(0).getSlashedAmount());
        assertEquals(BigInteger.valueOf(1000),
                applied.getSlashedLockups().get(0).getLockBeforeSlash().getFunds().getAmount());
        assertEquals(BigInteger.valueOf(465), lockAmount(lock.getLockId()));
        assertFalse(pendingSlashStore.has(dataBase, lock.getLockId()));
        assertEquals(BigInteger.valueOf(535), applied.getTotalTokensSlashed());
        assertEquals(List.of(new BankSend(RECEIVER, List.of(Coin.of(535, VALIDATOR_1_DENOM)))),
                applied.getBankMessages());
        assertEquals(BigInteger.valueOf(465), query(context -> lockService.totalLockedTokens(context)));

        // 部分罚没后按剩余数量重新投给原提案
        assertEquals(BigInteger.valueOf(697), proposalPower(0, proposal.getProposalId()));
        assertEquals(BigInteger.valueOf(697), roundTotalPower(0));
        assertEquals(BigInteger.valueOf(581), roundTotalPower(1));
        assertEquals(BigInteger.valueOf(465), roundTotalPower(2));
        // 锁仓在第 3 轮之前到期，该轮总投票权不受罚没影响
        assertEquals(BigInteger.ZERO, roundTotalPower(3));
    }

    @Test
    void pendingSlashesFromDifferentProposalsAddUp() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal first = createProposal("proposal 0", 1);
        Proposal second = createProposal("proposal 1", 1);
        vote(USER, first.getProposalId(), lock.getLockId());
        assertEquals(BigInteger.ZERO, roundTotalPower(3));

        SlashProposalVotersResult pending = slash(0, first.getProposalId(), "0.3");
        assertEquals(List.of(lock.getLockId()), pending.getPendingSlashesAdded());
        assertEquals(BigInteger.valueOf(300), pendingSlashStore.loadOrZero(dataBase, lock.getLockId()));
        assertEquals(BigInteger.valueOf(1000), lockAmount(lock.getLockId()));

        vote(USER, second.getProposalId(), lock.getLockId());
        SlashProposalVotersResult applied = slash(0, second.getProposalId(), "0.3");
        assertEquals(1, applied.getSlashedLockups().size());
        assertEquals(BigInteger.valueOf(600), applied.getSlashedLockups().get(0).getSlashedAmount());
        assertEquals(BigInteger.valueOf(600), applied.getTotalTokensSlashed());
        assertEquals(BigInteger.valueOf(400), lockAmount(lock.getLockId()));
        assertFalse(pendingSlashStore.has(dataBase, lock.getLockId()));

        assertEquals(BigInteger.ZERO, proposalPower(0, first.getProposalId()));
        assertEquals(BigInteger.valueOf(600), proposalPower(0, second.getProposalId()));
        assertEquals(BigInteger.valueOf(600), roundTotalPower(0));
        assertEquals(BigInteger.valueOf(500), roundTotalPower(1));
        assertEquals(BigInteger.valueOf(400), roundTotalPower(2));
        assertEquals(BigInteger.ZERO, roundTotalPower(3));
    }

    @Test
    void pagedSlashChargesEachLockOnce() {
        setRatio(VALIDATOR_1, "1");
        LockEntry a = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        LockEntry b = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        LockEntry c = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), a.getLockId(), b.getLockId(), c.getLockId());
        assertEquals(BigInteger.valueOf(4500), proposalPower(0, proposal.getProposalId()));

        SlashProposalVotersResult firstPage = slash(0, proposal.getProposalId(), "0.6", 0, 2);
        assertEquals(List.of(a.getLockId(), b.getLockId()), slashedIds(firstPage));
        assertEquals(BigInteger.valueOf(1200), firstPage.getTotalTokensSlashed());
        assertEquals(BigInteger.valueOf(1000), lockAmount(c.getLockId()));

        SlashProposalVotersResult secondPage = slash(0, proposal.getProposalId(), "0.6", 2, 2);
        assertEquals(List.of(c.getLockId()), slashedIds(secondPage));
        assertEquals(BigInteger.valueOf(600), secondPage.getTotalTokensSlashed());

        for (LockEntry lock : List.of(a, b, c)) {
            assertEquals(BigInteger.valueOf(400), lockAmount(lock.getLockId()));
        }
        assertEquals(BigInteger.valueOf(1800), proposalPower(0, proposal.getProposalId()));
        assertEquals(BigInteger.valueOf(1800), roundTotalPower(0));

        // 超出投票数量的分页不再罚没
        SlashProposalVotersResult beyond = slash(0, proposal.getProposalId(), "0.6", 3, 2);
        assertTrue(beyond.getSlashedLockups().isEmpty());
        assertTrue(beyond.getPendingSlashesAdded().isEmpty());
        assertEquals(BigInteger.valueOf(400), lockAmount(a.getLockId()));
    }

    @Test
    void placeholderVotesFromLaterSplitAreNotCharged() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("long deployment", 2);
        vote(USER, proposal.getProposalId(), lock.getLockId());

        atRound(1);
        List<LockEntry> children = exec(USER, context ->
                lockService.splitLock(context, lock.getLockId(), BigInteger.valueOf(400)));
        long remainingId = children.get(0).getLockId();
        long splitId = children.get(1).getLockId();
        Map<Long, Vote> roundZeroVotes = query(context -> voteService.userVotes(context, 0, TRANCHE_ID, USER));
        assertEquals(0, roundZeroVotes.get(remainingId).getTimeWeightedShares().signum());
        assertEquals(0, roundZeroVotes.get(splitId).getTimeWeightedShares().signum());

        SlashProposalVotersResult result = slash(0, proposal.getProposalId(), "0.6");
        // 只经原锁仓的后继各罚一次，子锁仓自身的占位投票不参与
        assertEquals(List.of(remainingId, splitId), slashedIds(result));
        assertEquals(BigInteger.valueOf(360), result.getSlashedLockups().get(0).getSlashedAmount());
        assertEquals(BigInteger.valueOf(240), result.getSlashedLockups().get(1).getSlashedAmount());
        assertTrue(result.getSkippedLockups().isEmpty());
        assertTrue(result.getPendingSlashesAdded().isEmpty());
        assertEquals(BigInteger.valueOf(600), result.getTotalTokensSlashed());
        assertEquals(BigInteger.valueOf(240), lockAmount(remainingId));
        assertEquals(BigInteger.valueOf(160), lockAmount(splitId));
        assertEquals(BigInteger.valueOf(500), roundTotalPower(1));
        assertEquals(BigInteger.valueOf(400), roundTotalPower(2));
    }

    @Test
    void slashPercentAboveOneIsClampedToLockAmount() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), lock.getLockId());

        SlashProposalVotersResult result = slash(0, proposal.getProposalId(), "1.5");
        assertEquals(1, result.getSlashedLockups().size());
        assertEquals(BigInteger.valueOf(1000), result.getSlashedLockups().get(0).getSlashedAmount());
        assertEquals(List.of(new BankSend(RECEIVER, List.of(Coin.of(1000, VALIDATOR_1_DENOM)))),
                result.getBankMessages());
        assertTrue(loadLock(lock.getLockId()).isEmpty());
        assertEquals(BigInteger.ZERO, roundTotalPower(0));
    }

    @Test
    void slashFollowsSplitAndMergedLocks() {
        setRatio(VALIDATOR_1, "1");
        LockEntry voted = lock(USER, 90000, VALIDATOR_1_DENOM, 3);
        LockEntry idle = lock(USER, 10000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), voted.getLockId());

        List<LockEntry> firstSplit = exec(USER, context ->
                lockService.splitLock(context, voted.getLockId(), BigInteger.valueOf(30000)));
        assertEquals(2L, firstSplit.get(0).getLockId());
        assertEquals(3L, firstSplit.get(1).getLockId());
        assertEquals(BigInteger.valueOf(60000), firstSplit.get(0).getFunds().getAmount());
        // 父锁仓的投票转移到两个子锁仓，提案投票权不变
        assertEquals(BigInteger.valueOf(135000), proposalPower(0, proposal.getProposalId()));

        atRound(1);
        List<LockEntry> secondSplit = exec(USER, context ->
                lockService.splitLock(context, 2L, BigInteger.valueOf(30000)));
        LockEntry merged = exec(USER, context -> lockService.mergeLocks(context,
                List.of(idle.getLockId(), secondSplit.get(0).getLockId(), secondSplit.get(1).getLockId())));
        assertEquals(6L, merged.getLockId());
        assertEquals(BigInteger.valueOf(70000), merged.getFunds().getAmount());

        BigInteger slashable = query(context -> slashingService.slashableTokenNumForProposal(context, 0, TRANCHE_ID,
                proposal.getProposalId()));
        assertEquals(BigInteger.valueOf(90000), slashable);

        SlashProposalVotersResult result = slash(0, proposal.getProposalId(), "0.6");
        assertEquals(BigInteger.valueOf(12000), lockAmount(3));
        assertEquals(BigInteger.valueOf(34000), lockAmount(6));
        assertEquals(BigInteger.valueOf(54000), result.getTotalTokensSlashed());
        assertEquals(List.of(Coin.of(54000, VALIDATOR_1_DENOM)), result.getSlashedAmounts());
        assertTrue(result.getPendingSlashesAdded().isEmpty());
    }

    @Test
    void zeroRatioVotesAreSkipped() {
        setRatio(VALIDATOR_1, "1");
        setRatio(VALIDATOR_2, "1");
        LockEntry first = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        LockEntry second = lock(USER_2, 1000, VALIDATOR_2_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), first.getLockId());
        vote(USER_2, proposal.getProposalId(), second.getLockId());
        assertEquals(BigInteger.valueOf(3000), roundTotalPower(0));

        setRatio(VALIDATOR_2, "0");
        assertEquals(BigInteger.valueOf(1500), roundTotalPower(0));

        SlashProposalVotersResult result = slash(0, proposal.getProposalId(), "1");
        assertTrue(result.getSkippedLockups().contains(second.getLockId()));
        assertEquals(1, result.getSlashedLockups().size());
        assertTrue(loadLock(first.getLockId()).isEmpty());
        assertTrue(query(context -> lockService.userLocks(context, USER)).isEmpty());
        assertEquals(BigInteger.valueOf(1000), lockAmount(second.getLockId()));
        assertEquals(BigInteger.ZERO, proposalPower(0, proposal.getProposalId()));
        assertEquals(BigInteger.ZERO, roundTotalPower(0));
    }

    @Test
    void convertedLockIsSlashedInItsNewDenom() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), lock.getLockId());

        atRound(1);
        setRatio("drop", "1.17");
        exec(USER, context -> {
            LockEntry converted = lock.copy();
            converted.setFunds(Coin.of(854, "datom"));
            lockStore.save(context.getDb(), converted, context.height());
            return null;
        });

        BigInteger slashable = query(context -> slashingService.slashableTokenNumForProposal(context, 0, TRANCHE_ID,
                proposal.getProposalId()));
        assertEquals(BigInteger.valueOf(999), slashable);

        SlashProposalVotersResult result = slash(0, proposal.getProposalId(), "0.55");
        assertEquals(BigInteger.valueOf(384), lockAmount(lock.getLockId()));
        assertEquals("datom", loadLock(lock.getLockId()).orElseThrow().getFunds().getDenom());
        assertEquals(List.of(new BankSend(RECEIVER, List.of(Coin.of(470, "datom")))), result.getBankMessages());
        assertEquals(BigInteger.valueOf(549), result.getTotalTokensSlashed());
    }

    @Test
    void intoAmountToSlashUsesRatiosOnlyAcrossDenoms() {
        setRatio(VALIDATOR_1, "1");
        setRatio("stride", "1.3");
        LockEntry voted = lock(USER, 1000, VALIDATOR_1_DENOM, 1);
        LockEntry sameDenom = voted.copy();
        LockEntry otherDenom = voted.copy();
        otherDenom.setFunds(Coin.of(1000, "statom"));

        assertEquals(BigInteger.valueOf(250), query(context -> slashingService.intoAmountToSlash(context, voted,
                sameDenom, Fraction.of(1, 2), DecimalUtil.of("0.5"), 0)).getAmount());
        // floor(1000 × 0.5 × 1 / 1.3)
        assertEquals(BigInteger.valueOf(384), query(context -> slashingService.intoAmountToSlash(context, voted,
                otherDenom, Fraction.ONE, DecimalUtil.of("0.5"), 0)).getAmount());
        assertTrue(query(context -> slashingService.intoAmountToSlash(context, voted,
                withDenom(voted, "unknown"), Fraction.ONE, DecimalUtil.of("0.5"), 0)).isZero());
    }

    @Test
    void slashableQueryRejectsFutureRoundAndUnknownProposal() {
        createProposal("proposal 0", 1);
        assertHydroError(ErrorType.VALIDATION, () -> query(context ->
                slashingService.slashableTokenNumForProposal(context, 1, TRANCHE_ID, 0)));
        assertHydroError(ErrorType.NOT_FOUND, () -> query(context ->
                slashingService.slashableTokenNumForProposal(context, 0, TRANCHE_ID, 7)));
        assertEquals(BigInteger.ZERO, query(context ->
                slashingService.slashableTokenNumForProposal(context, 0, TRANCHE_ID, 0)));
    }

    @Test
    void onlyAdminCanSlash() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), lock.getLockId());

        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context -> slashingService.slashProposalVoters(
                context, 0, TRANCHE_ID, proposal.getProposalId(), DecimalUtil.of("1"), 0, 100)));
        assertHydroError(ErrorType.VALIDATION, () -> slash(0, proposal.getProposalId(), "0"));
        assertEquals(BigInteger.valueOf(1000), lockAmount(lock.getLockId()));
        assertFalse(pendingSlashStore.has(dataBase, lock.getLockId()));
    }

    @Test
    void lockWithPendingSlashCannotBeSplitOrUnlocked() {
        setRatio(VALIDATOR_1, "1");
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 1);
        Proposal proposal = createProposal("proposal 0", 1);
        vote(USER, proposal.getProposalId(), lock.getLockId());
        slash(0, proposal.getProposalId(), "0.1");

        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.splitLock(context, lock.getLockId(), BigInteger.valueOf(100))));

        atRound(2);
        assertTrue(exec(USER, context -> lockService.unlockTokens(context, List.of())).getUnlockedLockIds().isEmpty());
    }

    private static List<Long> slashedIds(SlashProposalVotersResult result) {
        return result.getSlashedLockups().stream().map(SlashedLockup::getLockId).collect(Collectors.toList());
    }

    private static LockEntry withDenom(LockEntry lock, String denom) {
        LockEntry copy = lock.copy();
        copy.setFunds(Coin.of(lock.getFunds().getAmount().longValue(), denom));
        return copy;
    }
}
