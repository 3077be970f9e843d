package com.bit.hydro.service.impl;

import com.bit.hydro.common.Fraction;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.service.SlashingService;
import com.bit.hydro.service.VoteService;
import com.bit.hydro.store.AccessStore;
import com.bit.hydro.store.LockCompositionResolver;
import com.bit.hydro.store.LockStore;
import com.bit.hydro.store.MetadataStore;
import com.bit.hydro.store.PendingSlashStore;
import com.bit.hydro.store.ProposalStore;
import com.bit.hydro.store.RoundHeightTracker;
import com.bit.hydro.store.RoundPowerAggregator;
import com.bit.hydro.store.VoteLedger;
import com.bit.hydro.structure.bank.BankSend;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.power.LockPowerChange;
import com.bit.hydro.structure.power.ProposalPowerChanges;
import com.bit.hydro.structure.slash.AmountToSlash;
import com.bit.hydro.structure.slash.BuyoutResult;
import com.bit.hydro.structure.slash.SlashProposalVotersResult;
import com.bit.hydro.structure.slash.SlashedLockup;
import com.bit.hydro.structure.vote.ProcessUnvotesResult;
import com.bit.hydro.structure.vote.ProcessVotesResult;
import com.bit.hydro.structure.vote.Vote;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.*;

@Slf4j
@Service
public class SlashingServiceImpl implements SlashingService {

    @Autowired
    private AccessStore accessStore;

    @Autowired
    private ProposalStore proposalStore;

    @Autowired
    private VoteLedger voteLedger;

    @Autowired
    private LockStore lockStore;

    @Autowired
    private LockCompositionResolver compositionResolver;

    @Autowired
    private PendingSlashStore pendingSlashStore;

    @Autowired
    private RoundHeightTracker roundHeightTracker;

    @Autowired
    private RoundPowerAggregator roundPowerAggregator;

    @Autowired
    private MetadataStore metadataStore;

    @Autowired
    private VoteService voteService;

    @Override
    public SlashProposalVotersResult slashProposalVoters(LedgerContext context, long roundId, long trancheId,
                                                         long proposalId, BigDecimal slashPercent,
                                                         long startFrom, long limit) {
        DataBase db = context.getDb();
        accessStore.validateAdmin(db, context.sender());
        // 超过 1 的比例不报错，由罚没数量截断到锁仓数量
        if (slashPercent == null || slashPercent.signum() <= 0) {
            throw HydroException.validation("Slash percent must be greater than 0");
        }
        proposalStore.requireProposal(db, roundId, trancheId, proposalId);

        BigDecimal threshold = context.getConstants().getSlashPercentageThreshold();
        long snapshotHeight = roundHeightTracker.highestKnownHeightForRound(db, roundId) + 1;

        SlashProposalVotersResult result = new SlashProposalVotersResult();
        // 同一锁仓可能经多条路径被罚没多次，只保留第一次罚没前的状态
        Map<Long, SlashedLockup> slashed = new LinkedHashMap<>();
        Map<Long, LockEntry> afterSlash = new HashMap<>();
        Map<String, BigInteger> slashedByDenom = new TreeMap<>();
        BigInteger totalBaseTokens = BigInteger.ZERO;

        for (Map.Entry<Long, Vote> entry : voteLedger.range(db, roundId, trancheId, startFrom, limit).entrySet()) {
            long votedLockId = entry.getKey();
            Vote vote = entry.getValue();
            if (vote.getPropId() != proposalId || vote.getTimeWeightedShares().signum() == 0) {
                continue;
            }
            Optional<LockEntry> votedLock = lockStore.loadAtHeight(db, votedLockId, snapshotHeight);
            if (votedLock.isEmpty()) {
                log.warn("无法加载投票时的锁仓, 跳过, lockId={}, height={}", votedLockId, snapshotHeight);
                result.getSkippedLockups().add(votedLockId);
                continue;
            }

            for (LockComposition composition : compositionResolver.getCurrentLockComposition(db, votedLockId)) {
                long lockId = composition.getLockId();
                Optional<LockEntry> current = lockStore.load(db, lockId);
                if (current.isEmpty()) {
                    log.warn("锁仓已不存在, 跳过, 原锁仓={}, lockId={}", votedLockId, lockId);
                    result.getSkippedLockups().add(lockId);
                    continue;
                }
                LockEntry lock = current.get();
                AmountToSlash amount = intoAmountToSlash(context, votedLock.get(), lock, composition.getFraction(),
                        slashPercent, roundId);
                if (amount.isZero()) {
                    log.debug("罚没数量为 0, 跳过, lockId={}", lockId);
                    result.getSkippedLockups().add(lockId);
                    continue;
                }

                BigInteger lockAmount = lock.getFunds().getAmount();
                BigInteger toSlash = DecimalUtil.addAmount(pendingSlashStore.loadOrZero(db, lockId), amount.getAmount())
                        .min(lockAmount);
                if (DecimalUtil.fromRatio(toSlash, lockAmount).compareTo(threshold) < 0) {
                    pendingSlashStore.save(db, lockId, toSlash);
                    result.getPendingSlashesAdded().add(lockId);
                    log.debug("累计待罚没未达阈值, lockId={}, pending={}, amount={}", lockId, toSlash, lockAmount);
                    continue;
                }

                LockEntry before = lock.copy();
                BigInteger remaining = lockAmount.subtract(toSlash);
                if (remaining.signum() == 0) {
                    lockStore.remove(db, lockId, context.height());
                    for (Long tranche : proposalStore.trancheIds(db)) {
                        voteLedger.removeVotingAllowedRound(db, tranche, lockId);
                    }
                    afterSlash.put(lockId, null);
                } else {
                    lock.getFunds().setAmount(remaining);
                    lockStore.save(db, lock, context.height());
                    afterSlash.put(lockId, lock.copy());
                }
                pendingSlashStore.remove(db, lockId);

                slashed.merge(lockId, new SlashedLockup(lockId, before, toSlash), (existing, added) ->
                        new SlashedLockup(lockId, existing.getLockBeforeSlash(),
                                existing.getSlashedAmount().add(added.getSlashedAmount())));
                slashedByDenom.merge(lock.getFunds().getDenom(), toSlash, DecimalUtil::addAmount);
                totalBaseTokens = totalBaseTokens.add(
                        DecimalUtil.floor(DecimalUtil.mul(DecimalUtil.of(toSlash), amount.getSlashTokenRatio())));
            }
        }

        if (!slashed.isEmpty()) {
            updateCurrentRoundVotes(context, slashed, afterSlash);

            List<LockPowerChange> changes = new ArrayList<>();
            for (SlashedLockup lockup : slashed.values()) {
                changes.add(new LockPowerChange(lockup.getLockBeforeSlash(), afterSlash.get(lockup.getLockId())));
            }
            roundPowerAggregator.reconcile(db, context.getTokenManager(), context.getConstants(),
                    context.getCurrentRound(), context.height(), changes);

            BigInteger totalSlashed = slashedByDenom.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
            metadataStore.saveLockedTokens(db,
                    DecimalUtil.saturatingSubAmount(metadataStore.lockedTokens(db), totalSlashed));

            List<Coin> coins = new ArrayList<>();
            slashedByDenom.forEach((denom, value) -> coins.add(new Coin(denom, value)));
            result.setSlashedAmounts(coins);
            result.getBankMessages().add(new BankSend(context.getConstants().getSlashTokensReceiverAddr(), coins));
        }

        result.setSlashedLockups(new ArrayList<>(slashed.values()));
        result.setTotalTokensSlashed(totalBaseTokens);
        log.info("罚没完成, round={}, tranche={}, proposal={}, 比例={}, 罚没锁仓: {}, 新增待罚没: {}, 跳过: {}, 基础代币总量: {}",
                roundId, trancheId, proposalId, slashPercent.stripTrailingZeros().toPlainString(), slashed.keySet(),
                result.getPendingSlashesAdded(), result.getSkippedLockups(), totalBaseTokens);
        return result;
    }

    @Override
    public BigInteger slashableTokenNumForProposal(LedgerContext context, long roundId, long trancheId,
                                                   long proposalId) {
        DataBase db = context.getDb();
        if (roundId > context.getCurrentRound()) {
            throw HydroException.validation("cannot query slashable tokens number for the future round");
        }
        proposalStore.requireProposal(db, roundId, trancheId, proposalId);
        long snapshotHeight = roundHeightTracker.highestKnownHeightForRound(db, roundId) + 1;

        BigInteger total = BigInteger.ZERO;
        for (Map.Entry<Long, Vote> entry : voteLedger.all(db, roundId, trancheId).entrySet()) {
            Vote vote = entry.getValue();
            if (vote.getPropId() != proposalId || vote.getTimeWeightedShares().signum() == 0) {
                continue;
            }
            Optional<LockEntry> votedLock = lockStore.loadAtHeight(db, entry.getKey(), snapshotHeight);
            if (votedLock.isEmpty()) {
                continue;
            }
            for (LockComposition composition : compositionResolver.getCurrentLockComposition(db, entry.getKey())) {
                Optional<LockEntry> current = lockStore.load(db, composition.getLockId());
                if (current.isEmpty()) {
                    continue;
                }
                AmountToSlash amount = intoAmountToSlash(context, votedLock.get(), current.get(),
                        composition.getFraction(), BigDecimal.ONE, roundId);
                if (amount.isZero()) {
                    continue;
                }
                total = total.add(DecimalUtil.floor(
                        DecimalUtil.mul(DecimalUtil.of(amount.getAmount()), amount.getSlashTokenRatio())));
            }
        }
        return DecimalUtil.checkAmount(total);
    }

    @Override
    public BuyoutResult buyoutPendingSlash(LedgerContext context, long lockId, List<Coin> funds) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        LockEntry lock = lockStore.load(db, lockId)
                .orElseThrow(() -> HydroException.notFound("Lock with id " + lockId + " not found"));
        BigInteger pending = pendingSlashStore.load(db, lockId)
                .orElseThrow(() -> HydroException.notFound("No pending slash found for lock " + lockId));
        if (funds == null || funds.isEmpty()) {
            throw HydroException.validation("Must provide funds to buy out the pending slash");
        }

        long round = context.getCurrentRound();
        BigDecimal lockRatio = context.getTokenManager().getTokenDenomRatio(round, lock.getFunds().getDenom());
        if (lockRatio.signum() == 0) {
            throw HydroException.validation("Cannot determine the ratio of lock denom " + lock.getFunds().getDenom());
        }

        BigInteger remaining = pending;
        List<Coin> used = new ArrayList<>();
        List<Coin> refunds = new ArrayList<>();
        for (Coin coin : funds) {
            if (coin.getAmount() == null || coin.getAmount().signum() <= 0) {
                throw HydroException.validation("Buyout funds must be positive, got " + coin);
            }
            if (remaining.signum() == 0) {
                refunds.add(coin);
                continue;
            }
            BigDecimal coinRatio = context.getTokenManager().getTokenDenomRatio(round, coin.getDenom());
            if (coinRatio.signum() == 0) {
                throw HydroException.validation("Token with denom " + coin.getDenom()
                        + " can not be used to buy out the pending slash");
            }
            // 以锁仓币种计的价值
            BigInteger value = DecimalUtil.floor(DecimalUtil.div(
                    DecimalUtil.mul(DecimalUtil.of(coin.getAmount()), coinRatio), lockRatio));
            if (value.compareTo(remaining) <= 0) {
                remaining = remaining.subtract(value);
                used.add(coin);
                continue;
            }
            BigInteger needed = new BigDecimal(remaining).multiply(lockRatio)
                    .divide(coinRatio, 0, RoundingMode.CEILING).toBigIntegerExact().min(coin.getAmount());
            used.add(new Coin(coin.getDenom(), needed));
            BigInteger excess = coin.getAmount().subtract(needed);
            if (excess.signum() > 0) {
                refunds.add(new Coin(coin.getDenom(), excess));
            }
            remaining = BigInteger.ZERO;
        }

        if (remaining.signum() == 0) {
            pendingSlashStore.remove(db, lockId);
        } else {
            pendingSlashStore.save(db, lockId, remaining);
        }

        List<BankSend> messages = new ArrayList<>();
        if (!used.isEmpty()) {
            messages.add(new BankSend(context.getConstants().getSlashTokensReceiverAddr(), mergeCoins(used)));
        }
        if (!refunds.isEmpty()) {
            messages.add(new BankSend(context.sender(), mergeCoins(refunds)));
        }
        log.info("买断待罚没, lockId={}, sender={}, {} -> {}", lockId, context.sender(), pending, remaining);
        return new BuyoutResult(lockId, remaining, messages);
    }

    @Override
    public BigInteger pendingSlash(LedgerContext context, long lockId) {
        return pendingSlashStore.loadOrZero(context.getDb(), lockId);
    }

    @Override
    public AmountToSlash intoAmountToSlash(LedgerContext context, LockEntry votedLock, LockEntry lockToSlash,
                                           Fraction fraction, BigDecimal slashPercent, long votingRound) {
        BigDecimal voteTokenRatio = context.getTokenManager()
                .getTokenDenomRatio(votingRound, votedLock.getFunds().getDenom());
        // 投票后比率降为 0：投票没有贡献投票权，不罚没
        if (voteTokenRatio.signum() == 0) {
            return AmountToSlash.NONE;
        }
        // 取罚没轮的比率，被罚没锁仓的币种在投票轮可能还不能锁仓
        BigDecimal slashTokenRatio = context.getTokenManager()
                .getTokenDenomRatio(context.getCurrentRound(), lockToSlash.getFunds().getDenom());
        if (slashTokenRatio.signum() == 0) {
            return AmountToSlash.NONE;
        }

        BigDecimal votedAmount = DecimalUtil.mul(DecimalUtil.of(votedLock.getFunds().getAmount()), slashPercent);
        BigInteger amount;
        if (votedLock.getFunds().getDenom().equals(lockToSlash.getFunds().getDenom())) {
            // 同币种不折算比率，避免比率上涨后少罚
            amount = DecimalUtil.floor(fraction.applyTo(votedAmount));
        } else {
            BigDecimal baseTokens = fraction.applyTo(DecimalUtil.mul(votedAmount, voteTokenRatio));
            amount = DecimalUtil.floor(DecimalUtil.div(baseTokens, slashTokenRatio));
        }
        return new AmountToSlash(amount.min(lockToSlash.getFunds().getAmount()), slashTokenRatio);
    }

    /**
     * 所有 tranche 中撤销被罚没锁仓的当前轮投票，部分罚没的锁仓按罚没后的数量重新投给原提案
     */
    private void updateCurrentRoundVotes(LedgerContext context, Map<Long, SlashedLockup> slashed,
                                         Map<Long, LockEntry> afterSlash) {
        DataBase db = context.getDb();
        for (Long trancheId : proposalStore.trancheIds(db)) {
            ProcessUnvotesResult unvotes = voteService.processUnvotes(context, trancheId, slashed.keySet(),
                    Collections.emptyMap());

            Map<Long, List<LockEntry>> revotes = new TreeMap<>();
            unvotes.getRemovedVotes().forEach((lockId, vote) -> {
                LockEntry after = afterSlash.get(lockId);
                if (after != null && vote.getTimeWeightedShares().signum() > 0) {
                    revotes.computeIfAbsent(vote.getPropId(), id -> new ArrayList<>()).add(after);
                }
            });
            ProcessVotesResult votes = voteService.processVotes(context, trancheId, revotes);

            ProposalPowerChanges changes = new ProposalPowerChanges();
            changes.addAll(unvotes.getPowerChanges());
            changes.addAll(votes.getPowerChanges());
            voteService.applyProposalChanges(context, trancheId, changes);
        }

        slashed.values().forEach(lockup -> {
            if (afterSlash.get(lockup.getLockId()) == null) {
                lockStore.removeUserLock(db, lockup.getLockBeforeSlash().getOwner(), lockup.getLockId());
            }
        });
    }

    private static List<Coin> mergeCoins(List<Coin> coins) {
        Map<String, BigInteger> byDenom = new LinkedHashMap<>();
        coins.forEach(coin -> byDenom.merge(coin.getDenom(), coin.getAmount(), DecimalUtil::addAmount));
        List<Coin> result = new ArrayList<>();
        byDenom.forEach((denom, amount) -> result.add(new Coin(denom, amount)));
        return result;
    }
}
