package com.bit.hydro.service.impl;

import com.bit.hydro.common.Fraction;
import com.bit.hydro.config.HydroConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.round.RoundClock;
import com.bit.hydro.service.LockService;
import com.bit.hydro.service.VoteService;
import com.bit.hydro.store.LockCompositionResolver;
import com.bit.hydro.store.LockStore;
import com.bit.hydro.store.MetadataStore;
import com.bit.hydro.store.PendingSlashStore;
import com.bit.hydro.store.RoundPowerAggregator;
import com.bit.hydro.structure.bank.BankSend;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.lock.LockSuccessor;
import com.bit.hydro.structure.lock.UnlockResult;
import com.bit.hydro.structure.power.LockPowerChange;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

@Slf4j
@Service
public class LockServiceImpl implements LockService {

    @Autowired
    private HydroConfig hydroConfig;

    @Autowired
    private LockStore lockStore;

    @Autowired
    private MetadataStore metadataStore;

    @Autowired
    private PendingSlashStore pendingSlashStore;

    @Autowired
    private LockCompositionResolver compositionResolver;

    @Autowired
    private RoundPowerAggregator roundPowerAggregator;

    @Autowired
    private VoteService voteService;

    @Override
    public LockEntry lockTokens(LedgerContext context, Coin funds, long lockDuration) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        Constants constants = context.getConstants();
        if (funds == null || funds.getAmount() == null || funds.getAmount().signum() <= 0) {
            throw HydroException.validation("Must provide a positive amount of tokens to lock");
        }
        DecimalUtil.checkAmount(funds.getAmount());
        validateLockDuration(constants, lockDuration);
        context.getTokenManager().validateDenom(context.getCurrentRound(), funds.getDenom());

        BigInteger lockedTokens = DecimalUtil.addAmount(metadataStore.lockedTokens(db), funds.getAmount());
        if (lockedTokens.compareTo(constants.getMaxLockedTokens()) > 0) {
            throw HydroException.validation(
                    "The limit for locking tokens has been reached. No more tokens can be locked.");
        }

        long lockEnd;
        try {
            lockEnd = Math.addExact(context.now(), lockDuration);
        } catch (ArithmeticException e) {
            throw HydroException.arithmetic("锁仓结束时间溢出: " + context.now() + " + " + lockDuration);
        }
        LockEntry lock = new LockEntry(metadataStore.nextLockId(db), context.sender(),
                new Coin(funds.getDenom(), funds.getAmount()), context.now(), lockEnd);
        lockStore.save(db, lock, context.height());
        lockStore.addUserLock(db, lock.getOwner(), lock.getLockId());
        metadataStore.saveLockedTokens(db, lockedTokens);

        roundPowerAggregator.reconcile(db, context.getTokenManager(), constants, context.getCurrentRound(),
                context.height(), List.of(LockPowerChange.created(lock)));
        log.info("锁仓创建, lockId={}, owner={}, funds={}, lockEnd={}", lock.getLockId(), lock.getOwner(),
                lock.getFunds(), lock.getLockEnd());
        return lock;
    }

    @Override
    public List<LockEntry> splitLock(LedgerContext context, long lockId, BigInteger amount) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        LockEntry parent = requireOwnedLock(context, lockId);
        if (amount == null || amount.signum() <= 0 || amount.compareTo(parent.getFunds().getAmount()) >= 0) {
            throw HydroException.validation("Split amount must be greater than zero and less than the lock amount "
                    + parent.getFunds().getAmount());
        }
        ensureNoPendingSlash(db, lockId);
        ensureDepth(compositionResolver.depth(db, lockId) + 1);

        BigInteger total = parent.getFunds().getAmount();
        BigInteger remaining = total.subtract(amount);
        String denom = parent.getFunds().getDenom();
        LockEntry first = new LockEntry(metadataStore.nextLockId(db), parent.getOwner(), new Coin(denom, remaining),
                parent.getLockStart(), parent.getLockEnd());
        LockEntry second = new LockEntry(metadataStore.nextLockId(db), parent.getOwner(), new Coin(denom, amount),
                parent.getLockStart(), parent.getLockEnd());
        List<LockEntry> children = List.of(first, second);

        lockStore.remove(db, lockId, context.height());
        lockStore.removeUserLock(db, parent.getOwner(), lockId);
        for (LockEntry child : children) {
            lockStore.save(db, child, context.height());
            lockStore.addUserLock(db, child.getOwner(), child.getLockId());
        }
        compositionResolver.recordSuccessors(db, lockId, List.of(
                new LockSuccessor(first.getLockId(), Fraction.of(remaining, total)),
                new LockSuccessor(second.getLockId(), Fraction.of(amount, total))));

        roundPowerAggregator.reconcile(db, context.getTokenManager(), context.getConstants(),
                context.getCurrentRound(), context.height(), List.of(LockPowerChange.removed(parent),
                        LockPowerChange.created(first), LockPowerChange.created(second)));
        voteService.carryOverVotes(context, List.of(parent), children);

        log.info("锁仓拆分, lockId={} -> [{}: {}, {}: {}]", lockId, first.getLockId(), remaining,
                second.getLockId(), amount);
        return children;
    }

    @Override
    public LockEntry mergeLocks(LedgerContext context, List<Long> lockIds) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        Set<Long> unique = new LinkedHashSet<>(lockIds == null ? Collections.emptyList() : lockIds);
        if (unique.size() < 2) {
            throw HydroException.validation("Must specify at least two distinct lock IDs to merge");
        }

        List<LockEntry> parents = new ArrayList<>();
        int depth = 0;
        for (Long lockId : unique) {
            LockEntry parent = requireOwnedLock(context, lockId);
            ensureNoPendingSlash(db, lockId);
            if (!parents.isEmpty() && !parents.get(0).getFunds().getDenom().equals(parent.getFunds().getDenom())) {
                throw HydroException.validation("Cannot merge lockups with different denoms: "
                        + parents.get(0).getFunds().getDenom() + " and " + parent.getFunds().getDenom());
            }
            depth = Math.max(depth, compositionResolver.depth(db, lockId));
            parents.add(parent);
        }
        ensureDepth(depth + 1);

        BigInteger sum = BigInteger.ZERO;
        long lockEnd = Long.MIN_VALUE;
        for (LockEntry parent : parents) {
            sum = DecimalUtil.addAmount(sum, parent.getFunds().getAmount());
            lockEnd = Math.max(lockEnd, parent.getLockEnd());
        }
        LockEntry child = new LockEntry(metadataStore.nextLockId(db), context.sender(),
                new Coin(parents.get(0).getFunds().getDenom(), sum), context.now(), lockEnd);

        List<LockPowerChange> changes = new ArrayList<>();
        for (LockEntry parent : parents) {
            lockStore.remove(db, parent.getLockId(), context.height());
            lockStore.removeUserLock(db, parent.getOwner(), parent.getLockId());
            compositionResolver.recordSuccessors(db, parent.getLockId(),
                    List.of(new LockSuccessor(child.getLockId(), Fraction.ONE)));
            changes.add(LockPowerChange.removed(parent));
        }
        lockStore.save(db, child, context.height());
        lockStore.addUserLock(db, child.getOwner(), child.getLockId());
        changes.add(LockPowerChange.created(child));

        roundPowerAggregator.reconcile(db, context.getTokenManager(), context.getConstants(),
                context.getCurrentRound(), context.height(), changes);
        voteService.carryOverVotes(context, parents, List.of(child));

        log.info("锁仓合并, {} -> {}, 数量: {}", unique, child.getLockId(), sum);
        return child;
    }

    @Override
    public UnlockResult unlockTokens(LedgerContext context, List<Long> lockIds) {
        context.ensureNotPaused();
        DataBase db = context.getDb();
        List<Long> candidates = lockIds == null || lockIds.isEmpty()
                ? lockStore.userLockIds(db, context.sender())
                : new ArrayList<>(new LinkedHashSet<>(lockIds));

        List<Long> unlocked = new ArrayList<>();
        Map<String, BigInteger> returned = new TreeMap<>();
        for (Long lockId : candidates) {
            Optional<LockEntry> found = lockStore.load(db, lockId);
            if (found.isEmpty()) {
                continue;
            }
            LockEntry lock = found.get();
            if (!lock.getOwner().equals(context.sender())) {
                throw HydroException.unauthorized("Lock " + lockId + " is not owned by " + context.sender());
            }
            if (lock.getLockEnd() > context.now() || pendingSlashStore.has(db, lockId)) {
                continue;
            }
            lockStore.remove(db, lockId, context.height());
            lockStore.removeUserLock(db, lock.getOwner(), lockId);
            returned.merge(lock.getFunds().getDenom(), lock.getFunds().getAmount(), DecimalUtil::addAmount);
            unlocked.add(lockId);
        }

        List<BankSend> messages = new ArrayList<>();
        if (!returned.isEmpty()) {
            BigInteger total = returned.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
            metadataStore.saveLockedTokens(db, DecimalUtil.saturatingSubAmount(metadataStore.lockedTokens(db), total));
            List<Coin> coins = new ArrayList<>();
            returned.forEach((denom, amount) -> coins.add(new Coin(denom, amount)));
            messages.add(new BankSend(context.sender(), coins));
            log.info("解锁完成, sender={}, lockIds={}, 返还: {}", context.sender(), unlocked, coins);
        }
        return new UnlockResult(unlocked, messages);
    }

    @Override
    public LockEntry lock(LedgerContext context, long lockId) {
        return lockStore.load(context.getDb(), lockId)
                .orElseThrow(() -> HydroException.notFound("Lock with id " + lockId + " not found"));
    }

    @Override
    public List<LockEntry> userLocks(LedgerContext context, String address) {
        return lockStore.userLocks(context.getDb(), address);
    }

    @Override
    public BigInteger totalLockedTokens(LedgerContext context) {
        return metadataStore.lockedTokens(context.getDb());
    }

    @Override
    public List<LockComposition> currentLockComposition(LedgerContext context, long lockId) {
        return compositionResolver.getCurrentLockComposition(context.getDb(), lockId);
    }

    @Override
    public BigInteger userVotingPower(LedgerContext context, String address) {
        long round = context.getCurrentRound();
        long roundEnd = RoundClock.computeRoundEnd(context.getConstants(), round);
        BigDecimal power = DecimalUtil.ZERO;
        for (LockEntry lock : lockStore.userLocks(context.getDb(), address)) {
            BigInteger shares = RoundClock.lockTimeWeightedShares(context.getConstants(), roundEnd, lock);
            if (shares.signum() == 0) {
                continue;
            }
            BigDecimal ratio = context.getTokenManager().getTokenDenomRatio(round, lock.getFunds().getDenom());
            power = DecimalUtil.add(power, DecimalUtil.mul(DecimalUtil.of(shares), ratio));
        }
        return DecimalUtil.floor(power);
    }

    private LockEntry requireOwnedLock(LedgerContext context, long lockId) {
        LockEntry lock = lockStore.load(context.getDb(), lockId)
                .orElseThrow(() -> HydroException.notFound("Lock with id " + lockId + " not found"));
        if (!lock.getOwner().equals(context.sender())) {
            throw HydroException.unauthorized("Lock " + lockId + " is not owned by " + context.sender());
        }
        return lock;
    }

    private void ensureNoPendingSlash(DataBase db, long lockId) {
        if (pendingSlashStore.has(db, lockId)) {
            throw HydroException.validation("Lock " + lockId + " has a pending slash and can not be changed");
        }
    }

    private void ensureDepth(int depth) {
        if (depth > hydroConfig.getLockDepthLimit()) {
            throw HydroException.validation("Lock depth limit " + hydroConfig.getLockDepthLimit() + " exceeded");
        }
    }

    private static void validateLockDuration(Constants constants, long lockDuration) {
        long epoch = constants.getLockEpochLength();
        if (lockDuration <= 0 || lockDuration % epoch != 0
                || !constants.getRoundLockPowerSchedule().allowsLockedRounds(lockDuration / epoch)) {
            throw HydroException.validation("Lock duration must be one of: "
                    + constants.getRoundLockPowerSchedule().getEntries().stream()
                    .map(entry -> entry.getLockedRounds() * epoch).toList()
                    + "; but was: " + lockDuration);
        }
    }
}
