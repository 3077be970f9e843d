package com.bit.hydro.service;

import com.bit.hydro.LedgerTestSupport;
import com.bit.hydro.common.Fraction;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.bank.BankSend;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.structure.lock.UnlockResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LockServiceTest extends LedgerTestSupport {

    @BeforeEach
    void setUpRatio() {
        setRatio(VALIDATOR_1, "1");
    }

    @Test
    void lockUpdatesRoundPowerForEveryLockedRound() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        assertEquals(0L, lock.getLockId());
        assertEquals(lock.getLockStart() + 3 * ROUND_LENGTH, lock.getLockEnd());

        assertEquals(BigInteger.valueOf(1500), roundTotalPower(0));
        assertEquals(BigInteger.valueOf(1250), roundTotalPower(1));
        assertEquals(BigInteger.valueOf(1000), roundTotalPower(2));
        assertEquals(BigInteger.ZERO, roundTotalPower(3));
        assertEquals(BigInteger.valueOf(1000), query(context -> lockService.totalLockedTokens(context)));
        assertEquals(BigInteger.valueOf(1500), query(context -> lockService.userVotingPower(context, USER)));

        // 总投票权按高度留存，锁仓前为 0
        long lockHeight = height();
        assertEquals(BigInteger.ZERO, query(context ->
                governanceService.roundTotalPowerAtHeight(context, 0, lockHeight)));
        assertEquals(BigInteger.valueOf(1500), query(context ->
                governanceService.roundTotalPowerAtHeight(context, 0, lockHeight + 1)));
    }

    @Test
    void ratioChangeRescalesPower() {
        lock(USER, 1000, VALIDATOR_1_DENOM, 3);
        setRatio(VALIDATOR_1, "2");

        assertEquals(BigInteger.valueOf(3000), roundTotalPower(0));
        assertEquals(BigInteger.valueOf(2500), roundTotalPower(1));
        assertEquals(BigInteger.valueOf(3000), query(context -> lockService.userVotingPower(context, USER)));
    }

    @Test
    void invalidLocksAreRejected() {
        assertHydroError(ErrorType.VALIDATION, () -> lock(USER, 0, VALIDATOR_1_DENOM, 3));
        assertHydroError(ErrorType.VALIDATION, () -> lock(USER, 1000, VALIDATOR_1_DENOM, 5));
        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.lockTokens(context, Coin.of(1000, VALIDATOR_1_DENOM), ROUND_LENGTH + 1)));
        assertHydroError(ErrorType.VALIDATION, () -> lock(USER, 1000, "ibc/unknown", 3));
        // 没有比率的验证人不能锁仓
        assertHydroError(ErrorType.VALIDATION, () -> lock(USER, 1000, VALIDATOR_2_DENOM, 3));

        HydroException e = assertHydroError(ErrorType.VALIDATION, () ->
                lock(USER, 1_000_000_000_001L, VALIDATOR_1_DENOM, 3));
        assertEquals("The limit for locking tokens has been reached. No more tokens can be locked.", e.getDetail());
        assertEquals(BigInteger.ZERO, query(context -> lockService.totalLockedTokens(context)));
    }

    @Test
    void splitCreatesTwoLocksWithLineage() {
        LockEntry lock = lock(USER, 1000, VALIDATOR_1_DENOM, 3);

        List<LockEntry> children = exec(USER, context ->
                lockService.splitLock(context, lock.getLockId(), BigInteger.valueOf(300)));
        assertEquals(BigInteger.valueOf(700), children.get(0).getFunds().getAmount());
        assertEquals(BigInteger.valueOf(300), children.get(1).getFunds().getAmount());
        assertEquals(lock.getLockEnd(), children.get(1).getLockEnd());
        assertTrue(loadLock(lock.getLockId()).isEmpty());

        List<LockComposition> composition = query(context ->
                lockService.currentLockComposition(context, lock.getLockId()));
        assertEquals(List.of(new LockComposition(1L, Fraction.of(7, 10)), new LockComposition(2L, Fraction.of(3, 10))),
                composition);
        assertEquals(List.of(1L, 2L), query(context -> lockService.userLocks(context, USER)).stream()
                .map(LockEntry::getLockId).toList());
        assertEquals(BigInteger.valueOf(1500), roundTotalPower(0));

        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.splitLock(context, 1L, BigInteger.valueOf(700))));
        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.splitLock(context, 1L, BigInteger.ZERO)));
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER_2, context ->
                lockService.splitLock(context, 1L, BigInteger.TEN)));
        assertHydroError(ErrorType.NOT_FOUND, () -> exec(USER, context ->
                lockService.splitLock(context, lock.getLockId(), BigInteger.TEN)));
    }

    @Test
    void mergeRequiresSameDenomAndOwner() {
        setRatio("stride", "1.3");
        LockEntry first = lock(USER, 1000, VALIDATOR_1_DENOM, 1);
        LockEntry second = lock(USER, 500, VALIDATOR_1_DENOM, 3);
        LockEntry derivative = lock(USER, 500, "statom", 3);
        LockEntry foreign = lock(USER_2, 500, VALIDATOR_1_DENOM, 3);

        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.mergeLocks(context, List.of(first.getLockId(), first.getLockId()))));
        assertHydroError(ErrorType.VALIDATION, () -> exec(USER, context ->
                lockService.mergeLocks(context, List.of(first.getLockId(), derivative.getLockId()))));
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context ->
                lockService.mergeLocks(context, List.of(first.getLockId(), foreign.getLockId()))));

        LockEntry merged = exec(USER, context ->
                lockService.mergeLocks(context, List.of(first.getLockId(), second.getLockId())));
        assertEquals(BigInteger.valueOf(1500), merged.getFunds().getAmount());
        assertEquals(second.getLockEnd(), merged.getLockEnd());
        assertEquals(List.of(new LockComposition(merged.getLockId(), Fraction.ONE)),
                query(context -> lockService.currentLockComposition(context, first.getLockId())));
    }

    @Test
    void unlockReturnsExpiredLocks() {
        LockEntry shortLock = lock(USER, 1000, VALIDATOR_1_DENOM, 1);
        LockEntry longLock = lock(USER, 500, VALIDATOR_1_DENOM, 3);
        LockEntry foreign = lock(USER_2, 200, VALIDATOR_1_DENOM, 1);

        assertTrue(exec(USER, context -> lockService.unlockTokens(context, null)).getUnlockedLockIds().isEmpty());

        atRound(2);
        assertHydroError(ErrorType.UNAUTHORIZED, () -> exec(USER, context ->
                lockService.unlockTokens(context, List.of(foreign.getLockId()))));

        UnlockResult result = exec(USER, context -> lockService.unlockTokens(context, List.of()));
        assertEquals(List.of(shortLock.getLockId()), result.getUnlockedLockIds());
        assertEquals(List.of(new BankSend(USER, List.of(Coin.of(1000, VALIDATOR_1_DENOM)))), result.getBankMessages());
        assertTrue(loadLock(shortLock.getLockId()).isEmpty());
        assertTrue(loadLock(longLock.getLockId()).isPresent());
        assertEquals(BigInteger.valueOf(700), query(context -> lockService.totalLockedTokens(context)));
    }
}
