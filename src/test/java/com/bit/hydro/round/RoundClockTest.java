package com.bit.hydro.round;

import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.constants.LockPowerEntry;
import com.bit.hydro.structure.constants.RoundLockPowerSchedule;
import com.bit.hydro.structure.lock.Coin;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.util.DecimalUtil;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoundClockTest {

    private static final long ROUND = 1000;
    private static final long START = 5000;

    private final Constants constants = Constants.builder()
            .roundLength(ROUND)
            .lockEpochLength(ROUND)
            .firstRoundStart(START)
            .roundLockPowerSchedule(new RoundLockPowerSchedule(List.of(
                    new LockPowerEntry(3, DecimalUtil.of("1.5")),
                    new LockPowerEntry(1, DecimalUtil.of("1")),
                    new LockPowerEntry(2, DecimalUtil.of("1.25")))))
            .build();

    @Test
    void roundIdAndEnd() {
        assertEquals(0, RoundClock.computeRoundId(constants, START));
        assertEquals(0, RoundClock.computeRoundId(constants, START + ROUND - 1));
        assertEquals(1, RoundClock.computeRoundId(constants, START + ROUND));
        assertEquals(START + ROUND, RoundClock.computeRoundEnd(constants, 0));
        assertEquals(START + 3 * ROUND, RoundClock.computeRoundEnd(constants, 2));
        assertThrows(HydroException.class, () -> RoundClock.computeRoundId(constants, START - 1));
    }

    @Test
    void powerFactorDependsOnRemainingLockTime() {
        BigInteger amount = BigInteger.valueOf(1001);
        assertEquals(BigInteger.valueOf(1001), RoundClock.scaleLockupPower(constants, ROUND, amount));
        assertEquals(BigInteger.valueOf(1251), RoundClock.scaleLockupPower(constants, ROUND + 1, amount));
        assertEquals(BigInteger.valueOf(1501), RoundClock.scaleLockupPower(constants, 3 * ROUND, amount));
        // 超过倍数表最大轮数时取最后一项
        assertEquals(BigInteger.valueOf(1501), RoundClock.scaleLockupPower(constants, 10 * ROUND, amount));
    }

    @Test
    void expiredLockHasNoShares() {
        LockEntry lock = new LockEntry(0, "owner", Coin.of(100, "uatom"), START, START + 2 * ROUND);
        assertEquals(BigInteger.valueOf(125), RoundClock.lockTimeWeightedShares(constants, START, lock));
        assertEquals(BigInteger.valueOf(100), RoundClock.lockTimeWeightedShares(constants,
                RoundClock.computeRoundEnd(constants, 1), lock));
        assertEquals(BigInteger.ZERO, RoundClock.lockTimeWeightedShares(constants,
                RoundClock.computeRoundEnd(constants, 2), lock));
    }
}
