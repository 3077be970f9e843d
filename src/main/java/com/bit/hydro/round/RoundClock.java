package com.bit.hydro.round;

import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.lock.LockEntry;
import com.bit.hydro.util.DecimalUtil;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 轮次与锁仓投票权换算，所有时间都是纳秒
 */
public final class RoundClock {

    private RoundClock() {
    }

    public static long computeRoundId(Constants constants, long timestamp) {
        if (timestamp < constants.getFirstRoundStart()) {
            throw HydroException.validation("Timestamp " + timestamp + " is before the start of the first round "
                    + constants.getFirstRoundStart());
        }
        return (timestamp - constants.getFirstRoundStart()) / constants.getRoundLength();
    }

    public static long computeRoundEnd(Constants constants, long roundId) {
        try {
            return Math.addExact(constants.getFirstRoundStart(),
                    Math.multiplyExact(constants.getRoundLength(), Math.addExact(roundId, 1)));
        } catch (ArithmeticException e) {
            throw new HydroException(ErrorType.ARITHMETIC, "轮次结束时间溢出, round=" + roundId, e);
        }
    }

    /**
     * floor(倍数 × amount)
     */
    public static BigInteger scaleLockupPower(Constants constants, long lockupTime, BigInteger amount) {
        BigDecimal factor = constants.getRoundLockPowerSchedule().factorFor(constants.getLockEpochLength(), lockupTime);
        return DecimalUtil.floor(DecimalUtil.mul(DecimalUtil.of(amount), factor));
    }

    /**
     * 锁仓在某轮结束时的时间加权份额，已到期为 0
     */
    public static BigInteger lockTimeWeightedShares(Constants constants, long roundEnd, LockEntry lock) {
        if (lock.getLockEnd() < roundEnd) {
            return BigInteger.ZERO;
        }
        return scaleLockupPower(constants, lock.getLockEnd() - roundEnd, lock.getFunds().getAmount());
    }
}
