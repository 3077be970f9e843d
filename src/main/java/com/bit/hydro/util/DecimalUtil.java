package com.bit.hydro.util;

import com.bit.hydro.exception.HydroException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * 定点小数与 u128 整数运算
 * 小数固定 18 位，乘除结果向零截断；整数与小数都不能超出 u128 范围，超出即算术错误
 */
public class DecimalUtil {

    public static final int SCALE = 18;
    public static final BigInteger MAX_UINT128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    // Decimal 内部是 u128 原子单位 / 10^18
    private static final BigDecimal MAX_DECIMAL = new BigDecimal(MAX_UINT128, SCALE);

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);

    public static BigDecimal of(BigInteger amount) {
        return checkDecimal(new BigDecimal(amount).setScale(SCALE));
    }

    public static BigDecimal of(String value) {
        return checkDecimal(new BigDecimal(value).setScale(SCALE, RoundingMode.DOWN));
    }

    public static BigDecimal percent(long percent) {
        return BigDecimal.valueOf(percent).movePointLeft(2).setScale(SCALE);
    }

    public static BigDecimal normalize(BigDecimal value) {
        return checkDecimal(value.setScale(SCALE, RoundingMode.DOWN));
    }

    public static BigDecimal fromRatio(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw HydroException.arithmetic("除数为零: " + numerator + " / 0");
        }
        return checkDecimal(new BigDecimal(numerator).divide(new BigDecimal(denominator), SCALE, RoundingMode.DOWN));
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return checkDecimal(a.add(b).setScale(SCALE, RoundingMode.DOWN));
    }

    public static BigDecimal sub(BigDecimal a, BigDecimal b) {
        BigDecimal result = a.subtract(b);
        if (result.signum() < 0) {
            throw HydroException.arithmetic("小数减法下溢: " + a + " - " + b);
        }
        return result.setScale(SCALE, RoundingMode.DOWN);
    }

    /**
     * 差值小于零时取零
     */
    public static BigDecimal saturatingSub(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) > 0 ? a.subtract(b).setScale(SCALE, RoundingMode.DOWN) : ZERO;
    }

    public static BigDecimal mul(BigDecimal a, BigDecimal b) {
        return checkDecimal(a.multiply(b).setScale(SCALE, RoundingMode.DOWN));
    }

    public static BigDecimal div(BigDecimal a, BigDecimal b) {
        if (b.signum() == 0) {
            throw HydroException.arithmetic("除数为零: " + a + " / 0");
        }
        return checkDecimal(a.divide(b, SCALE, RoundingMode.DOWN));
    }

    public static BigInteger floor(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
    }

    public static BigInteger ceil(BigDecimal value) {
        return checkAmount(value.setScale(0, RoundingMode.CEILING).toBigIntegerExact());
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    public static BigInteger addAmount(BigInteger a, BigInteger b) {
        return checkAmount(a.add(b));
    }

    public static BigInteger subAmount(BigInteger a, BigInteger b) {
        BigInteger result = a.subtract(b);
        if (result.signum() < 0) {
            throw HydroException.arithmetic("整数减法下溢: " + a + " - " + b);
        }
        return result;
    }

    public static BigInteger saturatingSubAmount(BigInteger a, BigInteger b) {
        return a.compareTo(b) > 0 ? a.subtract(b) : BigInteger.ZERO;
    }

    public static BigInteger checkAmount(BigInteger amount) {
        if (amount.signum() < 0 || amount.compareTo(MAX_UINT128) > 0) {
            throw HydroException.arithmetic("数量超出 u128 范围: " + amount);
        }
        return amount;
    }

    public static BigDecimal checkDecimal(BigDecimal value) {
        if (value.signum() < 0 || value.compareTo(MAX_DECIMAL) > 0) {
            throw HydroException.arithmetic("小数超出范围: " + value.toPlainString());
        }
        return value;
    }
}
