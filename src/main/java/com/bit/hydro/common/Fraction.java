package com.bit.hydro.common;

import com.bit.hydro.exception.HydroException;
import com.bit.hydro.util.DecimalUtil;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * 精确有理数 numerator / denominator，始终约分且分母为正
 * 锁仓拆分/合并链路上的份额用它连乘，避免 18 位截断在多级拆分后累积误差
 */
@Getter
@EqualsAndHashCode
public final class Fraction implements Comparable<Fraction> {

    public static final Fraction ZERO = new Fraction(BigInteger.ZERO, BigInteger.ONE);
    public static final Fraction ONE = new Fraction(BigInteger.ONE, BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    @JsonCreator
    public Fraction(@JsonProperty("numerator") BigInteger numerator,
                    @JsonProperty("denominator") BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw HydroException.arithmetic("分母为零");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Fraction of(BigInteger numerator, BigInteger denominator) {
        return new Fraction(numerator, denominator);
    }

    public static Fraction of(long numerator, long denominator) {
        return new Fraction(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public Fraction multiply(Fraction other) {
        return new Fraction(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Fraction add(Fraction other) {
        return new Fraction(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    /**
     * value * this，保留 18 位小数向零截断
     */
    public BigDecimal applyTo(BigDecimal value) {
        return DecimalUtil.checkDecimal(value.multiply(new BigDecimal(numerator))
                .divide(new BigDecimal(denominator), DecimalUtil.SCALE, RoundingMode.DOWN));
    }

    public BigDecimal toDecimal() {
        return applyTo(DecimalUtil.ONE);
    }

    @JsonIgnore
    public boolean isZero() {
        return numerator.signum() == 0;
    }

    @Override
    public int compareTo(Fraction other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
