package com.bit.hydro.structure.slash;

import com.bit.hydro.util.DecimalUtil;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 以被罚没锁仓当前币种计的数量，以及该币种在罚没轮的比率
 */
@Data
@AllArgsConstructor
public class AmountToSlash {

    public static final AmountToSlash NONE = new AmountToSlash(BigInteger.ZERO, DecimalUtil.ZERO);

    private BigInteger amount;
    private BigDecimal slashTokenRatio;

    public boolean isZero() {
        return amount.signum() == 0;
    }
}
