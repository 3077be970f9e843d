package com.bit.hydro.structure.lock;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Coin {
    private String denom;
    /**
     * u128
     */
    private BigInteger amount;

    public static Coin of(long amount, String denom) {
        return new Coin(denom, BigInteger.valueOf(amount));
    }

    @Override
    public String toString() {
        return amount + denom;
    }
}
