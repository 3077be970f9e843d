package com.bit.hydro.structure.slash;

import com.bit.hydro.structure.lock.LockEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlashedLockup {
    private long lockId;
    /**
     * 本次调用第一次罚没前的锁仓
     */
    private LockEntry lockBeforeSlash;
    private BigInteger slashedAmount;
}
