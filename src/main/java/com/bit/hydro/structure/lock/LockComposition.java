package com.bit.hydro.structure.lock;

import com.bit.hydro.common.Fraction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 原始锁仓当前落在哪个锁仓上，占原始价值的份额
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LockComposition {
    private long lockId;
    private Fraction fraction;
}
