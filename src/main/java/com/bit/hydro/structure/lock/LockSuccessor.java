package com.bit.hydro.structure.lock;

import com.bit.hydro.common.Fraction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 拆分/合并产生的后继锁仓，以及它继承的父锁仓价值份额
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LockSuccessor {
    private long lockId;
    private Fraction fraction;
}
