package com.bit.hydro.structure.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * (round, tranche, lockId) -> Vote
 * shares 为 0 的投票是拆分/合并时写入的占位记录，不代表真实投票权
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Vote {
    private long propId;
    private String tokenGroupId;
    private BigDecimal timeWeightedShares;
}
