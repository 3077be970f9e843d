package com.bit.hydro.structure.lock;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 锁仓记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LockEntry {
    /**
     * 锁仓ID，全局递增，拆分/合并总是产生新ID
     */
    private long lockId;

    /**
     * 所有者地址
     */
    private String owner;

    /**
     * 锁定的代币，slash 只减少 amount，不改 denom
     */
    private Coin funds;

    /**
     * 锁定开始时间（纳秒）
     */
    private long lockStart;

    /**
     * 锁定结束时间（纳秒）
     */
    private long lockEnd;

    public LockEntry copy() {
        return new LockEntry(lockId, owner, new Coin(funds.getDenom(), funds.getAmount()), lockStart, lockEnd);
    }
}
