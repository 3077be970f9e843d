package com.bit.hydro.structure.vote;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class VoteResult {
    private List<Long> votedLockIds = new ArrayList<>();
    /**
     * 币种无效、份额为 0 或锁定期不足以覆盖部署期的锁仓
     */
    private List<Long> skippedLockIds = new ArrayList<>();
    private List<Long> unvotedLockIds = new ArrayList<>();
}
