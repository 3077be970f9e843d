package com.bit.hydro.structure.proposal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Proposal {
    private long roundId;
    private long trancheId;
    private long proposalId;
    private String title;
    private String description;
    /**
     * 部署持续轮数，投票后在 round + deploymentDuration 之前不能再用同一锁仓投票
     */
    private long deploymentDuration;
    /**
     * u128，等于 ceil(Σ 代币组份额 × 比率)
     */
    private BigInteger power;
}
