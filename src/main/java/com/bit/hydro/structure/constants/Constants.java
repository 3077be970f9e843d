package com.bit.hydro.structure.constants;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 按激活时间戳生效的配置，历史条目保留不变
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Constants {
    /**
     * 每轮时长（纳秒）
     */
    private long roundLength;
    /**
     * 锁仓周期（纳秒），锁定时长必须是倍数表中某个轮数乘以该值
     */
    private long lockEpochLength;
    /**
     * 第 0 轮开始时间（纳秒）
     */
    private long firstRoundStart;
    private BigInteger maxLockedTokens;
    private RoundLockPowerSchedule roundLockPowerSchedule;
    /**
     * 累计待罚没 / 当前数量 达到该比例时才真正扣减
     */
    private BigDecimal slashPercentageThreshold;
    private String slashTokensReceiverAddr;
    private boolean paused;
}
