package com.bit.hydro.config;

import com.bit.hydro.structure.constants.Constants;
import com.bit.hydro.structure.constants.LockPowerEntry;
import com.bit.hydro.structure.constants.RoundLockPowerSchedule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 账本初始化参数与代币提供方配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "hydro")
public class HydroConfig {

    private long roundLength;
    private long lockEpochLength;
    private long firstRoundStart;
    private BigInteger maxLockedTokens = BigInteger.ZERO;
    private List<LockPowerEntry> roundLockPowerSchedule = new ArrayList<>();
    private BigDecimal slashPercentageThreshold = BigDecimal.ONE;
    private String slashTokensReceiverAddr;

    private List<String> whitelistAdmins = new ArrayList<>();
    private List<TrancheInfo> tranches = new ArrayList<>();

    /**
     * 锁仓拆分/合并祖先链的最大长度
     */
    private int lockDepthLimit = 50;

    /**
     * 初始化时的区块高度，早于它的快照读取报错
     */
    private long initHeight;

    private TokenProviders tokenProviders = new TokenProviders();

    public Constants initialConstants() {
        return Constants.builder()
                .roundLength(roundLength)
                .lockEpochLength(lockEpochLength)
                .firstRoundStart(firstRoundStart)
                .maxLockedTokens(maxLockedTokens)
                .roundLockPowerSchedule(new RoundLockPowerSchedule(roundLockPowerSchedule))
                .slashPercentageThreshold(slashPercentageThreshold)
                .slashTokensReceiverAddr(slashTokensReceiverAddr)
                .paused(false)
                .build();
    }

    @Data
    public static class TrancheInfo {
        private String name;
        private String metadata = "";
    }

    @Data
    public static class TokenProviders {
        /**
         * LSM 验证人地址前缀，为空时不启用 LSM
         */
        private String lsmValidatorPrefix;
        private List<DerivativeToken> derivatives = new ArrayList<>();
        private List<String> baseDenoms = new ArrayList<>();
    }

    @Data
    public static class DerivativeToken {
        private String denom;
        private String tokenGroup;
    }
}
