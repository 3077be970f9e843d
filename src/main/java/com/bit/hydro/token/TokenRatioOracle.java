package com.bit.hydro.token;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 代币币种 -> 代币组 与 代币组 -> 基础代币比率 的查询接口
 */
public interface TokenRatioOracle {

    /**
     * 币种可锁仓时返回所属代币组，否则抛出校验异常
     */
    String validateDenom(long roundId, String denom);

    /**
     * 与 validateDenom 相同，无法解析时返回 empty
     */
    Optional<String> findTokenGroup(long roundId, String denom);

    /**
     * 未知代币组返回 0
     */
    BigDecimal getTokenGroupRatio(long roundId, String tokenGroupId);

    /**
     * validateDenom 失败时返回 0
     */
    BigDecimal getTokenDenomRatio(long roundId, String denom);
}
