package com.bit.hydro.service;

import com.bit.hydro.ledger.LedgerContext;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 代币组对基础代币的比率
 */
public interface TokenRatioService {

    /**
     * 记录当前轮的比率，并按新比率重算当前轮总投票权与提案投票权
     */
    void updateTokenGroupRatio(LedgerContext context, String tokenGroupId, BigDecimal ratio);

    BigDecimal tokenGroupRatio(LedgerContext context, long roundId, String tokenGroupId);

    Map<String, BigDecimal> allTokenGroupRatios(LedgerContext context, long roundId);
}
