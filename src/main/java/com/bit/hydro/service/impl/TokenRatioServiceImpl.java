package com.bit.hydro.service.impl;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.ledger.LedgerContext;
import com.bit.hydro.service.TokenRatioService;
import com.bit.hydro.store.AccessStore;
import com.bit.hydro.store.ProposalStore;
import com.bit.hydro.store.RoundPowerAggregator;
import com.bit.hydro.store.TokenGroupRatioStore;
import com.bit.hydro.token.TokenInfoProvider;
import com.bit.hydro.token.TokenManager;
import com.bit.hydro.util.DecimalUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class TokenRatioServiceImpl implements TokenRatioService {

    @Autowired
    private AccessStore accessStore;

    @Autowired
    private TokenGroupRatioStore ratioStore;

    @Autowired
    private ProposalStore proposalStore;

    @Autowired
    private RoundPowerAggregator roundPowerAggregator;

    @Override
    public void updateTokenGroupRatio(LedgerContext context, String tokenGroupId, BigDecimal ratio) {
        DataBase db = context.getDb();
        accessStore.validateAdmin(db, context.sender());
        if (ratio == null) {
            throw HydroException.validation("Ratio must be provided");
        }
        BigDecimal newRatio = DecimalUtil.normalize(ratio);

        TokenManager tokenManager = context.getTokenManager();
        Optional<TokenInfoProvider.ProviderType> type = tokenManager.providerTypeFor(tokenGroupId);
        if (type.isEmpty()) {
            throw HydroException.validation("Token group " + tokenGroupId + " is not known to any token info provider");
        }
        if (type.get() == TokenInfoProvider.ProviderType.BASE) {
            throw HydroException.validation("Ratio of base token group " + tokenGroupId + " is always 1");
        }

        long round = context.getCurrentRound();
        BigDecimal oldRatio = tokenManager.getTokenGroupRatio(round, tokenGroupId);
        ratioStore.save(db, tokenGroupId, round, newRatio);
        tokenManager.evictTokenGroup(tokenGroupId);
        if (oldRatio.compareTo(newRatio) == 0) {
            return;
        }

        proposalStore.applyRatioChange(db, round, tokenGroupId, oldRatio, newRatio);
        roundPowerAggregator.applyRatioChange(db, round, context.height(), tokenGroupId, oldRatio, newRatio);
        log.info("代币组比率更新, round={}, tokenGroup={}, {} -> {}", round, tokenGroupId,
                oldRatio.stripTrailingZeros().toPlainString(), newRatio.stripTrailingZeros().toPlainString());
    }

    @Override
    public BigDecimal tokenGroupRatio(LedgerContext context, long roundId, String tokenGroupId) {
        return context.getTokenManager().getTokenGroupRatio(roundId, tokenGroupId);
    }

    @Override
    public Map<String, BigDecimal> allTokenGroupRatios(LedgerContext context, long roundId) {
        return ratioStore.allRatios(context.getDb(), roundId);
    }
}
