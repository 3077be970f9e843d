package com.bit.hydro.token;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.util.DecimalUtil;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 按顺序询问各提供方，第一个能解析的生效
 * 每次调用创建一个实例，(round, denom) 与 (round, tokenGroup) 的结果在调用内缓存
 */
@Slf4j
public class TokenManager implements TokenRatioOracle {

    private final DataBase db;
    private final List<TokenInfoProvider> providers;

    private final Table<Long, String, Resolution> denomCache = HashBasedTable.create();
    private final Table<Long, String, BigDecimal> ratioCache = HashBasedTable.create();

    public TokenManager(DataBase db, List<TokenInfoProvider> providers) {
        this.db = db;
        this.providers = providers;
    }

    @Override
    public String validateDenom(long roundId, String denom) {
        Resolution resolution = resolve(roundId, denom);
        if (resolution.error != null) {
            throw resolution.error;
        }
        return resolution.tokenGroup;
    }

    @Override
    public Optional<String> findTokenGroup(long roundId, String denom) {
        return Optional.ofNullable(resolve(roundId, denom).tokenGroup);
    }

    @Override
    public BigDecimal getTokenGroupRatio(long roundId, String tokenGroupId) {
        BigDecimal cached = ratioCache.get(roundId, tokenGroupId);
        if (cached != null) {
            return cached;
        }
        BigDecimal ratio = DecimalUtil.ZERO;
        for (TokenInfoProvider provider : providers) {
            Optional<BigDecimal> providerRatio = provider.getTokenGroupRatio(db, roundId, tokenGroupId);
            if (providerRatio.isPresent()) {
                ratio = providerRatio.get();
                break;
            }
        }
        ratioCache.put(roundId, tokenGroupId, ratio);
        return ratio;
    }

    @Override
    public BigDecimal getTokenDenomRatio(long roundId, String denom) {
        return findTokenGroup(roundId, denom)
                .map(group -> getTokenGroupRatio(roundId, group))
                .orElse(DecimalUtil.ZERO);
    }

    /**
     * 负责该代币组的提供方类型
     */
    public Optional<TokenInfoProvider.ProviderType> providerTypeFor(String tokenGroupId) {
        for (TokenInfoProvider provider : providers) {
            if (provider.ownsTokenGroup(tokenGroupId)) {
                return Optional.of(provider.getType());
            }
        }
        return Optional.empty();
    }

    /**
     * 比率更新后清掉该代币组的缓存
     */
    public void evictTokenGroup(String tokenGroupId) {
        ratioCache.column(tokenGroupId).clear();
        denomCache.clear();
    }

    private Resolution resolve(long roundId, String denom) {
        Resolution cached = denomCache.get(roundId, denom);
        if (cached != null) {
            return cached;
        }
        Resolution resolution = doResolve(roundId, denom);
        denomCache.put(roundId, denom, resolution);
        return resolution;
    }

    private Resolution doResolve(long roundId, String denom) {
        HydroException lastError = null;
        for (TokenInfoProvider provider : providers) {
            try {
                return new Resolution(provider.resolveDenom(db, roundId, denom), null);
            } catch (HydroException e) {
                log.debug("提供方 {} 无法解析币种 {}: {}", provider.getType(), denom, e.getMessage());
                lastError = e;
            }
        }
        if (providers.size() == 1 && lastError != null) {
            return new Resolution(null, lastError);
        }
        return new Resolution(null,
                HydroException.validation("Token with denom " + denom + " can not be locked in Hydro."));
    }

    private static final class Resolution {
        private final String tokenGroup;
        private final HydroException error;

        private Resolution(String tokenGroup, HydroException error) {
            this.tokenGroup = tokenGroup;
            this.error = error;
        }
    }
}
