package com.bit.hydro.token;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.store.TokenGroupRatioStore;
import com.bit.hydro.util.DecimalUtil;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 流动性质押衍生代币（stATOM、dATOM 等），币种 -> 代币组 由配置给出，比率由管理员按轮更新
 */
public class DerivativeTokenInfoProvider implements TokenInfoProvider {

    private final Map<String, String> denomToTokenGroup;
    private final Set<String> tokenGroups;
    private final TokenGroupRatioStore ratioStore;

    public DerivativeTokenInfoProvider(Map<String, String> denomToTokenGroup, TokenGroupRatioStore ratioStore) {
        this.denomToTokenGroup = Map.copyOf(denomToTokenGroup);
        this.tokenGroups = new HashSet<>(denomToTokenGroup.values());
        this.ratioStore = ratioStore;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.DERIVATIVE;
    }

    @Override
    public String resolveDenom(DataBase db, long roundId, String denom) {
        String tokenGroup = denomToTokenGroup.get(denom);
        if (tokenGroup == null) {
            throw HydroException.validation("Token with denom " + denom + " is not a known derivative token");
        }
        BigDecimal ratio = ratioStore.ratio(db, tokenGroup, roundId).orElse(DecimalUtil.ZERO);
        if (ratio.signum() == 0) {
            throw HydroException.validation("Token group " + tokenGroup + " has no ratio in round " + roundId);
        }
        return tokenGroup;
    }

    @Override
    public Optional<BigDecimal> getTokenGroupRatio(DataBase db, long roundId, String tokenGroupId) {
        if (!ownsTokenGroup(tokenGroupId)) {
            return Optional.empty();
        }
        return Optional.of(ratioStore.ratio(db, tokenGroupId, roundId).orElse(DecimalUtil.ZERO));
    }

    @Override
    public boolean ownsTokenGroup(String tokenGroupId) {
        return tokenGroups.contains(tokenGroupId);
    }
}
