package com.bit.hydro.token;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.util.DecimalUtil;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * 基础代币，代币组即币种本身，比率恒为 1
 */
public class BaseTokenInfoProvider implements TokenInfoProvider {

    private final Set<String> denoms;

    public BaseTokenInfoProvider(Set<String> denoms) {
        this.denoms = Set.copyOf(denoms);
    }

    @Override
    public ProviderType getType() {
        return ProviderType.BASE;
    }

    @Override
    public String resolveDenom(DataBase db, long roundId, String denom) {
        if (!denoms.contains(denom)) {
            throw HydroException.validation("Token with denom " + denom + " is not a base token");
        }
        return denom;
    }

    @Override
    public Optional<BigDecimal> getTokenGroupRatio(DataBase db, long roundId, String tokenGroupId) {
        return ownsTokenGroup(tokenGroupId) ? Optional.of(DecimalUtil.ONE) : Optional.empty();
    }

    @Override
    public boolean ownsTokenGroup(String tokenGroupId) {
        return denoms.contains(tokenGroupId);
    }
}
