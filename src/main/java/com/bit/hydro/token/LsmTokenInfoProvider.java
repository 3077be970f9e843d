package com.bit.hydro.token;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.store.TokenGroupRatioStore;
import com.bit.hydro.util.DecimalUtil;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * LSM 份额代币，币种格式 {验证人地址}/{记录号}，代币组即验证人地址
 * 验证人在该轮有非零比率才允许锁仓
 */
public class LsmTokenInfoProvider implements TokenInfoProvider {

    private final String validatorPrefix;
    private final TokenGroupRatioStore ratioStore;

    public LsmTokenInfoProvider(String validatorPrefix, TokenGroupRatioStore ratioStore) {
        this.validatorPrefix = validatorPrefix;
        this.ratioStore = ratioStore;
    }

    @Override
    public ProviderType getType() {
        return ProviderType.LSM;
    }

    @Override
    public String resolveDenom(DataBase db, long roundId, String denom) {
        int slash = denom.indexOf('/');
        if (slash <= 0 || slash != denom.lastIndexOf('/') || slash == denom.length() - 1) {
            throw HydroException.validation("Invalid LSM denom " + denom);
        }
        String validator = denom.substring(0, slash);
        if (!ownsTokenGroup(validator)) {
            throw HydroException.validation("Invalid validator address prefix in denom " + denom);
        }
        if (!isNumeric(denom.substring(slash + 1))) {
            throw HydroException.validation("Invalid LSM record id in denom " + denom);
        }
        BigDecimal ratio = ratioStore.ratio(db, validator, roundId).orElse(DecimalUtil.ZERO);
        if (ratio.signum() == 0) {
            throw HydroException.validation("Validator " + validator + " is not present; possibly they are not part"
                    + " of the top N validators by delegated tokens");
        }
        return validator;
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
        return tokenGroupId.startsWith(validatorPrefix) && tokenGroupId.length() > validatorPrefix.length();
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
