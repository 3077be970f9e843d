package com.bit.hydro.token;

import com.bit.hydro.config.HydroConfig;
import com.bit.hydro.database.DataBase;
import com.bit.hydro.store.TokenGroupRatioStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 按配置组装提供方列表，顺序固定为 LSM、衍生品、基础代币
 */
@Slf4j
@Component
public class TokenManagerFactory {

    @Autowired
    private HydroConfig hydroConfig;

    @Autowired
    private TokenGroupRatioStore ratioStore;

    private List<TokenInfoProvider> providers = Collections.emptyList();

    @PostConstruct
    public void init() {
        HydroConfig.TokenProviders config = hydroConfig.getTokenProviders();
        List<TokenInfoProvider> result = new ArrayList<>();
        if (config.getLsmValidatorPrefix() != null && !config.getLsmValidatorPrefix().isEmpty()) {
            result.add(new LsmTokenInfoProvider(config.getLsmValidatorPrefix(), ratioStore));
        }
        if (!config.getDerivatives().isEmpty()) {
            Map<String, String> denoms = new LinkedHashMap<>();
            for (HydroConfig.DerivativeToken token : config.getDerivatives()) {
                denoms.put(token.getDenom(), token.getTokenGroup());
            }
            result.add(new DerivativeTokenInfoProvider(denoms, ratioStore));
        }
        if (!config.getBaseDenoms().isEmpty()) {
            result.add(new BaseTokenInfoProvider(new LinkedHashSet<>(config.getBaseDenoms())));
        }
        providers = Collections.unmodifiableList(result);
        log.info("代币提供方初始化完成: {}", providers.stream().map(TokenInfoProvider::getType).toList());
    }

    public TokenManager create(DataBase db) {
        return new TokenManager(db, providers);
    }
}
