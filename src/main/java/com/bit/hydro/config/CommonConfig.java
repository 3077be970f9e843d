package com.bit.hydro.config;

import com.bit.hydro.ledger.HydroLedger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 启动时写入初始配置、管理员与 tranche，数据库中已有数据时跳过
 */
@Slf4j
@Component
public class CommonConfig {

    @Autowired
    private HydroConfig hydroConfig;

    @Autowired
    private HydroLedger hydroLedger;

    @PostConstruct
    public void init() {
        if (!hydroLedger.initialize(hydroConfig)) {
            log.info("账本已初始化，沿用已有数据");
        }
    }
}
