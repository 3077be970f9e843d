package com.bit.hydro.config;

import com.bit.hydro.database.DataBase;
import com.bit.hydro.database.memory.MemoryDb;
import com.bit.hydro.database.rocksDb.RocksDb;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DataBaseConfig {

    @Bean(destroyMethod = "closeDatabase")
    public DataBase dataBase(SystemConfig config) {
        log.info("系统数据路径:{}, 存储类型:{}", config.getPath(), config.getDbType());
        DataBase dataBase = "memory".equalsIgnoreCase(config.getDbType()) ? new MemoryDb() : new RocksDb();
        if (!dataBase.createDatabase(config)) {
            throw new HydroException(ErrorType.STORAGE, "数据库创建失败: " + config.getPath());
        }
        return dataBase;
    }
}
