package com.bit.hydro.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {
    private String path;//保存路径
    private Integer maxSize;//最大内存占用大小 MB
    /**
     * rocksdb | memory
     */
    private String dbType = "rocksdb";
}
