package com.metagen;

import com.metagen.batch.BatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 批量元数据生成调度器 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.metagen")
@EnableScheduling
@EnableConfigurationProperties(BatchProperties.class)
public class MetagenApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetagenApplication.class, args);
    }
}
