package com.metagen.ai.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * AI 模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.metagen.ai")
@EnableConfigurationProperties(AiProperties.class)
public class AiModuleConfig {

    /**
     * 读写超时不在客户端上设置，每次调用通过 {@code call.timeout()} 单独限定。
     */
    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ZERO)
                .build();
    }
}
