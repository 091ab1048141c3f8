package com.metagen.dispatcher.config;

import com.metagen.dispatcher.pool.CredentialPool;
import com.metagen.dispatcher.pool.CredentialPoolListener;
import com.metagen.dispatcher.pool.InMemoryCredentialPool;
import com.metagen.dispatcher.spi.CredentialProbe;
import com.metagen.dispatcher.validation.CredentialActivator;
import com.metagen.dispatcher.validation.CredentialValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 调度模块自动配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.metagen.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock dispatcherClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialPool credentialPool(DispatcherProperties properties, Clock clock,
                                         ObjectProvider<CredentialPoolListener> listeners) {
        log.info("使用内存凭证池, 单凭证容量 {}/{}s",
                properties.getPerCredentialCapacityPerMinute(), properties.getRateWindowSeconds());
        InMemoryCredentialPool pool = new InMemoryCredentialPool(properties.getPerCredentialCapacityPerMinute(),
                Duration.ofSeconds(properties.getRateWindowSeconds()), clock);
        listeners.orderedStream().forEach(pool::addListener);
        return pool;
    }

    @Bean
    public CredentialValidator credentialValidator(CredentialProbe credentialProbe, DispatcherProperties properties) {
        return new CredentialValidator(credentialProbe, Duration.ofSeconds(properties.getValidationTimeoutSeconds()));
    }

    @Bean
    public CredentialActivator credentialActivator(CredentialPool credentialPool, CredentialValidator validator,
                                                   Clock clock) {
        return new CredentialActivator(credentialPool, validator, clock);
    }
}
