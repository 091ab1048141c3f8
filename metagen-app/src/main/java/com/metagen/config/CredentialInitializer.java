package com.metagen.config;

import com.metagen.dispatcher.pool.CredentialPool;
import com.metagen.dispatcher.validation.CredentialActivator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 应用启动时，从配置加载凭证到凭证池并发起校验。
 * <p>
 * 配置方式（在 application.yml 中）：
 * metagen.credentials=key1,key2,key3
 * <p>
 * 或通过环境变量：METAGEN_CREDENTIALS=key1,key2,key3
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class CredentialInitializer implements CommandLineRunner {

    private final CredentialPool credentialPool;
    private final CredentialActivator credentialActivator;

    @Value("${metagen.credentials:}")
    private String credentialsConfig;

    @Override
    public void run(String... args) {
        if (credentialsConfig == null || credentialsConfig.isBlank()) {
            log.warn("==============================================");
            log.warn("  未配置任何凭证！");
            log.warn("  请在 application.yml 中设置:");
            log.warn("  metagen.credentials: key1,key2");
            log.warn("  或通过环境变量: METAGEN_CREDENTIALS");
            log.warn("==============================================");
            return;
        }

        List<String> secrets = Arrays.stream(credentialsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();

        if (secrets.isEmpty()) {
            log.warn("凭证配置为空");
            return;
        }

        secrets.forEach(secret -> credentialPool.add(secret, null));
        int validating = credentialActivator.activatePending();
        log.info("已加载 {} 个凭证到调度池，{} 个开始校验", secrets.size(), validating);
    }
}
