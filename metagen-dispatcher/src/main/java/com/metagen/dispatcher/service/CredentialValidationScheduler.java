package com.metagen.dispatcher.service;

import com.metagen.dispatcher.validation.CredentialActivator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：校验池中尚未校验的凭证（如启动时从配置加载的），让它们在运行前就绪。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "metagen.dispatcher.validation-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class CredentialValidationScheduler {

    private final CredentialActivator credentialActivator;

    @Scheduled(fixedDelayString = "${metagen.dispatcher.validation-sweep-interval-seconds:30}000")
    public void validatePendingCredentials() {
        int started = credentialActivator.activatePending();
        if (started > 0) {
            log.info("发起 {} 个凭证的校验", started);
        }
    }
}
