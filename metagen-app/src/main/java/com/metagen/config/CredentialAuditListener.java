package com.metagen.config;

import com.metagen.common.dto.CredentialState;
import com.metagen.common.dto.CredentialStats;
import com.metagen.dispatcher.pool.CredentialPoolListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 记录凭证状态与用量变化，宿主可以在这里接入持久化。
 */
@Slf4j
@Component
public class CredentialAuditListener implements CredentialPoolListener {

    @Override
    public void onCredentialStateChanged(CredentialStats stats) {
        if (stats.getState() == CredentialState.INVALID) {
            log.warn("凭证 {} ({}) 不可用: {}", stats.getDisplayName(), stats.getMaskedSecret(), stats.getLastError());
        } else {
            log.debug("凭证 {} ({}) {}, 累计请求 {}", stats.getDisplayName(), stats.getMaskedSecret(),
                    stats.getState(), stats.getRequestCount());
        }
    }

    @Override
    public void onCredentialRemoved(String credentialId) {
        log.info("凭证 {} 已从调度池移除", credentialId);
    }
}
