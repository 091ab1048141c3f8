package com.metagen.dispatcher.pool;

import com.metagen.common.util.SecretMasker;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * 借出的凭证：持有期间该凭证不会被分配给其他任务，
 * 必须通过 {@link CredentialPool#recordAttempt} 归还。
 */
@Getter
@RequiredArgsConstructor
public final class CredentialLease {

    private final String credentialId;
    private final String secret;
    private final String displayName;
    private final Instant acquiredAt;

    @Override
    public String toString() {
        return "CredentialLease{" + displayName + ", " + SecretMasker.mask(secret) + ", " + acquiredAt + "}";
    }
}
