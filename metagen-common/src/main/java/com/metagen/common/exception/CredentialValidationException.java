package com.metagen.common.exception;

/**
 * 凭证首次探测失败，不会进入轮换。
 */
public class CredentialValidationException extends MetagenException {

    private final String credentialId;

    public CredentialValidationException(String credentialId, String message) {
        super("CREDENTIAL_INVALID", message);
        this.credentialId = credentialId;
    }

    public String getCredentialId() {
        return credentialId;
    }
}
