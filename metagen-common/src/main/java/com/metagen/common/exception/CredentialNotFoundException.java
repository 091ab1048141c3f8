package com.metagen.common.exception;

/**
 * 按 ID 找不到凭证。
 */
public class CredentialNotFoundException extends MetagenException {

    public CredentialNotFoundException(String credentialId) {
        super("CREDENTIAL_NOT_FOUND", "凭证不存在: " + credentialId);
    }
}
