package com.metagen.common.dto;

/**
 * 凭证校验状态。
 * <p>
 * 合法迁移：UNVALIDATED → VALIDATING → {VALID, INVALID}；
 * VALID 仅在实际调用返回认证类错误时退化为 INVALID。
 */
public enum CredentialState {
    UNVALIDATED, VALIDATING, VALID, INVALID
}
