package com.metagen.common.util;

/**
 * 密钥脱敏工具，日志与快照中只出现脱敏后的值。
 */
public final class SecretMasker {

    private SecretMasker() {
    }

    /**
     * 保留首尾各 4 位，如 {@code AIza...x9Qk}；过短的值整体隐藏。
     */
    public static String mask(String secret) {
        if (secret == null || secret.length() < 12) {
            return "***";
        }
        return secret.substring(0, 4) + "..." + secret.substring(secret.length() - 4);
    }
}
