package com.metagen.common.util;

import java.util.UUID;

/**
 * 调度器内各类对象的 ID：凭证 "cred-"、任务 "job-"、运行 "run-"，后接 12 位十六进制随机串。
 */
public final class IdGenerator {

    public static final String CREDENTIAL_PREFIX = "cred-";
    public static final String JOB_PREFIX = "job-";
    public static final String RUN_PREFIX = "run-";

    private static final int RANDOM_LENGTH = 12;

    private IdGenerator() {
    }

    public static String credentialId() {
        return CREDENTIAL_PREFIX + randomPart();
    }

    public static String jobId() {
        return JOB_PREFIX + randomPart();
    }

    public static String runId() {
        return RUN_PREFIX + randomPart();
    }

    /**
     * 是否可能是本进程生成的凭证 ID，用于在查池之前拒绝明显无效的输入。
     */
    public static boolean isCredentialId(String id) {
        return id != null
                && id.length() == CREDENTIAL_PREFIX.length() + RANDOM_LENGTH
                && id.startsWith(CREDENTIAL_PREFIX);
    }

    private static String randomPart() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, RANDOM_LENGTH);
    }
}
