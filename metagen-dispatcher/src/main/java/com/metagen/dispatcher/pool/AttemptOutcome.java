package com.metagen.dispatcher.pool;

import com.metagen.common.exception.ErrorCategory;

/**
 * 一次生成调用对凭证的影响。
 */
public enum AttemptOutcome {

    SUCCEEDED,

    /** 网络类失败，凭证不受影响 */
    TRANSIENT_FAILURE,

    /** 服务端配额超限，凭证本地标记饱和 */
    QUOTA_EXCEEDED,

    /** 认证失败，凭证转为 INVALID */
    AUTHENTICATION_FAILED,

    /** 输入被拒绝，错在任务而非凭证 */
    JOB_REJECTED;

    public static AttemptOutcome of(ErrorCategory category) {
        return switch (category) {
            case TRANSIENT -> TRANSIENT_FAILURE;
            case QUOTA -> QUOTA_EXCEEDED;
            case AUTHENTICATION -> AUTHENTICATION_FAILED;
            case PERMANENT -> JOB_REJECTED;
        };
    }
}
