package com.metagen.dispatcher.service;

/**
 * 报告中固定的失败原因文本。
 */
public final class FailureReasons {

    public static final String NO_VALID_CREDENTIAL = "no valid credential available";

    public static final String RUN_CANCELLED = "run cancelled";

    public static final String RETRIES_EXHAUSTED_PREFIX = "retries exhausted: ";

    public static final String RUN_ABORTED_PREFIX = "run aborted: ";

    private FailureReasons() {
    }
}
