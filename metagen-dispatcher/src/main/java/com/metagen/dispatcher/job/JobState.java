package com.metagen.dispatcher.job;

/**
 * 任务状态。
 */
public enum JobState {
    PENDING, IN_FLIGHT, SUCCEEDED, FAILED
}
