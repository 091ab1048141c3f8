package com.metagen.common.dto;

/**
 * 一次批量运行的状态。
 */
public enum RunStatus {
    IDLE, RUNNING, DRAINED, CANCELLED
}
