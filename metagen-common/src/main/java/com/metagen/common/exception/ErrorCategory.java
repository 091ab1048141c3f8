package com.metagen.common.exception;

/**
 * 生成调用失败的分类，决定调度器如何恢复。
 */
public enum ErrorCategory {

    /** 网络抖动、超时：可重试，可复用任意凭证（包括同一个） */
    TRANSIENT,

    /** 服务端配额耗尽：凭证本地标记为饱和，任务重新排队 */
    QUOTA,

    /** 凭证被拒绝：本次运行内永久失效，任务转交其他凭证 */
    AUTHENTICATION,

    /** 输入本身被拒绝：任务直接失败，不重试 */
    PERMANENT
}
