package com.metagen.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "metagen.dispatcher")
public class DispatcherProperties {

    /** 单个任务因瞬时/配额类失败最多尝试的次数，认证失败换凭证重派不计入 */
    private int maxRetries = 3;

    /** 每个凭证在一个窗口内的最大请求数（不同服务商限额不同，按需配置） */
    private int perCredentialCapacityPerMinute = 12;

    /** 滑动窗口大小（秒） */
    private int rateWindowSeconds = 60;

    /** 无可用凭证时调度循环的等待间隔（毫秒） */
    private long schedulingTickMillis = 250;

    /** 单次生成调用的超时时间（秒） */
    private int generationTimeoutSeconds = 60;

    /** 单次凭证探测的超时时间（秒） */
    private int validationTimeoutSeconds = 15;

    /** 是否定时校验池中尚未校验的凭证 */
    private boolean validationSweepEnabled = true;

    /** 定时校验的间隔（秒） */
    private int validationSweepIntervalSeconds = 30;
}
