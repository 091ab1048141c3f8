package com.metagen.dispatcher.job;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 调用方提交的一个待处理文件。
 *
 * @param <P> 传给生成服务的载荷类型
 */
@Getter
@AllArgsConstructor(staticName = "of")
public class JobRequest<P> {

    /** 文件引用，用于进度展示和报告 */
    private final String fileReference;

    private final P payload;
}
