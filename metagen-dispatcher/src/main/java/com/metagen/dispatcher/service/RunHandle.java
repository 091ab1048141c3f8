package com.metagen.dispatcher.service;

import com.metagen.common.dto.RunProgress;
import com.metagen.common.dto.RunReport;
import com.metagen.common.dto.RunStatus;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * 正在进行的批量运行的句柄：订阅进度、请求停止、获取最终报告。
 */
public class RunHandle<R> {

    private final DispatchRun<?, R> run;

    RunHandle(DispatchRun<?, R> run) {
        this.run = run;
    }

    public String getRunId() {
        return run.getRunId();
    }

    /**
     * 实时进度流，completed 单调不减；运行结束时流完成。
     */
    public Flux<RunProgress> progress() {
        return run.getAggregator().progress();
    }

    public RunProgress currentProgress() {
        return run.getAggregator().currentProgress();
    }

    /**
     * 请求停止。已发出的调用会继续完成并计入报告，未派发的任务以 "run cancelled" 失败。
     */
    public void stop() {
        run.requestStop();
    }

    public boolean isStopRequested() {
        return run.isStopRequested();
    }

    public RunStatus status() {
        return run.getStatus();
    }

    /** 运行结束时完成的最终报告 */
    public CompletableFuture<RunReport<R>> result() {
        return run.getResult();
    }
}
