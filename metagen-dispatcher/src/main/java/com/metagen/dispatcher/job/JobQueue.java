package com.metagen.dispatcher.job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * 待派发任务的 FIFO 队列。重试的任务排到队尾，避免饿死其他任务。
 * <p>
 * 非线程安全，只由调度线程访问。
 */
public class JobQueue<P, R> {

    private final Deque<GenerationJob<P, R>> pending = new ArrayDeque<>();

    public JobQueue(Collection<GenerationJob<P, R>> jobs) {
        for (GenerationJob<P, R> job : jobs) {
            enqueue(job);
        }
    }

    public void enqueue(GenerationJob<P, R> job) {
        if (job.getState() != JobState.PENDING) {
            throw new IllegalStateException("只有 PENDING 任务可以入队: " + job.getId() + " " + job.getState());
        }
        pending.addLast(job);
    }

    /** 取出队首任务，队列为空时返回 null */
    public GenerationJob<P, R> poll() {
        return pending.pollFirst();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /** 清空队列并返回剩余任务（按原顺序） */
    public List<GenerationJob<P, R>> drain() {
        List<GenerationJob<P, R>> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }
}
