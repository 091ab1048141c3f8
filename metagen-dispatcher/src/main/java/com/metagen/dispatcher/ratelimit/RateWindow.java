package com.metagen.dispatcher.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 单个凭证的滑动窗口限流记录。
 * <p>
 * 维护窗口内的请求时间戳队列，通过清理过期记录并计数来判断是否超限。
 * 窗口为闭区间 [now - window, now]。
 * <p>
 * 非线程安全，由 {@code CredentialPool} 在其锁内访问。
 */
public class RateWindow {

    private final Deque<Instant> timestamps = new ArrayDeque<>();
    private final Duration window;
    private int capacity;

    /** 服务端报告配额耗尽后，在此时刻之前视为饱和 */
    private Instant saturatedUntil;

    public RateWindow(int capacity, Duration window) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity 必须 >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.window = window;
    }

    /**
     * 当前是否还能再发一个请求。调度器在派发前调用，是闸门而非事后检查。
     */
    public boolean hasCapacity(Instant now) {
        prune(now);
        if (isSaturated(now)) {
            return false;
        }
        return timestamps.size() < capacity;
    }

    /**
     * 记录一次请求，并清理窗口外的旧记录。
     */
    public void recordRequest(Instant now) {
        prune(now);
        timestamps.addLast(now);
    }

    /**
     * 服务端返回配额超限：立即视为饱和，直到窗口自然清空。
     */
    public void markExhausted(Instant now) {
        Instant until = now.plus(window);
        if (saturatedUntil == null || until.isAfter(saturatedUntil)) {
            saturatedUntil = until;
        }
    }

    /**
     * 下一个请求槽位空出的时刻，仅用于诊断和退避提示；有余量时返回 {@code now}。
     */
    public Instant nextAvailableAt(Instant now) {
        prune(now);
        Instant next = now;
        if (timestamps.size() >= capacity) {
            // 需要过期的是倒数第 capacity 条之前的那一条
            int skip = timestamps.size() - capacity;
            Iterator<Instant> it = timestamps.iterator();
            for (int i = 0; i < skip; i++) {
                it.next();
            }
            next = it.next().plus(window);
        }
        if (isSaturated(now) && saturatedUntil.isAfter(next)) {
            next = saturatedUntil;
        }
        return next;
    }

    /**
     * 窗口内的请求数。
     */
    public int countInWindow(Instant now) {
        prune(now);
        return timestamps.size();
    }

    /**
     * 窗口内剩余可用请求数；饱和期间为 0。
     */
    public int remainingQuota(Instant now) {
        prune(now);
        if (isSaturated(now)) {
            return 0;
        }
        return Math.max(0, capacity - timestamps.size());
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity 必须 >= 1: " + capacity);
        }
        this.capacity = capacity;
    }

    public Duration getWindow() {
        return window;
    }

    private boolean isSaturated(Instant now) {
        return saturatedUntil != null && now.isBefore(saturatedUntil);
    }

    private void prune(Instant now) {
        Instant windowStart = now.minus(window);
        while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(windowStart)) {
            timestamps.pollFirst();
        }
        if (saturatedUntil != null && !now.isBefore(saturatedUntil)) {
            saturatedUntil = null;
        }
    }
}
