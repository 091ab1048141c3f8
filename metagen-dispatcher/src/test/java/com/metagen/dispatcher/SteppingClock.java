package com.metagen.dispatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试时钟：每次读取时间前进固定步长，使 60 秒的限流窗口在毫秒级真实时间内走完。
 */
public class SteppingClock extends Clock {

    private final AtomicLong millis;
    private final long stepMillis;

    public SteppingClock(Instant start, Duration step) {
        this.millis = new AtomicLong(start.toEpochMilli());
        this.stepMillis = step.toMillis();
    }

    public static SteppingClock oneSecondPerRead() {
        return new SteppingClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofSeconds(1));
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis.getAndAdd(stepMillis));
    }

    /** 读取当前时间但不前进 */
    public Instant peek() {
        return Instant.ofEpochMilli(millis.get());
    }

    public void advance(Duration duration) {
        millis.addAndGet(duration.toMillis());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
