package com.metagen.dispatcher.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateWindowTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration MINUTE = Duration.ofSeconds(60);

    @Test
    void blocksOnceCapacityIsReachedWithinWindow() {
        RateWindow window = new RateWindow(2, MINUTE);

        window.recordRequest(T0);
        window.recordRequest(T0.plusSeconds(10));

        assertThat(window.hasCapacity(T0.plusSeconds(20))).isFalse();
        assertThat(window.countInWindow(T0.plusSeconds(20))).isEqualTo(2);
        assertThat(window.remainingQuota(T0.plusSeconds(20))).isZero();
    }

    @Test
    void windowBoundaryIsInclusive() {
        RateWindow window = new RateWindow(1, MINUTE);
        window.recordRequest(T0);

        assertThat(window.hasCapacity(T0.plusSeconds(60))).isFalse();
        assertThat(window.hasCapacity(T0.plusSeconds(60).plusMillis(1))).isTrue();
    }

    @Test
    void nextAvailableAtPointsAtOldestBlockingRequest() {
        RateWindow window = new RateWindow(2, MINUTE);
        window.recordRequest(T0);
        window.recordRequest(T0.plusSeconds(30));

        assertThat(window.nextAvailableAt(T0.plusSeconds(40))).isEqualTo(T0.plusSeconds(60));

        Instant now = T0.plusSeconds(5);
        RateWindow fresh = new RateWindow(3, MINUTE);
        assertThat(fresh.nextAvailableAt(now)).isEqualTo(now);
    }

    @Test
    void markExhaustedSaturatesForAFullWindow() {
        RateWindow window = new RateWindow(5, MINUTE);
        window.recordRequest(T0);

        window.markExhausted(T0.plusSeconds(1));

        assertThat(window.hasCapacity(T0.plusSeconds(30))).isFalse();
        assertThat(window.remainingQuota(T0.plusSeconds(30))).isZero();
        assertThat(window.nextAvailableAt(T0.plusSeconds(30))).isEqualTo(T0.plusSeconds(61));
        assertThat(window.hasCapacity(T0.plusSeconds(61))).isTrue();
    }

    @Test
    void capacityCanBeChangedButMustStayPositive() {
        RateWindow window = new RateWindow(1, MINUTE);
        window.recordRequest(T0);
        assertThat(window.hasCapacity(T0.plusSeconds(1))).isFalse();

        window.setCapacity(2);

        assertThat(window.hasCapacity(T0.plusSeconds(1))).isTrue();
        assertThatThrownBy(() -> window.setCapacity(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateWindow(0, MINUTE)).isInstanceOf(IllegalArgumentException.class);
    }
}
