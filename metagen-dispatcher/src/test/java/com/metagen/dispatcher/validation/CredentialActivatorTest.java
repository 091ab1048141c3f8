package com.metagen.dispatcher.validation;

import com.metagen.common.dto.CredentialState;
import com.metagen.common.dto.CredentialStats;
import com.metagen.common.exception.CredentialNotFoundException;
import com.metagen.dispatcher.SteppingClock;
import com.metagen.dispatcher.pool.InMemoryCredentialPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialActivatorTest {

    private final AtomicInteger probeCalls = new AtomicInteger();
    private CompletableFuture<ValidationResult> pendingProbe;
    private InMemoryCredentialPool pool;
    private CredentialActivator activator;

    @BeforeEach
    void setUp() {
        SteppingClock clock = SteppingClock.oneSecondPerRead();
        pool = new InMemoryCredentialPool(5, Duration.ofSeconds(60), clock);
        pendingProbe = new CompletableFuture<>();
        CredentialValidator validator = new CredentialValidator((secret, timeout) -> {
            probeCalls.incrementAndGet();
            return secret.startsWith("sk-bad") ? CompletableFuture.completedFuture(ValidationResult.invalid("HTTP 401"))
                    : pendingProbe;
        }, Duration.ofSeconds(5));
        activator = new CredentialActivator(pool, validator, clock);
    }

    @Test
    void concurrentActivationProbesOnlyOnce() {
        String id = pool.add("sk-good-secret-0001", null).getId();

        CompletableFuture<CredentialStats> first = activator.activate(id);
        CompletableFuture<CredentialStats> second = activator.activate(id);

        assertThat(second).isSameAs(first).isNotDone();
        pendingProbe.complete(ValidationResult.valid());
        assertThat(first.join().getState()).isEqualTo(CredentialState.VALID);
        assertThat(probeCalls).hasValue(1);
    }

    @Test
    void invalidVerdictIsStoredWithError() {
        String id = pool.add("sk-bad-secret-0001", null).getId();

        CredentialStats stats = activator.activate(id).join();

        assertThat(stats.getState()).isEqualTo(CredentialState.INVALID);
        assertThat(stats.getLastError()).isEqualTo("HTTP 401");
    }

    @Test
    void alreadyValidatedCredentialReturnsSnapshotWithoutProbing() {
        String id = pool.add("sk-bad-secret-0001", null).getId();
        activator.activate(id).join();

        CredentialStats again = activator.activate(id).join();

        assertThat(again.getState()).isEqualTo(CredentialState.INVALID);
        assertThat(probeCalls).hasValue(1);
    }

    @Test
    void unknownCredentialFailsWithNotFound() {
        assertThatThrownBy(() -> activator.activate("cred-missing").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(CredentialNotFoundException.class);
    }

    @Test
    void activatePendingStartsEveryUnvalidatedCredential() {
        pool.add("sk-bad-secret-0001", null);
        pool.add("sk-bad-secret-0002", null);

        assertThat(activator.activatePending()).isEqualTo(2);
        assertThat(activator.activatePending()).isZero();
        assertThat(pool.allInvalid()).isTrue();
    }
}
