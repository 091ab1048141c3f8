package com.metagen.dispatcher.job;

import com.metagen.common.dto.JobOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationJobTest {

    @Test
    void retriedJobKeepsAttemptCountAndLastCredential() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");

        job.markInFlight("cred-a");
        job.requeue();
        job.markInFlight("cred-b");
        job.succeed("title");

        JobOutcome<String> outcome = job.toOutcome();
        assertThat(outcome.isSucceeded()).isTrue();
        assertThat(outcome.getResult()).isEqualTo("title");
        assertThat(outcome.getAttemptCount()).isEqualTo(2);
        assertThat(outcome.getLastCredentialId()).isEqualTo("cred-b");
    }

    @Test
    void retryableFailuresAreCountedApartFromDispatches() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");

        job.markInFlight("cred-a");
        job.requeue();
        job.markInFlight("cred-b");

        assertThat(job.countRetryableFailure()).isEqualTo(1);
        assertThat(job.getAttemptCount()).isEqualTo(2);
        assertThat(job.getRetryableFailures()).isEqualTo(1);
    }

    @Test
    void retryableFailureIsOnlyCountedWhileInFlight() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");

        assertThatThrownBy(job::countRetryableFailure).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pendingJobCanFailWithoutEverBeingDispatched() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");

        job.fail("run cancelled");

        assertThat(job.toOutcome().getFailureReason()).isEqualTo("run cancelled");
        assertThat(job.toOutcome().getAttemptCount()).isZero();
    }

    @Test
    void terminalJobsRejectFurtherTransitions() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");
        job.markInFlight("cred-a");
        job.succeed("ok");

        assertThatThrownBy(() -> job.fail("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(job::requeue).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.markInFlight("cred-b")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void outcomeOfUnfinishedJobIsAnError() {
        GenerationJob<String, String> job = new GenerationJob<>("job-1", "a.jpg", "payload");

        assertThatThrownBy(job::toOutcome).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void queueIsFifoAndRequeuedJobsGoToTheBack() {
        GenerationJob<String, String> first = new GenerationJob<>("job-1", "a.jpg", "a");
        GenerationJob<String, String> second = new GenerationJob<>("job-2", "b.jpg", "b");
        JobQueue<String, String> queue = new JobQueue<>(List.of(first, second));

        GenerationJob<String, String> polled = queue.poll();
        polled.markInFlight("cred-a");
        assertThatThrownBy(() -> queue.enqueue(polled)).isInstanceOf(IllegalStateException.class);
        polled.requeue();
        queue.enqueue(polled);

        assertThat(queue.drain()).containsExactly(second, first);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.poll()).isNull();
    }
}
