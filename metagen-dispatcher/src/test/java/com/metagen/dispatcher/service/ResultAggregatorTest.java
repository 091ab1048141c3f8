package com.metagen.dispatcher.service;

import com.metagen.common.dto.RunProgress;
import com.metagen.common.dto.RunReport;
import com.metagen.common.dto.RunStatus;
import com.metagen.dispatcher.job.GenerationJob;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultAggregatorTest {

    private static GenerationJob<String, String> succeeded(String id) {
        GenerationJob<String, String> job = new GenerationJob<>(id, id + ".jpg", "payload");
        job.markInFlight("cred-a");
        job.succeed("meta-" + id);
        return job;
    }

    @Test
    void lateSubscriberSeesLatestProgressThenCompletion() {
        ResultAggregator<String> aggregator = new ResultAggregator<>("run-1", 2);
        aggregator.onRunStatus(RunStatus.RUNNING);
        aggregator.onJobSettled(succeeded("job-1"));

        StepVerifier.create(aggregator.progress())
                .assertNext(progress -> {
                    assertThat(progress.getCompleted()).isEqualTo(1);
                    assertThat(progress.getTotal()).isEqualTo(2);
                    assertThat(progress.getStatus()).isEqualTo(RunStatus.RUNNING);
                })
                .then(() -> {
                    GenerationJob<String, String> failed = new GenerationJob<>("job-2", "b.jpg", "payload");
                    failed.fail("run cancelled");
                    aggregator.onJobSettled(failed);
                    aggregator.report(RunStatus.CANCELLED, List.of(), Instant.EPOCH, Instant.EPOCH);
                })
                .assertNext(progress -> assertThat(progress.getCompleted()).isEqualTo(2))
                .assertNext(progress -> assertThat(progress.getStatus()).isEqualTo(RunStatus.CANCELLED))
                .verifyComplete();
    }

    @Test
    void completedCountIsMonotonic() {
        ResultAggregator<String> aggregator = new ResultAggregator<>("run-1", 3);
        List<Integer> seen = new CopyOnWriteArrayList<>();
        aggregator.progress().map(RunProgress::getCompleted).subscribe(seen::add);

        aggregator.onJobSettled(succeeded("job-1"));
        aggregator.onJobSettled(succeeded("job-2"));
        aggregator.onJobSettled(succeeded("job-3"));
        aggregator.report(RunStatus.DRAINED, List.of(), Instant.EPOCH, Instant.EPOCH);

        assertThat(seen).isSorted().contains(0, 1, 2, 3);
    }

    @Test
    void reportPartitionsOutcomes() {
        ResultAggregator<String> aggregator = new ResultAggregator<>("run-1", 2);
        aggregator.onJobSettled(succeeded("job-1"));
        GenerationJob<String, String> failed = new GenerationJob<>("job-2", "b.jpg", "payload");
        failed.fail("no valid credential available");
        aggregator.onJobSettled(failed);

        RunReport<String> report = aggregator.report(RunStatus.DRAINED, List.of(),
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:01:00Z"));

        assertThat(report.totalJobs()).isEqualTo(2);
        assertThat(report.getSucceeded()).extracting("result").containsExactly("meta-job-1");
        assertThat(report.getFailed()).extracting("failureReason").containsExactly("no valid credential available");
        assertThat(report.elapsed().toSeconds()).isEqualTo(60);
    }

    @Test
    void settlingTheSameJobTwiceIsRejected() {
        ResultAggregator<String> aggregator = new ResultAggregator<>("run-1", 1);
        GenerationJob<String, String> job = succeeded("job-1");
        aggregator.onJobSettled(job);

        assertThatThrownBy(() -> aggregator.onJobSettled(job)).isInstanceOf(IllegalStateException.class);
    }
}
