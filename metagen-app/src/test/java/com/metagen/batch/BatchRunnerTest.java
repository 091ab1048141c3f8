package com.metagen.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metagen.ai.provider.GenerationRequest;
import com.metagen.ai.provider.OpenAiCompatibleProvider;
import com.metagen.common.dto.JobOutcome;
import com.metagen.common.dto.RunReport;
import com.metagen.common.dto.RunStatus;
import com.metagen.dispatcher.job.JobRequest;
import com.metagen.dispatcher.service.DispatcherService;
import com.metagen.dispatcher.service.RunHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchRunnerTest {

    @TempDir
    Path tempDir;

    private final DispatcherService dispatcherService = mock(DispatcherService.class);
    private final OpenAiCompatibleProvider provider = mock(OpenAiCompatibleProvider.class);
    private BatchProperties properties;
    private BatchRunner runner;

    @BeforeEach
    void setUp() {
        properties = new BatchProperties();
        properties.setInputDir(tempDir.resolve("in").toString());
        properties.setPrompt("Describe");
        runner = new BatchRunner(dispatcherService, provider, properties);
    }

    @Test
    void loadsEveryFileInNameOrder() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("b.png"), "hi", StandardCharsets.UTF_8);
        Files.writeString(in.resolve("a.jpg"), "hi", StandardCharsets.UTF_8);
        Files.createDirectories(in.resolve("nested"));

        List<JobRequest<GenerationRequest>> requests = runner.loadRequests(in);

        assertThat(requests).extracting(JobRequest::getFileReference).containsExactly("a.jpg", "b.png");
        GenerationRequest payload = requests.get(1).getPayload();
        assertThat(payload.getImageBase64()).isEqualTo("aGk=");
        assertThat(payload.getMimeType()).isEqualTo("image/png");
        assertThat(payload.getPrompt()).isEqualTo("Describe");
    }

    @Test
    @SuppressWarnings("unchecked")
    void writesAllOutcomesToOutputFile() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("a.jpg"), "hi", StandardCharsets.UTF_8);
        Path out = tempDir.resolve("metadata.json");
        properties.setOutputFile(out.toString());

        RunReport<String> report = RunReport.<String>builder()
                .runId("run-1")
                .status(RunStatus.DRAINED)
                .succeeded(List.of(JobOutcome.<String>builder().jobId("job-1").fileReference("a.jpg")
                        .succeeded(true).result("Title: A").attemptCount(1).build()))
                .failed(List.of())
                .credentialStats(List.of())
                .startedAt(Instant.EPOCH)
                .finishedAt(Instant.EPOCH)
                .build();
        RunHandle<String> handle = mock(RunHandle.class);
        when(handle.progress()).thenReturn(Flux.empty());
        when(handle.result()).thenReturn(CompletableFuture.completedFuture(report));
        when(dispatcherService.run(anyList(), eq(provider))).thenReturn(handle);

        runner.run();

        JsonNode written = new ObjectMapper().readTree(out.toFile());
        assertThat(written.size()).isEqualTo(1);
        assertThat(written.path(0).path("fileReference").asText()).isEqualTo("a.jpg");
        assertThat(written.path(0).path("result").asText()).isEqualTo("Title: A");
    }

    @Test
    void emptyDirectoryDoesNotStartARun() throws Exception {
        Files.createDirectories(tempDir.resolve("in"));

        runner.run();

        verify(dispatcherService, never()).run(anyList(), eq(provider));
    }
}
