package com.metagen.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.metagen.ai.provider.GenerationRequest;
import com.metagen.ai.provider.OpenAiCompatibleProvider;
import com.metagen.common.dto.JobOutcome;
import com.metagen.common.dto.RunReport;
import com.metagen.common.util.MediaUtils;
import com.metagen.dispatcher.job.JobRequest;
import com.metagen.dispatcher.service.DispatcherService;
import com.metagen.dispatcher.service.RunHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 命令行批处理：读取目录下的全部文件，交给调度服务生成元数据，结果写入 JSON 文件。
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "metagen.batch", name = "input-dir")
public class BatchRunner implements CommandLineRunner {

    private final DispatcherService dispatcherService;
    private final OpenAiCompatibleProvider provider;
    private final BatchProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void run(String... args) throws Exception {
        List<JobRequest<GenerationRequest>> requests = loadRequests(Path.of(properties.getInputDir()));
        if (requests.isEmpty()) {
            log.warn("目录 {} 下没有待处理的文件", properties.getInputDir());
            return;
        }

        RunHandle<String> handle = dispatcherService.run(requests, provider);
        handle.progress().subscribe(progress -> log.debug("进度 {}/{}: {}",
                progress.getCompleted(), progress.getTotal(), progress.getCurrentFile()));

        RunReport<String> report = handle.result().get();
        for (JobOutcome<String> failed : report.getFailed()) {
            log.warn("文件 {} 处理失败: {}", failed.getFileReference(), failed.getFailureReason());
        }
        log.info("批处理完成 ({}), 成功 {} / 失败 {}, 耗时 {}s", report.getStatus(),
                report.getSucceeded().size(), report.getFailed().size(), report.elapsed().toSeconds());

        if (properties.getOutputFile() != null && !properties.getOutputFile().isBlank()) {
            writeOutcomes(report, Path.of(properties.getOutputFile()));
        }
    }

    List<JobRequest<GenerationRequest>> loadRequests(Path inputDir) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(inputDir)) {
            files = stream.filter(Files::isRegularFile).sorted().toList();
        }

        List<JobRequest<GenerationRequest>> requests = new ArrayList<>(files.size());
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            GenerationRequest payload = GenerationRequest.builder()
                    .fileName(fileName)
                    .prompt(properties.getPrompt())
                    .imageBase64(MediaUtils.toBase64(Files.readAllBytes(file)))
                    .mimeType(MediaUtils.getMimeType(fileName))
                    .build();
            requests.add(JobRequest.of(fileName, payload));
        }
        log.info("从 {} 读取 {} 个文件", inputDir, requests.size());
        return requests;
    }

    private void writeOutcomes(RunReport<String> report, Path outputFile) {
        List<JobOutcome<String>> outcomes = new ArrayList<>(report.getSucceeded());
        outcomes.addAll(report.getFailed());
        try {
            objectMapper.writeValue(outputFile.toFile(), outcomes);
            log.info("结果已写入 {}", outputFile);
        } catch (IOException e) {
            throw new UncheckedIOException("写入结果文件失败: " + outputFile, e);
        }
    }
}
