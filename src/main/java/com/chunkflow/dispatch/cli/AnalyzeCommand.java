package com.chunkflow.dispatch.cli;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.core.engine.JobRunner;
import com.chunkflow.core.engine.JobRunnerFactory;
import com.chunkflow.core.events.ChunkflowEvent;
import com.chunkflow.core.events.EventBus;
import com.chunkflow.core.model.ChunkSegment;
import com.chunkflow.core.model.ExecutionOutcome;
import com.chunkflow.core.model.WorkItem;
import com.chunkflow.media.ManifestStore;
import com.chunkflow.media.MediaProcessingException;
import com.chunkflow.vision.AnalysisSettings;
import com.chunkflow.vision.ChunkAnalyzer;
import com.chunkflow.vision.ChunkAnalyzerFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: chunkflow analyze &lt;manifest.json&gt; --frames-dir &lt;dir&gt;
 * <p>
 * Submits every chunk in the manifest as a work item. Each chunk's frames are
 * sampled, sent to the vision processor in batches and reassembled in frame order.
 * Chunks that exhaust their retries are listed with their errors and can be
 * replayed once with {@code --replay-failed}. Chunks left without an outcome by
 * {@code --join-timeout} are listed as unfinished and fail the run.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze every chunk of a manifest")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Chunk manifest (manifest.json)")
    private Path manifest;

    @Option(names = "--frames-dir", required = true, description = "Directory for extracted frames")
    private Path framesDir;

    @Option(names = "--endpoint", description = "Vision processor URL (default: chunkflow.vision.endpoint-url)")
    private String endpoint;

    @Option(names = "--fps", description = "Frame sampling rate (default: chunkflow.media.fps)")
    private Double fps;

    @Option(names = "--batch-size", description = "Frames per batch (default: chunkflow.batch.size)")
    private Integer batchSize;

    @Option(names = "--parallel", description = "Batches in flight per chunk (default: chunkflow.batch.max-parallel)")
    private Integer parallel;

    @Option(names = "--workers", description = "Chunks analyzed concurrently (default: chunkflow.runner.workers)")
    private Integer workers;

    @Option(names = "--retries", description = "Retries per chunk after the first attempt (default: chunkflow.runner.max-retries)")
    private Integer retries;

    @Option(names = "--replay-failed", description = "Replay failed chunks once after the first pass")
    private boolean replayFailed;

    @Option(names = "--join-timeout", description = "Seconds to wait for chunks before giving up (default: no limit)")
    private Long joinTimeoutSeconds;

    @Option(names = {"--output", "-o"}, description = "Write ordered results per chunk as JSON")
    private Path output;

    @Option(names = "--watch", description = "Print chunk and batch events as they happen")
    private boolean watch;

    private final ManifestStore manifestStore;
    private final ChunkAnalyzerFactory analyzerFactory;
    private final JobRunnerFactory runnerFactory;
    private final ChunkflowProperties properties;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;

    public AnalyzeCommand(ManifestStore manifestStore, ChunkAnalyzerFactory analyzerFactory,
                          JobRunnerFactory runnerFactory, ChunkflowProperties properties,
                          ObjectMapper objectMapper, EventBus eventBus) {
        this.manifestStore = manifestStore;
        this.analyzerFactory = analyzerFactory;
        this.runnerFactory = runnerFactory;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ChunkSegment> chunks;
        ChunkAnalyzer analyzer;
        JobRunner<ChunkSegment, List<JsonNode>> runner;
        try {
            chunks = manifestStore.readManifest(manifest);
            analyzer = analyzerFactory.create(settings());
            runner = runnerFactory.create("analyze", analyzer,
                    workers != null ? workers : properties.getRunner().getWorkers());
        } catch (IllegalArgumentException | MediaProcessingException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        if (chunks.isEmpty()) {
            ConsoleOutput.info("Manifest has no chunks: " + manifest);
            return 0;
        }

        int maxRetries = retries != null ? retries : runnerFactory.defaultMaxRetries();
        ConsoleOutput.info("Analyzing " + chunks.size() + " chunk(s) with up to " + (maxRetries + 1) + " attempt(s) each");

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(AnalyzeCommand::printEvent) : null;
        List<WorkItem<ChunkSegment>> abandoned;
        boolean drained = false;
        runner.start();
        try {
            for (ChunkSegment chunk : chunks) {
                runner.submit(chunk.jobId(), chunk, maxRetries);
            }
            drained = awaitDrain(runner);
            if (drained && replayFailed && !runner.failed().isEmpty()) {
                int replayed = runner.retryFailed();
                ConsoleOutput.warn("Replaying " + replayed + " failed chunk(s)");
                drained = awaitDrain(runner);
            }
            if (!drained) {
                ConsoleOutput.warn("Timed out waiting for chunks; stopping workers");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for chunks");
        } finally {
            abandoned = runner.shutdown();
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        var completed = runner.completed();
        var failed = runner.failed();
        Set<String> abandonedIds = new HashSet<>();
        abandoned.forEach(item -> abandonedIds.add(item.id()));
        List<String> unfinished = new ArrayList<>();
        for (var chunk : chunks) {
            String id = chunk.jobId();
            if (!completed.containsKey(id) && !failed.containsKey(id) && !abandonedIds.contains(id)) {
                unfinished.add(id);
            }
        }

        printSummary(chunks, runner, completed, failed);
        for (var item : abandoned) {
            ConsoleOutput.warn("Not processed: " + item.id());
        }
        for (String id : unfinished) {
            ConsoleOutput.warn("Not finished: " + id);
        }

        if (output != null && !writeResults(chunks, completed)) {
            return 1;
        }
        boolean allDone = drained && failed.isEmpty() && abandoned.isEmpty() && unfinished.isEmpty();
        return allDone ? 0 : 1;
    }

    AnalysisSettings settings() {
        var defaults = AnalysisSettings.from(properties, framesDir);
        return new AnalysisSettings(
                endpoint != null ? endpoint : defaults.endpointUrl(),
                defaults.timeout(),
                defaults.prompt(),
                fps != null ? fps : defaults.fps(),
                batchSize != null ? batchSize : defaults.batchSize(),
                parallel != null ? parallel : defaults.parallelism(),
                framesDir);
    }

    private boolean awaitDrain(JobRunner<?, ?> runner) throws InterruptedException {
        if (joinTimeoutSeconds == null) {
            runner.join();
            return true;
        }
        return runner.join(Duration.ofSeconds(joinTimeoutSeconds));
    }

    private static void printEvent(ChunkflowEvent event) {
        String subject = event.subjectId() != null ? event.subjectId() : "-";
        ConsoleOutput.watchEvent(event.eventType(), event.source() + " " + subject + " " + event.payload());
    }

    private void printSummary(List<ChunkSegment> chunks, JobRunner<ChunkSegment, List<JsonNode>> runner,
                              Map<String, ExecutionOutcome<List<JsonNode>>> completed,
                              Map<String, ExecutionOutcome<List<JsonNode>>> failed) {
        System.out.println();
        System.out.printf("  %-12s %-10s %-9s %s%n", "CHUNK", "STATUS", "ATTEMPTS", "DETAIL");
        System.out.println("  " + "-".repeat(64));
        for (var chunk : chunks) {
            String id = chunk.jobId();
            ExecutionOutcome<List<JsonNode>> done = completed.get(id);
            ExecutionOutcome<List<JsonNode>> fail = failed.get(id);
            if (done != null) {
                System.out.printf("  %-12s %-10s %-9d %d result(s)%n", id, "COMPLETED", done.attempts(),
                        done.result() != null ? done.result().size() : 0);
            } else if (fail != null) {
                System.out.printf("  %-12s %-10s %-9d %s%n", id, "FAILED", fail.attempts(),
                        ConsoleOutput.truncate(fail.error(), 40));
            } else {
                System.out.printf("  %-12s %-10s %-9s %s%n", id, "PENDING", "-", "-");
            }
        }
        System.out.println();

        if (completed.size() == chunks.size()) {
            ConsoleOutput.success(completed.size() + "/" + chunks.size() + " chunk(s) completed");
            return;
        }
        ConsoleOutput.warn(completed.size() + "/" + chunks.size() + " chunk(s) completed");
        if (!failed.isEmpty()) {
            ConsoleOutput.error("Failed (" + failed.size() + "):");
            runner.failedErrors().forEach((id, error) -> ConsoleOutput.error("  " + id + ": " + error));
        }
    }

    private boolean writeResults(List<ChunkSegment> chunks, Map<String, ExecutionOutcome<List<JsonNode>>> completed) {
        var ordered = new LinkedHashMap<String, List<JsonNode>>();
        for (var chunk : chunks) {
            var outcome = completed.get(chunk.jobId());
            if (outcome != null) {
                ordered.put(chunk.jobId(), outcome.result());
            }
        }
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), ordered);
            ConsoleOutput.info("Results written to " + output.toAbsolutePath());
            return true;
        } catch (IOException e) {
            ConsoleOutput.error("Could not write results to " + output + ": " + e.getMessage());
            return false;
        }
    }
}
