package com.chunkflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for job execution and batch dispatch.
 */
@Service
public class ChunkflowMetrics {

    private final MeterRegistry registry;

    public ChunkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Job engine ---

    /**
     * Records a terminal job outcome and the attempts it consumed.
     *
     * @param runner   runner name
     * @param success  whether the job completed
     * @param attempts attempts consumed including the final one
     */
    public void recordJobOutcome(String runner, boolean success, int attempts) {
        Counter.builder("chunkflow.jobs.total")
                .tag("runner", runner)
                .tag("outcome", success ? "completed" : "failed")
                .register(registry)
                .increment();

        DistributionSummary.builder("chunkflow.jobs.attempts")
                .description("Attempts consumed per terminal job outcome")
                .tag("runner", runner)
                .register(registry)
                .record(attempts);
    }

    public void recordReplay(String runner, int count) {
        Counter.builder("chunkflow.jobs.replayed")
                .description("Failed jobs resubmitted by manual replay")
                .tag("runner", runner)
                .register(registry)
                .increment(count);
    }

    // --- Batch dispatch ---

    public void recordBatchDuration(long ms) {
        Timer.builder("chunkflow.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatchFailure() {
        Counter.builder("chunkflow.batch.failures")
                .description("Batch sends that aborted a dispatch")
                .register(registry)
                .increment();
    }

    /**
     * Records one dispatch call.
     *
     * @param batchCount  number of batches dispatched
     * @param parallelism effective parallelism factor
     */
    public void recordDispatch(int batchCount, int parallelism) {
        DistributionSummary.builder("chunkflow.dispatch.batches")
                .description("Number of batches per dispatch call")
                .tag("mode", parallelism <= 1 ? "sequential" : "parallel")
                .register(registry)
                .record(batchCount);
    }
}
