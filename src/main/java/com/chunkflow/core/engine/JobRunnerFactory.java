package com.chunkflow.core.engine;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.core.events.EventBus;
import com.chunkflow.core.metrics.ChunkflowMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Creates {@link JobRunner}s configured from {@code chunkflow.runner.*} and wired to
 * the shared event bus and metrics.
 */
@Component
public class JobRunnerFactory {

    private final ChunkflowProperties properties;
    private final EventBus eventBus;
    private final ChunkflowMetrics metrics;

    public JobRunnerFactory(ChunkflowProperties properties, EventBus eventBus,
                            @Autowired(required = false) ChunkflowMetrics metrics) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public <P, R> JobRunner<P, R> create(String name, JobHandler<P, R> handler) {
        return create(name, handler, properties.getRunner().getWorkers());
    }

    public <P, R> JobRunner<P, R> create(String name, JobHandler<P, R> handler, int workers) {
        var runner = properties.getRunner();
        return new JobRunner<>(name, handler, workers,
                Duration.ofMillis(runner.getPollIntervalMs()),
                Duration.ofMillis(runner.getRetryBackoffMs()),
                Duration.ofSeconds(runner.getShutdownTimeoutSeconds()),
                eventBus, metrics);
    }

    public int defaultMaxRetries() {
        return properties.getRunner().getMaxRetries();
    }
}
