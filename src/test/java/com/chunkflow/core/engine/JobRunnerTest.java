package com.chunkflow.core.engine;

import com.chunkflow.core.events.ChunkflowEvent;
import com.chunkflow.core.events.EventBus;
import com.chunkflow.core.metrics.ChunkflowMetrics;
import com.chunkflow.core.model.ExecutionOutcome;
import com.chunkflow.core.model.WorkItem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private final List<JobRunner<?, ?>> runners = new ArrayList<>();

    @AfterEach
    void tearDown() {
        runners.forEach(JobRunner::shutdown);
    }

    private <P, R> JobRunner<P, R> runner(JobHandler<P, R> handler, int workers) {
        return runner(handler, workers, Duration.ZERO, null, null);
    }

    private <P, R> JobRunner<P, R> runner(JobHandler<P, R> handler, int workers, Duration backoff,
                                          EventBus eventBus, ChunkflowMetrics metrics) {
        var runner = new JobRunner<>("test", handler, workers, Duration.ofMillis(10), backoff,
                Duration.ofSeconds(5), eventBus, metrics);
        runners.add(runner);
        return runner;
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @ParameterizedTest
        @ValueSource(ints = {0, -1, -8})
        @DisplayName("non-positive worker count is rejected")
        void rejectsNonPositiveWorkers(int workers) {
            assertThrows(IllegalArgumentException.class, () -> new JobRunner<String, String>(p -> p, workers));
        }

        @Test
        @DisplayName("negative retry ceiling is rejected at submission")
        void rejectsNegativeRetries() {
            var runner = runner((String p) -> p, 1);
            assertThrows(IllegalArgumentException.class, () -> runner.submit("a", "x", -1));
        }

        @Test
        @DisplayName("shutdown before start returns no abandoned items")
        void shutdownBeforeStart() {
            var runner = runner((String p) -> p, 1);
            assertTrue(runner.shutdown().isEmpty());
            assertFalse(runner.isRunning());
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @ParameterizedTest
        @ValueSource(ints = {1, 3, 8})
        @DisplayName("every item lands in exactly one store with attempts within the ceiling")
        void everyItemLandsInExactlyOneStore(int workers) throws Exception {
            int maxRetries = 2;
            JobRunner<Integer, Integer> runner = runner(n -> {
                if (n % 3 == 0) {
                    throw new IllegalStateException("bad item " + n);
                }
                return n * 2;
            }, workers);
            runner.start();

            var ids = new HashSet<String>();
            for (int i = 0; i < 30; i++) {
                runner.submit("item-" + i, i, maxRetries);
                ids.add("item-" + i);
            }

            assertTrue(runner.join(WAIT));

            var completed = runner.completed();
            var failed = runner.failed();
            var union = new HashSet<>(completed.keySet());
            union.addAll(failed.keySet());
            assertEquals(ids, union);
            assertTrue(completed.keySet().stream().noneMatch(failed::containsKey));

            completed.values().forEach(o -> assertTrue(o.attempts() <= maxRetries + 1));
            failed.values().forEach(o -> assertEquals(maxRetries + 1, o.attempts()));
            assertEquals(10, failed.size());
            assertEquals(14, completed.get("item-7").result());
            assertEquals("bad item 9", failed.get("item-9").error());
            assertEquals(0, runner.pendingCount());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 4})
        @DisplayName("always-failing handler runs exactly ceiling + 1 attempts")
        void alwaysFailingRunsCeilingPlusOne(int maxRetries) throws Exception {
            var calls = new AtomicInteger();
            JobRunner<String, String> runner = runner(p -> {
                calls.incrementAndGet();
                throw new RuntimeException("boom");
            }, 2);
            runner.start();
            runner.submit("doomed", "payload", maxRetries);

            assertTrue(runner.join(WAIT));

            assertEquals(maxRetries + 1, calls.get());
            var outcome = runner.failed().get("doomed");
            assertNotNull(outcome);
            assertFalse(outcome.success());
            assertEquals(maxRetries + 1, outcome.attempts());
            assertEquals("boom", outcome.error());
            assertTrue(runner.completed().isEmpty());
        }

        @Test
        @DisplayName("flaky handler succeeds inline without re-queueing")
        void flakyHandlerSucceedsInline() throws Exception {
            var calls = new AtomicInteger();
            var threads = ConcurrentHashMap.<String>newKeySet();
            JobRunner<String, String> runner = runner(p -> {
                threads.add(Thread.currentThread().getName());
                if (calls.incrementAndGet() < 3) {
                    throw new java.io.IOException("transient");
                }
                return p.toUpperCase();
            }, 4);
            runner.start();
            runner.submit("flaky", "ok", 3);

            assertTrue(runner.join(WAIT));

            var outcome = runner.completed().get("flaky");
            assertEquals(3, outcome.attempts());
            assertEquals("OK", outcome.result());
            assertEquals(1, threads.size(), "retries stay on the same worker");
        }

        @Test
        @DisplayName("handler exception without message is described by its type")
        void exceptionWithoutMessage() throws Exception {
            JobRunner<String, String> runner = runner(p -> {
                throw new UnsupportedOperationException();
            }, 1);
            runner.start();
            runner.submit("x", "p", 0);

            assertTrue(runner.join(WAIT));
            assertEquals("UnsupportedOperationException", runner.failedErrors().get("x"));
        }

        @Test
        @DisplayName("duplicate live id is rejected")
        void duplicateLiveIdRejected() throws Exception {
            var release = new CountDownLatch(1);
            JobRunner<String, String> runner = runner(p -> {
                release.await();
                return p;
            }, 1);
            runner.start();
            runner.submit("same", "a", 0);

            assertThrows(IllegalArgumentException.class, () -> runner.submit("same", "b", 0));

            release.countDown();
            assertTrue(runner.join(WAIT));
            runner.submit("same", "c", 0);
            assertTrue(runner.join(WAIT));
            assertEquals("c", runner.completed().get("same").result());
        }

        @Test
        @DisplayName("start is idempotent and pool size stays fixed")
        void startIsIdempotent() throws Exception {
            var threads = ConcurrentHashMap.<String>newKeySet();
            JobRunner<Integer, Integer> runner = runner(n -> {
                threads.add(Thread.currentThread().getName());
                Thread.sleep(2);
                return n;
            }, 2);
            runner.start();
            runner.start();
            for (int i = 0; i < 20; i++) {
                runner.submit("n" + i, i, 0);
            }

            assertTrue(runner.join(WAIT));
            assertTrue(threads.size() <= 2, "ran on " + threads);
            assertTrue(threads.stream().allMatch(t -> t.startsWith("test-worker-")));
        }

        @Test
        @DisplayName("join times out while work is in flight")
        void joinTimesOut() throws Exception {
            var release = new CountDownLatch(1);
            JobRunner<String, String> runner = runner(p -> {
                release.await();
                return p;
            }, 1);
            runner.start();
            runner.submit("slow", "p", 0);

            assertFalse(runner.join(Duration.ofMillis(100)));
            assertEquals(1, runner.pendingCount());

            release.countDown();
            assertTrue(runner.join(WAIT));
        }

        @Test
        @DisplayName("join on an idle runner returns immediately")
        void joinIdle() throws Exception {
            var runner = runner((String p) -> p, 1);
            assertTrue(runner.join(Duration.ZERO));
        }

        @Test
        @DisplayName("configured backoff spaces out inline retries")
        void backoffDelaysRetries() throws Exception {
            JobRunner<String, String> runner = runner(p -> {
                throw new RuntimeException("down");
            }, 1, Duration.ofMillis(40), null, null);
            runner.start();

            long start = System.nanoTime();
            runner.submit("slow-fail", "p", 2);
            assertTrue(runner.join(WAIT));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs >= 80, "two backoffs expected, took " + elapsedMs + " ms");
            assertEquals(3, runner.failed().get("slow-fail").attempts());
        }
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        @DisplayName("retryFailed resets attempts and removes the item from failed")
        void retryFailedResetsAttempts() throws Exception {
            var healthy = new AtomicBoolean(false);
            JobRunner<String, String> runner = runner(p -> {
                if (!healthy.get()) {
                    throw new IllegalStateException("remote down");
                }
                return "done:" + p;
            }, 2);
            runner.start();
            runner.submit("job-1", "a", 2);
            assertTrue(runner.join(WAIT));
            assertEquals(3, runner.failed().get("job-1").attempts());

            healthy.set(true);
            assertEquals(1, runner.retryFailed());
            assertFalse(runner.failed().containsKey("job-1"));

            assertTrue(runner.join(WAIT));
            ExecutionOutcome<String> outcome = runner.completed().get("job-1");
            assertEquals(1, outcome.attempts());
            assertEquals("done:a", outcome.result());
            assertTrue(runner.failed().isEmpty());
        }

        @Test
        @DisplayName("item failing again after replay returns to failed with a fresh attempt count")
        void replayedItemCanFailAgain() throws Exception {
            var calls = new AtomicInteger();
            JobRunner<String, String> runner = runner(p -> {
                calls.incrementAndGet();
                throw new RuntimeException("still down");
            }, 1);
            runner.start();
            runner.submit("job-2", "b", 1);
            assertTrue(runner.join(WAIT));

            assertEquals(1, runner.retryFailed("job-2"));
            assertTrue(runner.join(WAIT));

            assertEquals(4, calls.get());
            assertEquals(2, runner.failed().get("job-2").attempts());
        }

        @Test
        @DisplayName("retryFailed with an id replays only that item")
        void retryFailedById() throws Exception {
            JobRunner<String, String> runner = runner(p -> {
                throw new RuntimeException("nope");
            }, 2);
            runner.start();
            runner.submit("a", "1", 0);
            runner.submit("b", "2", 0);
            assertTrue(runner.join(WAIT));

            assertEquals(0, runner.retryFailed("unknown"));
            assertEquals(1, runner.retryFailed("a"));
            assertTrue(runner.failed().containsKey("b"));
            assertTrue(runner.join(WAIT));
            assertEquals(Set.of("a", "b"), runner.failed().keySet());
        }

        @Test
        @DisplayName("resubmitting a failed id replaces its failure so replay cannot start a second copy")
        void resubmitSupersedesFailure() throws Exception {
            var release = new CountDownLatch(1);
            var running = new AtomicInteger();
            var maxRunning = new AtomicInteger();
            JobRunner<String, String> runner = runner(p -> {
                if (p.equals("bad")) {
                    throw new IllegalStateException("rejected");
                }
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    release.await();
                } finally {
                    running.decrementAndGet();
                }
                return p;
            }, 2);
            runner.start();
            runner.submit("x", "bad", 0);
            assertTrue(runner.join(WAIT));
            assertTrue(runner.failed().containsKey("x"));

            runner.submit("x", "slow", 0);
            assertFalse(runner.failed().containsKey("x"));
            assertEquals(0, runner.retryFailed("x"));
            assertEquals(0, runner.retryFailed());
            assertEquals(1, runner.pendingCount());

            release.countDown();
            assertTrue(runner.join(WAIT));
            assertEquals(1, maxRunning.get());
            assertEquals("slow", runner.completed().get("x").result());
            assertTrue(runner.failed().isEmpty());

            runner.submit("x", "again", 0);
            assertTrue(runner.join(WAIT));
            assertEquals("again", runner.completed().get("x").result());
        }

        @Test
        @DisplayName("retryFailed with no failures returns zero")
        void retryFailedNothing() {
            var runner = runner((String p) -> p, 1);
            assertEquals(0, runner.retryFailed());
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("queued items are abandoned, neither completed nor failed")
        void shutdownAbandonsQueuedItems() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            JobRunner<String, String> runner = runner(p -> {
                if (p.equals("first")) {
                    started.countDown();
                    release.await();
                }
                return p;
            }, 1);
            runner.start();
            runner.submit("a", "first", 0);
            for (String id : List.of("b", "c", "d")) {
                runner.submit(id, id, 0);
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));

            ScheduledExecutorService releaser = Executors.newSingleThreadScheduledExecutor();
            try {
                releaser.schedule(release::countDown, 200, TimeUnit.MILLISECONDS);
                List<WorkItem<String>> abandoned = runner.shutdown();

                assertEquals(List.of("b", "c", "d"), abandoned.stream().map(WorkItem::id).toList());
            } finally {
                releaser.shutdownNow();
            }

            assertEquals(Set.of("a"), runner.completed().keySet());
            assertTrue(runner.failed().isEmpty());
            assertEquals(0, runner.pendingCount());
            assertFalse(runner.isRunning());
            assertTrue(runner.join(Duration.ZERO));
        }

        @Test
        @DisplayName("runner can be restarted after shutdown")
        void restartAfterShutdown() throws Exception {
            var runner = runner((String p) -> p + "!", 2);
            runner.start();
            runner.shutdown();

            runner.start();
            runner.submit("again", "hi", 0);
            assertTrue(runner.join(WAIT));
            assertEquals("hi!", runner.completed().get("again").result());
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("publishes attempt, failure, completion and replay events")
        void publishesEvents() throws Exception {
            var eventBus = new EventBus();
            var events = new CopyOnWriteArrayList<ChunkflowEvent>();
            eventBus.subscribeAll(events::add);

            JobRunner<String, String> runner = runner(p -> {
                if (p.equals("bad")) throw new RuntimeException("x");
                return p;
            }, 1, Duration.ZERO, eventBus, null);
            runner.start();
            runner.submit("ok", "good", 2);
            runner.submit("ko", "bad", 2);
            assertTrue(runner.join(WAIT));
            runner.retryFailed();
            assertTrue(runner.join(WAIT));

            Map<String, Long> counts = new java.util.HashMap<>();
            events.forEach(e -> counts.merge(e.eventType(), 1L, Long::sum));
            assertEquals(1L, counts.get("job.completed"));
            assertEquals(2L, counts.get("job.failed"));
            assertEquals(4L, counts.get("job.attempt.failed"));
            assertEquals(1L, counts.get("job.replayed"));
            assertTrue(events.stream().allMatch(e -> "test".equals(e.source())));
        }

        @Test
        @DisplayName("records outcome and replay metrics")
        void recordsMetrics() throws Exception {
            var registry = new SimpleMeterRegistry();
            JobRunner<String, String> runner = runner(p -> {
                if (p.equals("bad")) throw new RuntimeException("x");
                return p;
            }, 2, Duration.ZERO, null, new ChunkflowMetrics(registry));
            runner.start();
            runner.submit("ok", "good", 1);
            runner.submit("ko", "bad", 1);
            assertTrue(runner.join(WAIT));
            runner.retryFailed();
            assertTrue(runner.join(WAIT));

            assertEquals(1.0, registry.find("chunkflow.jobs.total").tag("outcome", "completed").counter().count());
            assertEquals(2.0, registry.find("chunkflow.jobs.total").tag("outcome", "failed").counter().count());
            assertEquals(1.0, registry.find("chunkflow.jobs.replayed").counter().count());
            assertEquals(3, registry.find("chunkflow.jobs.attempts").summary().count());
        }
    }
}
