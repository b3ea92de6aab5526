package com.phillippitts.photobatch.service.schedule;

import com.phillippitts.photobatch.config.WorkerPoolFactory;
import com.phillippitts.photobatch.config.properties.WorkerPoolProperties;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class BoundedConcurrencySchedulerTest {

    private EventCapturingPublisher publisher;
    private RunState state;
    private BoundedConcurrencyScheduler scheduler;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        state = new RunState();
        scheduler = new BoundedConcurrencyScheduler(new WorkerPoolFactory(new WorkerPoolProperties()),
                new ProgressSink(publisher), new ProcessingMetrics(new SimpleMeterRegistry()), 5);
    }

    @Test
    void processesEveryInputAndCountsSuccesses() {
        List<Path> inputs = inputs(40);
        Map<Path, AtomicInteger> calls = new ConcurrentHashMap<>();

        StageResult result = scheduler.run(inputs, 4, p -> {
            calls.computeIfAbsent(p, k -> new AtomicInteger()).incrementAndGet();
            return true;
        }, state, PoolSizeAdvisor.none());

        assertThat(result.succeeded()).isEqualTo(40);
        assertThat(result.failed()).isZero();
        assertThat(result.cancelled()).isFalse();
        assertThat(state.processedFiles()).isEqualTo(40);
        assertThat(calls).hasSize(40).allSatisfy((p, n) -> assertThat(n.get()).isEqualTo(1));
        assertThat(publisher.progress()).hasSize(40);
    }

    @Test
    void shouldNeverExceedInFlightWindow() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        scheduler.run(inputs(30), 2, p -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleep(5);
            running.decrementAndGet();
            return true;
        }, state, PoolSizeAdvisor.none());

        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(state.processedFiles()).isEqualTo(30);
    }

    @Test
    void failedJobsAreNotCountedAsSuccess() {
        StageResult result = scheduler.run(inputs(6), 2,
                p -> !p.getFileName().toString().startsWith("img-1"), state, PoolSizeAdvisor.none());

        assertThat(result.succeeded()).isEqualTo(5);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(state.processedFiles()).isEqualTo(5);
        // recording the error is the pipeline's job
        assertThat(state.errorCount()).isZero();
    }

    @Test
    void escapingExceptionBecomesErrorEntry() {
        StageResult result = scheduler.run(inputs(3), 2, p -> {
            if (p.getFileName().toString().equals("img-2.jpg")) {
                throw new IllegalStateException("kaboom");
            }
            return true;
        }, state, PoolSizeAdvisor.none());

        assertThat(result.failed()).isEqualTo(1);
        assertThat(state.errorLog()).singleElement().satisfies(e -> {
            assertThat(e.filename()).isEqualTo("img-2.jpg");
            assertThat(e.message()).isEqualTo("kaboom");
        });
    }

    @Test
    void shouldStopDispatchAndDrainInFlightOnCancel() {
        AtomicInteger started = new AtomicInteger();

        StageResult result = scheduler.run(inputs(20), 1, p -> {
            started.incrementAndGet();
            state.cancel();
            sleep(20);
            return true;
        }, state, PoolSizeAdvisor.none());

        assertThat(result.cancelled()).isTrue();
        // window is workers * in-flight factor = 2; both dispatched jobs complete and count
        assertThat(started.get()).isEqualTo(2);
        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(state.processedFiles()).isEqualTo(2);
    }

    @Test
    void cancelledBeforeStartDispatchesNothing() {
        state.cancel();
        AtomicInteger started = new AtomicInteger();

        StageResult result = scheduler.run(inputs(5), 2, p -> started.incrementAndGet() > 0, state,
                PoolSizeAdvisor.none());

        assertThat(started.get()).isZero();
        assertThat(result.completed()).isZero();
        assertThat(result.cancelled()).isTrue();
    }

    @Test
    void shouldRedispatchQueuedJobsExactlyOnceOnRebuild() throws InterruptedException {
        List<Path> inputs = inputs(12);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger adviceCalls = new AtomicInteger();
        PoolSizeAdvisor advisor = () -> {
            int call = adviceCalls.incrementAndGet();
            if (call == 2) {
                return OptionalInt.of(3);
            }
            if (call == 3) {
                release.countDown();
            }
            return OptionalInt.empty();
        };
        Map<Path, AtomicInteger> calls = new ConcurrentHashMap<>();

        StageResult result = scheduler.run(inputs, 1, p -> {
            calls.computeIfAbsent(p, k -> new AtomicInteger()).incrementAndGet();
            if (p.equals(inputs.get(0))) {
                awaitRelease(release);
            }
            return true;
        }, state, advisor);

        assertThat(result.rebuilds()).isEqualTo(1);
        assertThat(result.succeeded()).isEqualTo(12);
        assertThat(state.processedFiles()).isEqualTo(12);
        assertThat(calls).hasSize(12).allSatisfy((p, n) -> assertThat(n.get()).isEqualTo(1));
    }

    @Test
    void shouldRunWithdrawnJobsWhenCancelledRightAfterShrinkingRebuild() {
        // 4 workers, window 8: four jobs block on the old pool while four wait in its queue
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger adviceCalls = new AtomicInteger();
        PoolSizeAdvisor advisor = () -> {
            int call = adviceCalls.incrementAndGet();
            if (call == 2) {
                await().atMost(Duration.ofSeconds(5)).until(() -> started.get() >= 4);
                return OptionalInt.of(1);
            }
            if (call == 3) {
                state.cancel();
                release.countDown();
            }
            return OptionalInt.empty();
        };
        Map<Path, AtomicInteger> calls = new ConcurrentHashMap<>();

        StageResult result = scheduler.run(inputs(12), 4, p -> {
            calls.computeIfAbsent(p, k -> new AtomicInteger()).incrementAndGet();
            if (started.incrementAndGet() <= 4) {
                awaitRelease(release);
            }
            return true;
        }, state, advisor);

        assertThat(result.rebuilds()).isEqualTo(1);
        assertThat(result.cancelled()).isTrue();
        assertThat(calls).hasSize(8).allSatisfy((p, n) -> assertThat(n.get()).isEqualTo(1));
        assertThat(result.succeeded()).isEqualTo(8);
        assertThat(state.processedFiles()).isEqualTo(8);
    }

    @Test
    void emptyInputReturnsImmediately() {
        StageResult result = scheduler.run(List.of(), 4, p -> true, state, PoolSizeAdvisor.none());

        assertThat(result.completed()).isZero();
        assertThat(result.cancelled()).isFalse();
    }

    @Test
    void rejectsNonPositiveWorkers() {
        assertThatThrownBy(() -> scheduler.run(inputs(1), 0, p -> true, state, PoolSizeAdvisor.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Path> inputs(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> Path.of("in", "img-" + i + ".jpg"))
                .collect(Collectors.toList());
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitRelease(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
