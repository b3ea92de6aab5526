package com.phillippitts.photobatch.config;

import com.phillippitts.photobatch.config.properties.WorkerPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Builds the fixed-size executors of the standard-image stage.
 *
 * <p>A {@link ThreadPoolTaskExecutor} cannot be resized in place without disturbing queued work,
 * so the scheduler asks for a fresh pool whenever the worker count changes.
 *
 * <p>Pool shape:
 * <ul>
 *   <li>Core = max = {@code workers}; threads time out after {@code keep-alive-seconds}</li>
 *   <li>Queue: bounded to the in-flight limit, so dispatch never has to be rejected</li>
 *   <li>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy} as backpressure</li>
 *   <li>Shutdown never blocks the caller and never interrupts running tasks</li>
 * </ul>
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread (the run id)
 * into the worker for the duration of each task.
 */
@Component
public class WorkerPoolFactory {

    private final WorkerPoolProperties properties;

    public WorkerPoolFactory(WorkerPoolProperties properties) {
        this.properties = properties;
    }

    /**
     * @param workers       thread count, positive
     * @param queueCapacity tasks that may wait for a thread
     * @return an initialized executor owned by the caller
     */
    public ThreadPoolTaskExecutor create(int workers, int queueCapacity) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(1, queueCapacity));
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setKeepAliveSeconds(properties.getKeepAliveSeconds());
        executor.setAllowCoreThreadTimeOut(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(0);
        executor.setTaskDecorator(mdcDecorator());
        executor.initialize();
        return executor;
    }

    public int inFlightLimit(int workers) {
        return workers * properties.getInFlightFactor();
    }

    static TaskDecorator mdcDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
