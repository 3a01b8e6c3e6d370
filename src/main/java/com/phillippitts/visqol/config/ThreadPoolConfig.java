package com.phillippitts.visqol.config;

import com.phillippitts.visqol.config.properties.BatchProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs batch measurements.
 *
 * <p>Pool sizes are configured via {@link BatchProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final BatchProperties batchProperties;

    public ThreadPoolConfig(BatchProperties batchProperties) {
        this.batchProperties = batchProperties;
    }

    /**
     * Creates the bounded pool batch pairs run on.
     *
     * <p>Pool sizing configured via {@code visqol.batch.*} properties:
     * <ul>
     *   <li>Core and max pool: {@code concurrency} (default: available processors)</li>
     *   <li>Queue: default 100 pairs - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the submitting thread measures the pair itself,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread.
     *
     * @return Configured executor for batch measurement
     */
    @Bean(name = "batchExecutor")
    public Executor batchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchProperties.getConcurrency());
        executor.setMaxPoolSize(batchProperties.getConcurrency());
        executor.setQueueCapacity(batchProperties.getQueueCapacity());
        executor.setThreadNamePrefix(batchProperties.getThreadNamePrefix());
        executor.setKeepAliveSeconds(batchProperties.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    // Visible for tests
    static TaskDecorator mdcPropagatingDecorator() {
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
