package com.phillippitts.callrelay.config;

import com.phillippitts.callrelay.config.properties.ThreadPoolProperties;
import com.phillippitts.callrelay.util.KeyedSerialExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors and scheduler for asynchronous call processing.
 *
 * <p>Two pools are kept apart on purpose:
 * <ul>
 *   <li>{@code pipelineExecutor} - the per-call ordered work queue and channel notifications.
 *       Rejection policy {@link ThreadPoolExecutor.AbortPolicy}. Submitters include socket
 *       threads and threads holding a call's store lock, so a saturated pool must never run
 *       work on the submitting thread; callers log and drop rejected work.</li>
 *   <li>{@code capabilityExecutor} - the external calls themselves. Pipeline threads wait on
 *       these with a timeout. Rejection policy {@link ThreadPoolExecutor.AbortPolicy}, so a
 *       saturated pool surfaces as a capability failure rather than blocking the caller.</li>
 * </ul>
 *
 * <p>MDC propagation: both pools copy the Log4j2 ThreadContext of the submitting thread so
 * {@code connectionId}/{@code callId} survive the hop into worker threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        return buildExecutor(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "capabilityExecutor")
    public Executor capabilityExecutor() {
        return buildExecutor(threadPoolProperties.getCapability(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Per-call ordered work queue layered on the pipeline pool. Tasks sharing a call id run
     * one after another in submission order; different calls run in parallel.
     */
    @Bean
    public KeyedSerialExecutor callWorkQueue() {
        return new KeyedSerialExecutor(pipelineExecutor());
    }

    /**
     * Scheduler for delayed audio cleanup and the periodic sweeps. Named {@code taskScheduler}
     * so {@code @Scheduled} methods use it too. Pending tasks are cancelled on shutdown.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("relay-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props, RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
