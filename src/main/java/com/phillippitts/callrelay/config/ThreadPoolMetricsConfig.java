package com.phillippitts.callrelay.config;

import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Gauges for the pipeline pool and the two shared in-memory tables.
 *
 * <ul>
 *   <li>{@code relay.pipeline.pool.active} / {@code .queued} / {@code .size}</li>
 *   <li>{@code relay.connections.live} - registered transport connections</li>
 *   <li>{@code relay.calls.retained} - sessions held by the store, ended ones included</li>
 * </ul>
 *
 * <p>Also logs a pool health line every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
    }

    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("relay.pipeline.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the pipeline pool")
                    .register(registry);

            Gauge.builder("relay.pipeline.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Pipeline threads actively executing tasks")
                    .register(registry);

            Gauge.builder("relay.pipeline.pool.queued", executor, e -> e.getQueue().size())
                    .description("Pipeline tasks waiting in the queue")
                    .register(registry);
        };
    }

    @Bean
    public MeterBinder relayStateMetrics(ConnectionRegistry connectionRegistry, CallSessionStore callSessionStore) {
        return registry -> {
            Gauge.builder("relay.connections.live", connectionRegistry, ConnectionRegistry::size)
                    .description("Registered transport connections")
                    .register(registry);

            Gauge.builder("relay.calls.retained", callSessionStore, CallSessionStore::size)
                    .description("Call sessions held in memory")
                    .register(registry);
        };
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Pipeline pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
