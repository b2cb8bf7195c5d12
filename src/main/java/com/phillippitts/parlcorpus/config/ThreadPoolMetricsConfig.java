package com.phillippitts.parlcorpus.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes session executor metrics via Micrometer.
 *
 * <ul>
 *   <li>session.pool.size - Current number of threads in the pool</li>
 *   <li>session.pool.active - Number of sessions being processed</li>
 *   <li>session.pool.queued - Number of sessions waiting in the queue</li>
 *   <li>session.pool.completed - Cumulative count of processed sessions</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<Executor> sessionExecutorProvider;

    public ThreadPoolMetricsConfig(@Qualifier("sessionExecutor") ObjectProvider<Executor> sessionExecutorProvider) {
        this.sessionExecutorProvider = sessionExecutorProvider;
    }

    @Bean
    public MeterBinder sessionExecutorMetrics() {
        return registry -> {
            if (!(sessionExecutorProvider.getIfAvailable() instanceof ThreadPoolTaskExecutor taskExecutor)) {
                LOG.debug("Session executor is not a ThreadPoolTaskExecutor; pool metrics not registered");
                return;
            }
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();

            Gauge.builder("session.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the session pool")
                    .register(registry);

            Gauge.builder("session.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively processing sessions")
                    .register(registry);

            Gauge.builder("session.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of sessions waiting in the queue")
                    .register(registry);

            Gauge.builder("session.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of processed sessions")
                    .register(registry);

            LOG.info("Session thread pool metrics registered: session.pool.*");
        };
    }
}
