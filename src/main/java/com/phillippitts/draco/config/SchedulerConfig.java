package com.phillippitts.draco.config;

import com.phillippitts.draco.config.properties.ComponentLifecycleProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the scheduler that runs deferred idle-eviction checks.
 *
 * <p>Eviction checks are short (a lock, a timestamp comparison and, when idle, an unloader
 * call), so a single daemon thread is the default. Pool size and thread naming are tuned via
 * {@code components.scheduler.*}.
 *
 * <p>The scheduler is also picked up by {@code @EnableScheduling} for the periodic status
 * summary.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger LOG = LogManager.getLogger(SchedulerConfig.class);

    private final ComponentLifecycleProperties properties;

    public SchedulerConfig(ComponentLifecycleProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the scheduler for idle-eviction checks.
     *
     * <p>Cancelled checks are removed from the work queue immediately so debounced
     * reschedules do not accumulate. Pending checks are dropped on shutdown; the lifecycle
     * manager evicts everything itself when the context closes.
     *
     * @return initialized scheduler
     */
    @Bean(name = "componentEvictionScheduler")
    public ThreadPoolTaskScheduler componentEvictionScheduler() {
        ComponentLifecycleProperties.SchedulerProperties schedulerProps = properties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerProps.getPoolSize());
        scheduler.setThreadNamePrefix(schedulerProps.getThreadNamePrefix());
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> LOG.error("Scheduled component task failed", t));
        scheduler.initialize();
        return scheduler;
    }
}
