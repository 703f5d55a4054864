package com.phillippitts.draco.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the component lifecycle manager.
 *
 * <p>Example application.properties:
 * <pre>
 * components.default-idle-timeout-seconds=60
 * components.load-wait-timeout-millis=30000
 * components.reclaim-memory-on-evict=true
 * components.scheduler.pool-size=1
 * components.scheduler.thread-name-prefix=component-evict-
 * </pre>
 */
@ConfigurationProperties(prefix = "components")
@Validated
public class ComponentLifecycleProperties {

    /** Idle timeout used when a collaborator schedules eviction without an explicit timeout. */
    @Positive(message = "Default idle timeout must be positive")
    private long defaultIdleTimeoutSeconds = 60;

    /** Ceiling on how long acquire waits for another caller's in-flight load. */
    @Positive(message = "Load wait timeout must be positive")
    private long loadWaitTimeoutMillis = 30_000;

    /** Memory estimate reported for components registered without one. */
    @PositiveOrZero(message = "Default memory estimate must not be negative")
    private double defaultEstimatedMemoryMb = 100;

    /** Hint the JVM to collect garbage after each eviction. */
    private boolean reclaimMemoryOnEvict = true;

    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    public long getDefaultIdleTimeoutSeconds() {
        return defaultIdleTimeoutSeconds;
    }

    public void setDefaultIdleTimeoutSeconds(long defaultIdleTimeoutSeconds) {
        this.defaultIdleTimeoutSeconds = defaultIdleTimeoutSeconds;
    }

    public long getLoadWaitTimeoutMillis() {
        return loadWaitTimeoutMillis;
    }

    public void setLoadWaitTimeoutMillis(long loadWaitTimeoutMillis) {
        this.loadWaitTimeoutMillis = loadWaitTimeoutMillis;
    }

    public double getDefaultEstimatedMemoryMb() {
        return defaultEstimatedMemoryMb;
    }

    public void setDefaultEstimatedMemoryMb(double defaultEstimatedMemoryMb) {
        this.defaultEstimatedMemoryMb = defaultEstimatedMemoryMb;
    }

    public boolean isReclaimMemoryOnEvict() {
        return reclaimMemoryOnEvict;
    }

    public void setReclaimMemoryOnEvict(boolean reclaimMemoryOnEvict) {
        this.reclaimMemoryOnEvict = reclaimMemoryOnEvict;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Eviction scheduler configuration.
     */
    public static class SchedulerProperties {
        @Positive(message = "Scheduler pool size must be positive")
        private int poolSize = 1;

        @NotBlank(message = "Scheduler thread name prefix must not be blank")
        private String threadNamePrefix = "component-evict-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
