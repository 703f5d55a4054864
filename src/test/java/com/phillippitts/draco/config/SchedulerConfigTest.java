package com.phillippitts.draco.config;

import com.phillippitts.draco.config.properties.ComponentLifecycleProperties;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerConfigTest {

    @Test
    void shouldCreateSchedulerWithDefaultConfiguration() {
        SchedulerConfig config = new SchedulerConfig(new ComponentLifecycleProperties());
        ThreadPoolTaskScheduler scheduler = config.componentEvictionScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("component-evict-");
            assertThat(scheduler.isDaemon()).isTrue();
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void shouldRunScheduledTaskOnNamedThread() throws InterruptedException {
        ComponentLifecycleProperties properties = new ComponentLifecycleProperties();
        properties.getScheduler().setThreadNamePrefix("evict-test-");
        ThreadPoolTaskScheduler scheduler = new SchedulerConfig(properties).componentEvictionScheduler();
        try {
            CountDownLatch ran = new CountDownLatch(1);
            AtomicReference<String> threadName = new AtomicReference<>();

            scheduler.schedule(() -> {
                threadName.set(Thread.currentThread().getName());
                ran.countDown();
            }, Instant.now().plusMillis(50));

            assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("evict-test-");
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void shouldDropCancelledTasksFromQueue() {
        ThreadPoolTaskScheduler scheduler = new SchedulerConfig(new ComponentLifecycleProperties())
                .componentEvictionScheduler();
        try {
            ScheduledFuture<?> future = scheduler.schedule(() -> { }, Instant.now().plusSeconds(60));
            future.cancel(false);

            assertThat(scheduler.getScheduledThreadPoolExecutor().getQueue()).isEmpty();
        } finally {
            scheduler.shutdown();
        }
    }
}
