package com.phillippitts.draco.service.metrics;

import com.phillippitts.draco.service.lifecycle.ComponentLifecycleManager;
import com.phillippitts.draco.service.lifecycle.event.ComponentEvictedEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadFailedEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadTimeoutEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation of component lifecycle events.
 *
 * <p>Provides:
 * <ul>
 *   <li>Load latency per component, tagged by outcome (success, failure)</li>
 *   <li>Load failure and load-wait timeout counts per component</li>
 *   <li>Eviction counts per component and reason (explicit, idle, shutdown, ...)</li>
 *   <li>Gauge of the memory estimate of currently loaded components</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ComponentLifecycleMetrics {

    private static final String METRIC_PREFIX = "draco.component";

    private final MeterRegistry registry;

    public ComponentLifecycleMetrics(MeterRegistry registry, ComponentLifecycleManager manager) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".memory.loaded", manager, ComponentLifecycleManager::loadedMemoryMb)
                .description("Estimated memory of loaded components")
                .baseUnit("megabytes")
                .register(registry);
    }

    @EventListener
    public void onLoaded(ComponentLoadedEvent event) {
        recordLoadLatency(event.component(), "success", event.durationMs());
    }

    @EventListener
    public void onLoadFailed(ComponentLoadFailedEvent event) {
        recordLoadLatency(event.component(), "failure", event.durationMs());
        Counter.builder(METRIC_PREFIX + ".load.failure")
                .description("Number of failed component loads")
                .tag("component", event.component())
                .tag("cause", event.cause() == null ? "unknown" : event.cause().getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onLoadTimeout(ComponentLoadTimeoutEvent event) {
        Counter.builder(METRIC_PREFIX + ".load.timeout")
                .description("Number of callers that gave up waiting for an in-flight load")
                .tag("component", event.component())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onEvicted(ComponentEvictedEvent event) {
        Counter.builder(METRIC_PREFIX + ".eviction")
                .description("Number of released component instances")
                .tag("component", event.component())
                .tag("reason", event.reason().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private void recordLoadLatency(String component, String outcome, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".load.latency")
                .description("Time taken to construct a component")
                .tag("component", component)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
