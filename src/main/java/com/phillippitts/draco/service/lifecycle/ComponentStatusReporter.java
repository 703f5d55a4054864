package com.phillippitts.draco.service.lifecycle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Periodically logs a one-line summary of every component's state and the resident
 * memory estimate. Lightweight: reads snapshots only, never triggers loads.
 */
@Component
@ConditionalOnProperty(prefix = "components.status-log", name = "enabled", havingValue = "true", matchIfMissing = true)
class ComponentStatusReporter {

    private static final Logger LOG = LogManager.getLogger(ComponentStatusReporter.class);

    private final ComponentLifecycleManager manager;

    ComponentStatusReporter(ComponentLifecycleManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Scheduled(fixedRateString = "${components.status-log.interval-millis:60000}",
            initialDelayString = "${components.status-log.interval-millis:60000}")
    void logStatusSummary() {
        LOG.info(summarize());
    }

    /** Visible for tests */
    String summarize() {
        Map<String, ComponentStatus> status = manager.status();
        if (status.isEmpty()) {
            return "Components: none registered";
        }
        StringBuilder sb = new StringBuilder("Components: ");
        status.values().forEach(s -> sb.append(s.name())
                .append('=').append(s.state())
                .append(String.format(Locale.ROOT, "(idle %.0fs, uses %d) ", s.idleSeconds(), s.accessCount())));
        sb.append(String.format(Locale.ROOT, "loadedMb~%.0f", manager.loadedMemoryMb()));
        return sb.toString();
    }
}
