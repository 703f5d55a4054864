package com.phillippitts.draco.service.health;

import com.phillippitts.draco.service.lifecycle.ComponentLifecycleManager;
import com.phillippitts.draco.service.lifecycle.ComponentState;
import com.phillippitts.draco.service.lifecycle.ComponentStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for managed components.
 *
 * <ul>
 *   <li>UP: no component is in ERROR (unloaded components are healthy, they load on demand)</li>
 *   <li>DEGRADED: at least one component's last load failed</li>
 *   <li>DOWN: the manager has been closed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ComponentHealthIndicator implements HealthIndicator {

    private final ComponentLifecycleManager manager;

    public ComponentHealthIndicator(ComponentLifecycleManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        Map<String, ComponentStatus> status = manager.status();
        long failed = status.values().stream()
                .filter(s -> s.state() == ComponentState.ERROR)
                .count();

        Health.Builder builder = new Health.Builder();
        if (manager.isClosed()) {
            builder.down().withDetail("status", "Component manager closed");
        } else if (failed > 0) {
            builder.status("DEGRADED").withDetail("status", failed + " component(s) failed to load");
        } else {
            builder.up().withDetail("status", status.isEmpty()
                    ? "No components registered"
                    : "All components loadable");
        }

        status.values().forEach(s -> builder.withDetail(s.name(), describe(s)));
        builder.withDetail("loadedMemoryMb", manager.loadedMemoryMb());
        return builder.build();
    }

    private String describe(ComponentStatus s) {
        String state = s.state().name().toLowerCase(Locale.ROOT);
        if (s.state() == ComponentState.ERROR && s.lastFailure() != null) {
            return state + ": " + s.lastFailure();
        }
        return state;
    }
}
