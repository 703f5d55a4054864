package com.phillippitts.draco;

import com.phillippitts.draco.service.lifecycle.ComponentHandle;
import com.phillippitts.draco.service.lifecycle.ComponentLifecycleManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
    properties = {
        "components.reclaim-memory-on-evict=false",
        "components.status-log.enabled=false"
    }
)
@AutoConfigureMockMvc
class DracoApplicationTests {

    @Autowired
    private ComponentLifecycleManager manager;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
        assertThat(manager.isClosed()).isFalse();
    }

    @Test
    void shouldServeStatusForRegisteredComponent() throws Exception {
        ComponentHandle<String> handle = manager.register("greeter", () -> "hello", null, 12);
        handle.acquire();

        mockMvc.perform(get("/components"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.greeter.state").value("LOADED"))
                .andExpect(jsonPath("$.components.greeter.accessCount").value(1));

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.component.status").value("UP"))
                .andExpect(jsonPath("$.components.component.details.greeter").value("loaded"));
    }

    @Test
    void shouldRecordEvictionMetricsThroughEvents() throws Exception {
        manager.register("cache", Object::new);
        manager.acquire("cache");

        mockMvc.perform(post("/components/cache/evict"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("NOT_LOADED"));

        Counter evictions = meterRegistry.find("draco.component.eviction")
                .tag("component", "cache")
                .tag("reason", "explicit")
                .counter();
        assertThat(evictions).isNotNull();
        assertThat(evictions.count()).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNotFoundForUnknownComponent() throws Exception {
        mockMvc.perform(post("/components/missing/evict"))
                .andExpect(status().isNotFound());
    }
}
