package com.phillippitts.draco.presentation.controller;

import com.phillippitts.draco.service.lifecycle.ComponentLifecycleManager;
import com.phillippitts.draco.service.lifecycle.ComponentStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Status and manual eviction of managed components, the operator view the desktop UI
 * shows in its status panel.
 */
@RestController
@RequestMapping("/components")
class ComponentController {

    private static final Logger LOG = LogManager.getLogger(ComponentController.class);

    private final ComponentLifecycleManager manager;

    ComponentController(ComponentLifecycleManager manager) {
        this.manager = manager;
    }

    @GetMapping
    ResponseEntity<ComponentsView> status() {
        return ResponseEntity.ok(new ComponentsView(manager.status(), manager.loadedMemoryMb()));
    }

    @PostMapping("/{name}/evict")
    ResponseEntity<ComponentStatus> evict(@PathVariable("name") String name) {
        LOG.info("Eviction requested over HTTP: {}", name);
        manager.evictComponent(name);
        return ResponseEntity.ok(manager.status(name));
    }

    @PostMapping("/evict-all")
    ResponseEntity<Void> evictAll() {
        LOG.info("Eviction of all components requested over HTTP");
        manager.evictAll();
        return ResponseEntity.noContent().build();
    }

    record ComponentsView(Map<String, ComponentStatus> components, double loadedMemoryMb) {
    }
}
