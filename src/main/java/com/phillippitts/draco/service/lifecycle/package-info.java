/**
 * On-demand lifecycle management for heavy, memory-hungry components.
 *
 * <p>{@link com.phillippitts.draco.service.lifecycle.ComponentLifecycleManager} is the single
 * owner of every component instance. Collaborators (model loader, speech pipeline, vision
 * pipeline, automation driver, search client) receive it by injection, register their
 * loaders once and then acquire instances on demand through a
 * {@link com.phillippitts.draco.service.lifecycle.ComponentHandle}.
 *
 * <p>Instances are evicted explicitly, on shutdown, or by a debounced idle check armed with
 * {@code scheduleEviction}. Every transition is published as an application event from
 * {@code service.lifecycle.event}.
 *
 * @since 1.0
 */
package com.phillippitts.draco.service.lifecycle;
