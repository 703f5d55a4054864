/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.lifecycle} - on-demand loading, sharing and idle eviction of heavy components</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation of lifecycle events</li>
 *   <li>{@code service.health} - Actuator health of managed components</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.draco.service;
