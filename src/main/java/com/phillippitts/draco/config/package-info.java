/**
 * Application-wide configuration beans and properties.
 *
 * <p>{@link com.phillippitts.draco.config.SchedulerConfig} provides the scheduler that runs
 * deferred idle-eviction checks. Tunables are bound from {@code components.*} in
 * {@code application.properties} by
 * {@link com.phillippitts.draco.config.properties.ComponentLifecycleProperties}.
 *
 * @since 1.0
 */
package com.phillippitts.draco.config;
