/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.draco.exception.DracoException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.draco.exception.UnknownComponentException} - Thrown when
 *       a lifecycle operation names a component that was never registered</li>
 *   <li>{@link com.phillippitts.draco.exception.ComponentLoadException} - Thrown when a
 *       component loader fails; the caller receives the wrapped cause</li>
 *   <li>{@link com.phillippitts.draco.exception.ComponentLoadTimeoutException} - Thrown when
 *       a caller waits too long for another caller's in-flight load</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, carry the component name, and map to HTTP status codes
 * via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.draco.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.draco.exception;
