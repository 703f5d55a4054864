/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Operator-facing HTTP boundary over the component lifecycle manager. Presentation
 * depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - status snapshot and manual eviction endpoints</li>
 *   <li>{@code presentation.exception} - maps lifecycle exceptions to HTTP status codes</li>
 * </ul>
 *
 * @see com.phillippitts.draco.presentation.controller
 * @since 1.0
 */
package com.phillippitts.draco.presentation;
