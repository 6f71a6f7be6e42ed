/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - HTTP binding of the recorder operations</li>
 *   <li>{@code presentation.exception} - Mapping of recorder errors to HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.recorderbridge.presentation;
