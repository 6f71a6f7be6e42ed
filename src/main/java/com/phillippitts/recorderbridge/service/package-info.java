/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.recorder} - Caller-facing operations, registry and dispatcher</li>
 *   <li>{@code service.worker} - Channel protocol and the audio worker loop</li>
 *   <li>{@code service.audio} - Capture format and the Java Sound backend</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - Failure
 *       events, Micrometer instrumentation and actuator health</li>
 * </ul>
 *
 * <p>Services throw domain exceptions, never HTTP exceptions, and use constructor injection.
 *
 * @since 1.0
 */
package com.phillippitts.recorderbridge.service;
