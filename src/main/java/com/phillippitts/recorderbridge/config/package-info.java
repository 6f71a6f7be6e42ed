/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.recorderbridge.config.WorkerConfig} - Production
 *       {@code WorkerSpawner} backed by Java Sound</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code recorder.worker.*} and {@code audio.capture.*}
 *       properties</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filter)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.recorderbridge.config;
