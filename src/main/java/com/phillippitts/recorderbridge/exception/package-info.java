/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.recorderbridge.exception.RecorderBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.recorderbridge.exception.RecorderException} - Typed failure of a
 *       recorder operation, tagged with a {@link com.phillippitts.recorderbridge.exception.RecorderErrorKind}</li>
 *   <li>{@link com.phillippitts.recorderbridge.exception.AudioDeviceException} - Thrown inside the
 *       audio worker when a capture device cannot be opened; surfaces to callers as an
 *       {@code AUDIO_ERROR}</li>
 * </ul>
 *
 * <p>{@code RecorderException} maps to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.recorderbridge.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.recorderbridge.exception;
