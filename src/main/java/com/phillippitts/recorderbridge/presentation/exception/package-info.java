/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code AUDIO_ERROR} → 422 Unprocessable Entity</li>
 *   <li>{@code NO_ACTIVE_RECORDING} → 409 Conflict</li>
 *   <li>{@code SEND_ERROR}, {@code RECEIVE_ERROR}, {@code THREAD_NOT_INITIALIZED} → 503 Service Unavailable</li>
 *   <li>{@code LOCK_ERROR} → 500 Internal Server Error</li>
 *   <li>Invalid request body → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "AUDIO_ERROR",
 *   "message": "Audio error: No active recording session",
 *   "details": "No active recording session",
 *   "timestamp": "2026-10-19T09:12:03.114Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.recorderbridge.exception.RecorderErrorKind
 * @since 1.0
 */
package com.phillippitts.recorderbridge.presentation.exception;
