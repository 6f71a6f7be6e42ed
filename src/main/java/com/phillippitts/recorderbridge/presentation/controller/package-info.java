/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints (all under {@code /recorder}):
 * <ul>
 *   <li>{@code GET /devices} - capture devices in worker order</li>
 *   <li>{@code POST /session}, {@code DELETE /session} - open or close a recording session</li>
 *   <li>{@code POST /recording/start|stop|cancel} - control capture; stop returns samples</li>
 *   <li>{@code GET /status} - recording flag and whether a worker is live</li>
 *   <li>{@code DELETE /worker} - stop the audio worker</li>
 * </ul>
 *
 * <p>Controllers only delegate; failures are left to {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.recorderbridge.presentation.controller;
