package com.phillippitts.recorderbridge.service.events;

import com.phillippitts.recorderbridge.exception.RecorderErrorKind;

import java.time.Instant;

/**
 * Published when an operation fails because the audio worker could not be reached
 * (spawn failure, closed channel, missing or late response).
 */
public record WorkerFailureEvent(String operation, RecorderErrorKind kind, Instant at) { }
