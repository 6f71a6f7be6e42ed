package com.phillippitts.recorderbridge.presentation.exception;

import com.phillippitts.recorderbridge.exception.RecorderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void audioErrorReturns422WithWorkerDetail() {
        RecorderException ex = RecorderException.audioError("No active recording session");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleRecorderFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("AUDIO_ERROR");
        assertThat(response.getBody().message()).isEqualTo("Audio error: No active recording session");
        assertThat(response.getBody().details()).isEqualTo("No active recording session");
    }

    @Test
    void unreachableWorkerReturns503() {
        assertThat(handler.handleRecorderFailure(RecorderException.sendError("closed", null)).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleRecorderFailure(RecorderException.receiveError("closed")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleRecorderFailure(RecorderException.threadNotInitialized()).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void noActiveRecordingReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleRecorderFailure(RecorderException.noActiveRecording());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().errorCode()).isEqualTo("NO_ACTIVE_RECORDING");
    }

    @Test
    void lockErrorReturns500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleRecorderFailure(RecorderException.lockError("interrupted", new InterruptedException()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("LOCK_ERROR");
    }

    @Test
    void recorderFailureContainsRecentTimestamp() {
        Instant beforeCall = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleRecorderFailure(RecorderException.audioError("x"));

        assertThat(response.getBody().timestamp()).isAfter(beforeCall);
    }

    @Test
    void unexpectedErrorDoesNotExposeInternals() {
        RuntimeException ex = new RuntimeException("NullPointerException at line 42 in /internal/Secret.java");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnexpected(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("Secret.java");
    }
}
