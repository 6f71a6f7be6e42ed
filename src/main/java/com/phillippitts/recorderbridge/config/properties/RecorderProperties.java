package com.phillippitts.recorderbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the audio worker and its request/response protocol.
 */
@Validated
@ConfigurationProperties(prefix = "recorder.worker")
public class RecorderProperties {

    /** Name given to the worker thread; shows up in logs and thread dumps. */
    @NotBlank
    private final String threadName;

    /**
     * How long a caller waits for the worker's response. Zero waits indefinitely.
     * When a positive timeout elapses the worker is considered stalled and is replaced on next use.
     */
    @NotNull
    private final Duration responseTimeout;

    @ConstructorBinding
    public RecorderProperties(String threadName, Duration responseTimeout) {
        this.threadName = (threadName == null || threadName.isBlank()) ? "audio-worker" : threadName;
        this.responseTimeout = responseTimeout == null ? Duration.ZERO : responseTimeout;
        if (this.responseTimeout.isNegative()) {
            throw new IllegalArgumentException("recorder.worker.response-timeout must not be negative");
        }
    }

    public String getThreadName() {
        return threadName;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public boolean hasResponseTimeout() {
        return !responseTimeout.isZero();
    }
}
