package com.phillippitts.recorderbridge.util;

import java.time.Duration;

/**
 * Standard timeout values for capture thread management.
 *
 * @see com.phillippitts.recorderbridge.service.audio.capture.JavaSoundRecorderBackend
 * @since 1.0
 */
public final class CaptureTimeouts {

    /**
     * Timeout for the capture thread to terminate during a normal stop.
     *
     * <p>The capture thread may be blocked in {@code TargetDataLine.read}; one second lets the
     * last chunk drain.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the capture thread when a session is closed with capture still running.
     * Captured data is discarded in that case, so waiting longer buys nothing.
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Pause after a read that returned no data, while the line is still open. */
    public static final Duration EMPTY_READ_BACKOFF = Duration.ofMillis(2);

    private CaptureTimeouts() {
        // Utility class - prevent instantiation
    }
}
