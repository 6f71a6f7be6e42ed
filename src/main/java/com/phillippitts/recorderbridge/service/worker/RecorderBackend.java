package com.phillippitts.recorderbridge.service.worker;

import java.util.List;

/**
 * Device-facing half of the audio worker.
 *
 * <p>Only ever called from the worker thread, so implementations need not be thread-safe.
 * Session-state violations (start without a session, stop while idle) are reported by throwing;
 * the worker turns any exception into a {@link RecorderResponse.Error}.
 *
 * <pre>
 * no session → openSession → READY → startRecording → RECORDING → stopRecording → READY
 * READY → closeSession → no session
 * </pre>
 */
public interface RecorderBackend extends AutoCloseable {

    /** Labels of the capture devices currently available, in a stable order. */
    List<String> listDevices();

    /** Opens a session on the named device, replacing any idle session. */
    void openSession(String deviceName);

    /** Closes the current session, discarding any capture in progress. No-op without a session. */
    void closeSession();

    void startRecording();

    /** Stops capture and returns the recorded samples. */
    float[] stopRecording();

    /** Releases every device resource. Idempotent. */
    @Override
    void close();
}
