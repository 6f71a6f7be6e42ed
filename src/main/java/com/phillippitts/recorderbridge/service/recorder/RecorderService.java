package com.phillippitts.recorderbridge.service.recorder;

import java.util.List;

/**
 * Caller-facing recorder operations. Every method is safe to call from any thread; calls are
 * serialized against the single audio worker.
 *
 * <p>Session lifecycle (enforced by the worker, which rejects out-of-order commands):
 * <pre>
 * Uninitialized → initRecordingSession → Ready → startRecording → Recording
 * Recording → stopRecording | cancelRecording → Ready → closeRecordingSession → Uninitialized
 * </pre>
 *
 * <p>Every failure is reported as a {@link com.phillippitts.recorderbridge.exception.RecorderException}.
 * Nothing is retried.
 */
public interface RecorderService {

    /** Lists capture devices in worker order. Device ids equal their labels. */
    List<DeviceInfo> enumerateRecordingDevices();

    /** Opens a session on {@code deviceName}. A null name is rejected as AUDIO_ERROR without reaching the worker. */
    void initRecordingSession(String deviceName);

    /** Closes the session; clears the recording flag on success. */
    void closeRecordingSession();

    /** Starts capture; sets the recording flag on success. */
    void startRecording();

    /** Stops capture and returns the recorded samples; clears the recording flag on success. */
    float[] stopRecording();

    /**
     * Stops capture and discards the samples; clears the recording flag on success.
     * The worker receives the same command as for {@link #stopRecording()}; there is no abort.
     */
    void cancelRecording();

    /** Tells the worker to exit and empties the registry. No-op when no worker is running. */
    void closeWorker();

    /** Last known recording status. */
    boolean isRecording();

    boolean isWorkerRunning();
}
