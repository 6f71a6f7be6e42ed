package com.phillippitts.recorderbridge.service.worker;

import java.util.Objects;

/**
 * Commands accepted by the audio worker. Immutable once sent.
 *
 * <p>The worker answers every command with exactly one {@link RecorderResponse}, in the order
 * the commands were sent.
 */
public sealed interface RecorderCommand {

    /** Lists capture devices; answered with {@link RecorderResponse.RecordingDeviceList}. */
    record EnumerateRecordingDevices() implements RecorderCommand { }

    /** Opens a session on the named device; answered with {@link RecorderResponse.Success}. */
    record InitRecordingSession(String deviceName) implements RecorderCommand {
        public InitRecordingSession {
            Objects.requireNonNull(deviceName, "deviceName");
        }
    }

    /** Closes the current session; answered with {@link RecorderResponse.Success}. */
    record CloseRecordingSession() implements RecorderCommand { }

    /** Starts capturing; answered with {@link RecorderResponse.Success}. */
    record StartRecording() implements RecorderCommand { }

    /** Stops capturing; answered with {@link RecorderResponse.AudioData}. */
    record StopRecording() implements RecorderCommand { }

    /** Asks the worker to release the device and exit; answered with {@link RecorderResponse.Success}. */
    record CloseThread() implements RecorderCommand { }

    /** Short name used for log lines and metric tags. */
    default String commandName() {
        return getClass().getSimpleName();
    }
}
