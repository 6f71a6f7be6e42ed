package com.phillippitts.recorderbridge.service.worker;

import java.util.List;
import java.util.Objects;

/**
 * Responses emitted by the audio worker, one per {@link RecorderCommand}.
 */
public sealed interface RecorderResponse {

    record Success() implements RecorderResponse { }

    /** Worker-reported domain failure (bad state, device unavailable, ...). */
    record Error(String message) implements RecorderResponse {
        public Error {
            Objects.requireNonNull(message, "message");
        }
    }

    record RecordingDeviceList(List<String> devices) implements RecorderResponse {
        public RecordingDeviceList {
            devices = List.copyOf(devices);
        }
    }

    /**
     * Captured mono samples in [-1, 1]. The array is handed over, not copied; neither side
     * touches it after sending.
     */
    record AudioData(float[] samples) implements RecorderResponse {
        public AudioData {
            Objects.requireNonNull(samples, "samples");
        }
    }
}
