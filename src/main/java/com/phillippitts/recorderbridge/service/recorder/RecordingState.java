package com.phillippitts.recorderbridge.service.recorder;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mirror of the worker's last known recording status.
 *
 * <p>Written only by {@link DefaultRecorderService} from inside a successful round trip, i.e.
 * while the registry lock is held. Readable from anywhere.
 *
 * <p>Failed round trips never change it. When a worker dies or times out mid-recording
 * (SEND_ERROR or RECEIVE_ERROR) the flag can stay {@code true} although the replacement worker
 * is idle. Stop and cancel then fail on the fresh worker; a session close or
 * {@code closeWorker} clears the flag.
 */
@Component
public class RecordingState {

    private final AtomicBoolean recording = new AtomicBoolean(false);

    public boolean isRecording() {
        return recording.get();
    }

    void markRecording() {
        recording.set(true);
    }

    void markStopped() {
        recording.set(false);
    }
}
