package com.phillippitts.recorderbridge.testutil;

import com.phillippitts.recorderbridge.service.worker.RecorderBackend;

import java.util.ArrayList;
import java.util.List;

/**
 * Test double for {@link RecorderBackend} with a minimal session state machine and canned data.
 *
 * <p><b>Public fields:</b> call counters and the opened device name are exposed so tests can
 * verify what the worker did.
 */
public class FakeRecorderBackend implements RecorderBackend {
    public List<String> devices = new ArrayList<>(List.of("Mic A", "Mic B"));
    public float[] samples = {0.1f, 0.2f, 0.3f};
    public String openedDevice;
    public boolean recording;
    public int closeCount;
    public RuntimeException listFailure;

    @Override
    public List<String> listDevices() {
        if (listFailure != null) {
            throw listFailure;
        }
        return devices;
    }

    @Override
    public void openSession(String deviceName) {
        if (recording) {
            throw new IllegalStateException("Cannot initialize a session while recording");
        }
        openedDevice = deviceName;
    }

    @Override
    public void closeSession() {
        recording = false;
        openedDevice = null;
    }

    @Override
    public void startRecording() {
        if (openedDevice == null) {
            throw new IllegalStateException("No active recording session");
        }
        recording = true;
    }

    @Override
    public float[] stopRecording() {
        if (!recording) {
            throw new IllegalStateException("No active recording");
        }
        recording = false;
        return samples;
    }

    @Override
    public void close() {
        closeCount++;
        closeSession();
    }
}
