package com.phillippitts.recorderbridge.service.recorder;

/**
 * A capture device as seen by callers.
 *
 * <p>The worker only reports labels, so {@code deviceId} is the label itself. Two devices with
 * the same label are indistinguishable.
 */
public record DeviceInfo(String deviceId, String label) {

    static DeviceInfo fromLabel(String label) {
        return new DeviceInfo(label, label);
    }
}
