package com.phillippitts.recorderbridge.exception;

/**
 * Thrown when a capture device cannot be opened (missing, busy, or access denied).
 */
public class AudioDeviceException extends RecorderBridgeException {

    private final String deviceName;

    public AudioDeviceException(String deviceName, String reason, Throwable cause) {
        super("Audio device '" + deviceName + "' unavailable: " + reason, cause);
        this.deviceName = deviceName;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
