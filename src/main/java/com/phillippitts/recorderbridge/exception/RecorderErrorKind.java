package com.phillippitts.recorderbridge.exception;

/**
 * The six failure kinds a recorder operation can report to its caller.
 *
 * <p>Every internal failure (lock interruption, closed channel, response mismatch, worker-reported
 * error) is mapped to exactly one of these before it leaves the dispatcher.
 */
public enum RecorderErrorKind {

    THREAD_NOT_INITIALIZED("Audio thread not initialized", true),
    SEND_ERROR("Failed to send command: %s", true),
    RECEIVE_ERROR("Failed to receive response: %s", true),
    AUDIO_ERROR("Audio error: %s", false),
    NO_ACTIVE_RECORDING("No active recording", false),
    LOCK_ERROR("Failed to acquire lock: %s", false);

    private final String template;
    private final boolean workerFailure;

    RecorderErrorKind(String template, boolean workerFailure) {
        this.template = template;
        this.workerFailure = workerFailure;
    }

    /**
     * Renders the caller-facing message for this kind.
     *
     * @param detail kind-specific detail; ignored by kinds that carry none
     * @return formatted message
     */
    public String format(String detail) {
        if (!template.contains("%s")) {
            return template;
        }
        return String.format(template, detail == null ? "" : detail);
    }

    /**
     * Whether this kind means the worker itself is unreachable (as opposed to a domain error
     * the worker reported).
     */
    public boolean isWorkerFailure() {
        return workerFailure;
    }
}
