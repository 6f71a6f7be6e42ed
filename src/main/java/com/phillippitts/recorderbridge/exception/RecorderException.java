package com.phillippitts.recorderbridge.exception;

/**
 * Typed failure of a recorder operation.
 *
 * <p>Carries one {@link RecorderErrorKind} plus an optional detail string. Instances are
 * serializable so they can cross the caller boundary unchanged.
 */
public class RecorderException extends RecorderBridgeException {

    private final RecorderErrorKind kind;
    private final String detail;

    public RecorderException(RecorderErrorKind kind, String detail) {
        super(kind.format(detail));
        this.kind = kind;
        this.detail = detail;
    }

    public RecorderException(RecorderErrorKind kind, String detail, Throwable cause) {
        super(kind.format(detail), cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static RecorderException threadNotInitialized() {
        return new RecorderException(RecorderErrorKind.THREAD_NOT_INITIALIZED, null);
    }

    public static RecorderException sendError(String detail, Throwable cause) {
        return new RecorderException(RecorderErrorKind.SEND_ERROR, detail, cause);
    }

    public static RecorderException receiveError(String detail) {
        return new RecorderException(RecorderErrorKind.RECEIVE_ERROR, detail);
    }

    public static RecorderException receiveError(String detail, Throwable cause) {
        return new RecorderException(RecorderErrorKind.RECEIVE_ERROR, detail, cause);
    }

    public static RecorderException audioError(String detail) {
        return new RecorderException(RecorderErrorKind.AUDIO_ERROR, detail);
    }

    public static RecorderException noActiveRecording() {
        return new RecorderException(RecorderErrorKind.NO_ACTIVE_RECORDING, null);
    }

    public static RecorderException lockError(String detail, Throwable cause) {
        return new RecorderException(RecorderErrorKind.LOCK_ERROR, detail, cause);
    }

    public RecorderErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
