package com.phillippitts.recorderbridge.service.worker;

/**
 * Thrown when sending to, or receiving from, a {@link MessageChannel} that has been closed.
 *
 * <p>Checked so that every send and receive site decides explicitly how a dead peer is reported.
 */
public class ChannelClosedException extends Exception {

    public ChannelClosedException(String message) {
        super(message);
    }
}
