package com.phillippitts.recorderbridge.service.recorder;

import com.phillippitts.recorderbridge.exception.RecorderException;
import com.phillippitts.recorderbridge.service.worker.ChannelClosedException;
import com.phillippitts.recorderbridge.service.worker.MessageChannel;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * Registry entry: the command and response channels of exactly one live worker.
 *
 * <p>{@link #request} is only called while the registry lock is held, which keeps at most one
 * command outstanding on the pair.
 */
final class WorkerChannels {

    private final MessageChannel<RecorderCommand> commands;
    private final MessageChannel<RecorderResponse> responses;

    WorkerChannels(MessageChannel<RecorderCommand> commands, MessageChannel<RecorderResponse> responses) {
        this.commands = Objects.requireNonNull(commands);
        this.responses = Objects.requireNonNull(responses);
    }

    /**
     * Sends one command and waits for its response, then checks the response variant.
     *
     * @param timeout zero to wait indefinitely
     * @return the response, narrowed to {@code expected}
     * @throws RecorderException SEND_ERROR or RECEIVE_ERROR on channel failure, AUDIO_ERROR for
     *         an {@code Error} response or any variant other than {@code expected}
     */
    <R extends RecorderResponse> R request(RecorderCommand command, Class<R> expected, Duration timeout) {
        try {
            commands.send(command);
        } catch (ChannelClosedException e) {
            throw RecorderException.sendError(e.getMessage(), e);
        }

        RecorderResponse response;
        try {
            response = timeout.isZero() ? responses.receive() : responses.receive(timeout);
        } catch (ChannelClosedException e) {
            throw RecorderException.receiveError(e.getMessage(), e);
        }
        if (response == null) {
            throw RecorderException.receiveError("no response within " + timeout.toMillis() + "ms");
        }

        if (response instanceof RecorderResponse.Error error) {
            throw RecorderException.audioError(error.message());
        }
        if (!expected.isInstance(response)) {
            throw RecorderException.audioError("Unexpected response");
        }
        return expected.cast(response);
    }

    /** Closes both channels; a worker still reading from them exits. */
    void close() {
        commands.close();
        responses.close();
    }
}
