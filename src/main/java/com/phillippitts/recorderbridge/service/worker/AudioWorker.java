package com.phillippitts.recorderbridge.service.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;

/**
 * Command loop that owns a {@link RecorderBackend} and therefore the capture device.
 *
 * <p>Consumes commands strictly in order and emits exactly one response per command. Backend
 * failures become {@link RecorderResponse.Error} responses; they never end the loop. The loop
 * ends after answering {@link RecorderCommand.CloseThread}, or when either channel is closed.
 * On exit the backend is released and both channels are closed so that callers waiting on
 * them fail fast instead of hanging.
 */
public final class AudioWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(AudioWorker.class);

    private final RecorderBackend backend;
    private final MessageChannel<RecorderCommand> commands;
    private final MessageChannel<RecorderResponse> responses;

    public AudioWorker(RecorderBackend backend,
                       MessageChannel<RecorderCommand> commands,
                       MessageChannel<RecorderResponse> responses) {
        this.backend = Objects.requireNonNull(backend);
        this.commands = Objects.requireNonNull(commands);
        this.responses = Objects.requireNonNull(responses);
    }

    @Override
    public void run() {
        LOG.info("Audio worker started");
        try {
            while (true) {
                RecorderCommand command;
                try {
                    command = commands.receive();
                } catch (ChannelClosedException e) {
                    LOG.info("Command channel closed; audio worker exiting");
                    return;
                }

                RecorderResponse response = handle(command);
                try {
                    responses.send(response);
                } catch (ChannelClosedException e) {
                    LOG.warn("Response channel closed before {} could be answered; audio worker exiting",
                            command.commandName());
                    return;
                }

                if (command instanceof RecorderCommand.CloseThread) {
                    LOG.info("Audio worker closed on request");
                    return;
                }
            }
        } finally {
            releaseBackend();
            commands.close();
            responses.close();
        }
    }

    // Package-private for tests
    RecorderResponse handle(RecorderCommand command) {
        ThreadContext.put("command", command.commandName());
        try {
            LOG.debug("Handling {}", command);
            if (command instanceof RecorderCommand.EnumerateRecordingDevices) {
                return new RecorderResponse.RecordingDeviceList(backend.listDevices());
            }
            if (command instanceof RecorderCommand.InitRecordingSession init) {
                backend.openSession(init.deviceName());
                return new RecorderResponse.Success();
            }
            if (command instanceof RecorderCommand.CloseRecordingSession) {
                backend.closeSession();
                return new RecorderResponse.Success();
            }
            if (command instanceof RecorderCommand.StartRecording) {
                backend.startRecording();
                return new RecorderResponse.Success();
            }
            if (command instanceof RecorderCommand.StopRecording) {
                return new RecorderResponse.AudioData(backend.stopRecording());
            }
            if (command instanceof RecorderCommand.CloseThread) {
                backend.close();
                return new RecorderResponse.Success();
            }
            return new RecorderResponse.Error("Unsupported command: " + command.commandName());
        } catch (RuntimeException e) {
            LOG.warn("{} failed: {}", command.commandName(), e.getMessage());
            return new RecorderResponse.Error(describe(e));
        } finally {
            ThreadContext.remove("command");
        }
    }

    private void releaseBackend() {
        try {
            backend.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to release audio backend: {}", e.toString());
        }
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
