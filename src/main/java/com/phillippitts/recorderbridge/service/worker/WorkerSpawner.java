package com.phillippitts.recorderbridge.service.worker;

/**
 * Starts a new audio worker.
 *
 * <p>The worker replies on {@code responses}; the returned channel is the one it reads commands
 * from. Any runtime exception means no worker was started.
 */
@FunctionalInterface
public interface WorkerSpawner {

    MessageChannel<RecorderCommand> spawn(MessageChannel<RecorderResponse> responses);
}
