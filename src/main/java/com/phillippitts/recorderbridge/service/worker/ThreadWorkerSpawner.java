package com.phillippitts.recorderbridge.service.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Spawns each {@link AudioWorker} on its own daemon thread with a fresh backend.
 *
 * <p>The backend is created before the thread starts, so a backend that cannot be constructed
 * fails the spawn rather than the first command.
 */
public final class ThreadWorkerSpawner implements WorkerSpawner {

    private static final Logger LOG = LogManager.getLogger(ThreadWorkerSpawner.class);

    private final Supplier<? extends RecorderBackend> backendFactory;
    private final String threadName;

    public ThreadWorkerSpawner(Supplier<? extends RecorderBackend> backendFactory, String threadName) {
        this.backendFactory = Objects.requireNonNull(backendFactory);
        this.threadName = Objects.requireNonNull(threadName);
    }

    @Override
    public MessageChannel<RecorderCommand> spawn(MessageChannel<RecorderResponse> responses) {
        RecorderBackend backend = Objects.requireNonNull(backendFactory.get(), "backend");
        MessageChannel<RecorderCommand> commands = new MessageChannel<>("command");

        Thread t = new Thread(new AudioWorker(backend, commands, responses), threadName);
        t.setDaemon(true);
        t.start();
        LOG.debug("Started audio worker thread '{}'", threadName);
        return commands;
    }
}
