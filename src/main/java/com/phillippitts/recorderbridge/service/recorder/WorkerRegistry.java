package com.phillippitts.recorderbridge.service.recorder;

import com.phillippitts.recorderbridge.config.properties.RecorderProperties;
import com.phillippitts.recorderbridge.exception.RecorderException;
import com.phillippitts.recorderbridge.service.worker.MessageChannel;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;
import com.phillippitts.recorderbridge.service.worker.WorkerSpawner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily creates and holds the single live worker and its channel pair.
 *
 * <p>All access goes through one fair {@link ReentrantLock}. The same lock is held by
 * {@link CommandDispatcher} for each full round trip, so commands reach the worker one at a
 * time and in lock-acquisition order.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * empty → ensureInitialized() → live
 * live  → teardown()          → empty (worker told to exit)
 * live  → discard()           → empty (worker unreachable or out of step; channels closed)
 * </pre>
 */
@Component
public class WorkerRegistry {

    private static final Logger LOG = LogManager.getLogger(WorkerRegistry.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final WorkerSpawner spawner;
    private final Duration responseTimeout;

    // Written under the lock; volatile so status reads never wait behind a round trip
    private volatile WorkerChannels current;

    @Autowired
    public WorkerRegistry(WorkerSpawner spawner, RecorderProperties properties) {
        this(spawner, properties.getResponseTimeout());
    }

    // Package-private for tests
    WorkerRegistry(WorkerSpawner spawner, Duration responseTimeout) {
        this.spawner = Objects.requireNonNull(spawner);
        this.responseTimeout = Objects.requireNonNull(responseTimeout);
    }

    /**
     * Spawns the worker unless one is already live. Idempotent; check-and-create is atomic.
     *
     * @throws RecorderException SEND_ERROR if the worker could not be spawned (the registry stays
     *         empty so a later call can retry), LOCK_ERROR if interrupted while waiting for the lock
     */
    public void ensureInitialized() {
        acquire();
        try {
            if (current != null) {
                LOG.debug("Audio worker already initialized");
                return;
            }
            LOG.debug("Audio worker not initialized, spawning a new one");
            MessageChannel<RecorderResponse> responses = new MessageChannel<>("response");
            MessageChannel<RecorderCommand> commands;
            try {
                commands = spawner.spawn(responses);
            } catch (RuntimeException e) {
                responses.close();
                LOG.error("Failed to spawn audio worker: {}", e.toString());
                throw RecorderException.sendError(describe(e), e);
            }
            if (commands == null) {
                responses.close();
                throw RecorderException.sendError("worker spawner returned no command channel", null);
            }
            current = new WorkerChannels(commands, responses);
            LOG.info("Audio worker created successfully");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the live worker, if any, and empties the registry.
     *
     * <p>The entry is removed before CloseThread is sent, so concurrent callers never observe a
     * half-closed worker. Returns immediately, sending nothing, when no worker is live.
     *
     * @param onClosed run under the lock once the worker has acknowledged CloseThread
     * @return {@code true} if a worker was closed, {@code false} if there was none
     */
    public boolean teardown(Runnable onClosed) {
        acquire();
        try {
            WorkerChannels channels = current;
            if (channels == null) {
                LOG.debug("No audio worker to close");
                return false;
            }
            current = null;
            LOG.debug("Sending CloseThread command");
            try {
                channels.request(new RecorderCommand.CloseThread(), RecorderResponse.Success.class, responseTimeout);
            } catch (RecorderException e) {
                LOG.error("Error closing audio worker: {}", e.getMessage());
                throw e;
            } finally {
                channels.close();
            }
            onClosed.run();
            LOG.info("Audio worker closed successfully");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Whether a worker is live. Does not wait for an in-flight round trip. */
    public boolean isInitialized() {
        return current != null;
    }

    Duration responseTimeout() {
        return responseTimeout;
    }

    /**
     * Takes the registry lock for a round trip. Must be paired with {@link #release()}.
     *
     * @throws RecorderException LOCK_ERROR if interrupted while waiting
     */
    void acquire() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RecorderException.lockError("interrupted while waiting for the audio worker", e);
        }
    }

    void release() {
        lock.unlock();
    }

    /** Live entry, or {@code null}. Caller must hold the lock. */
    WorkerChannels current() {
        return current;
    }

    /**
     * Drops an entry whose worker is gone or no longer in step with its channels. Caller must
     * hold the lock. The next operation spawns a fresh worker.
     */
    void discard(WorkerChannels channels) {
        if (current == channels) {
            current = null;
            LOG.warn("Discarding unreachable audio worker; a new one will be spawned on next use");
        }
        channels.close();
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
