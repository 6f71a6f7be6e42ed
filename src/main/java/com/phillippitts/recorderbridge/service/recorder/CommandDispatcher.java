package com.phillippitts.recorderbridge.service.recorder;

import com.phillippitts.recorderbridge.exception.RecorderErrorKind;
import com.phillippitts.recorderbridge.exception.RecorderException;
import com.phillippitts.recorderbridge.service.events.WorkerFailureEvent;
import com.phillippitts.recorderbridge.service.metrics.RecorderMetrics;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Executes one command round trip against the audio worker.
 *
 * <p>The registry lock is held from send until the response has been mapped, including the
 * {@code onSuccess} step. Every command from every caller is therefore processed one at a time,
 * in lock-acquisition order, and any state mutated in {@code onSuccess} changes under that lock.
 *
 * <p>Every failure leaves as a {@link RecorderException}:
 * <ul>
 *   <li>interrupted while waiting for the lock: LOCK_ERROR</li>
 *   <li>worker could not be spawned or command channel closed: SEND_ERROR</li>
 *   <li>entry vanished between initialization and locking: THREAD_NOT_INITIALIZED</li>
 *   <li>response channel closed, or no response within the configured timeout: RECEIVE_ERROR</li>
 *   <li>{@code Error} response, or a response of the wrong variant: AUDIO_ERROR</li>
 * </ul>
 * On SEND_ERROR and RECEIVE_ERROR the entry is discarded, because the worker is gone or its
 * channels no longer line up with the commands sent.
 */
@Component
public class CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(CommandDispatcher.class);

    private final WorkerRegistry registry;
    private final RecorderMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public CommandDispatcher(WorkerRegistry registry,
                             RecorderMetrics metrics,
                             ApplicationEventPublisher publisher) {
        this.registry = Objects.requireNonNull(registry);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
    }

    /**
     * Sends {@code command}, waits for its response and maps it.
     *
     * @param operation caller-facing operation name, for logs and events
     * @param command command to send
     * @param expected the response variant that means success
     * @param onSuccess maps the expected response; runs with the registry lock held
     * @return result of {@code onSuccess}
     * @throws RecorderException on any failure
     */
    public <R extends RecorderResponse, T> T withWorker(String operation,
                                                        RecorderCommand command,
                                                        Class<R> expected,
                                                        Function<? super R, ? extends T> onSuccess) {
        String commandName = command.commandName();
        long start = System.nanoTime();
        ThreadContext.put("command", commandName);
        try {
            registry.ensureInitialized();
            T result = roundTrip(command, expected, onSuccess);
            metrics.incrementSuccess(commandName);
            return result;
        } catch (RecorderException e) {
            onFailure(operation, commandName, e);
            throw e;
        } finally {
            metrics.recordLatency(commandName, System.nanoTime() - start);
            ThreadContext.remove("command");
        }
    }

    private <R extends RecorderResponse, T> T roundTrip(RecorderCommand command,
                                                        Class<R> expected,
                                                        Function<? super R, ? extends T> onSuccess) {
        registry.acquire();
        try {
            WorkerChannels channels = registry.current();
            if (channels == null) {
                throw RecorderException.threadNotInitialized();
            }
            LOG.debug("Sending {} and waiting for response", command.commandName());
            R response;
            try {
                response = channels.request(command, expected, registry.responseTimeout());
            } catch (RecorderException e) {
                if (e.getKind() == RecorderErrorKind.SEND_ERROR || e.getKind() == RecorderErrorKind.RECEIVE_ERROR) {
                    registry.discard(channels);
                }
                throw e;
            }
            return onSuccess.apply(response);
        } finally {
            registry.release();
        }
    }

    private void onFailure(String operation, String commandName, RecorderException e) {
        metrics.incrementFailure(commandName, e.getKind());
        LOG.error("{} failed: {}", operation, e.getMessage());
        if (e.getKind().isWorkerFailure()) {
            publisher.publishEvent(new WorkerFailureEvent(operation, e.getKind(), Instant.now()));
        }
    }
}
