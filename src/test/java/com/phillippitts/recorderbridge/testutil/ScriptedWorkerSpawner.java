package com.phillippitts.recorderbridge.testutil;

import com.phillippitts.recorderbridge.service.worker.ChannelClosedException;
import com.phillippitts.recorderbridge.service.worker.MessageChannel;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;
import com.phillippitts.recorderbridge.service.worker.WorkerSpawner;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test double for {@link WorkerSpawner} whose workers answer from a script instead of audio
 * hardware.
 *
 * <p>The script maps each command to a response. Returning {@code null} makes the worker die
 * mid-request: both channels are closed without an answer.
 *
 * <p><b>Public fields:</b> {@code received}, {@code spawnCount} and {@code overlapping} are exposed
 * so tests can verify what the worker observed. {@code overlapping} counts commands found queued
 * behind one still being handled; the dispatcher must keep it at zero. Such a command is still
 * handled, in order, after the current one.
 */
public class ScriptedWorkerSpawner implements WorkerSpawner {

    public final List<RecorderCommand> received = new CopyOnWriteArrayList<>();
    public final AtomicInteger spawnCount = new AtomicInteger();
    public final AtomicInteger overlapping = new AtomicInteger();

    private final Function<RecorderCommand, RecorderResponse> script;
    private volatile RuntimeException spawnFailure;

    public ScriptedWorkerSpawner(Function<RecorderCommand, RecorderResponse> script) {
        this.script = script;
    }

    /** A worker that behaves like a healthy device: Success for everything, empty audio on stop. */
    public static ScriptedWorkerSpawner healthy() {
        return new ScriptedWorkerSpawner(ScriptedWorkerSpawner::defaultResponse);
    }

    public static RecorderResponse defaultResponse(RecorderCommand command) {
        if (command instanceof RecorderCommand.EnumerateRecordingDevices) {
            return new RecorderResponse.RecordingDeviceList(List.of("Mic A", "Mic B"));
        }
        if (command instanceof RecorderCommand.StopRecording) {
            return new RecorderResponse.AudioData(new float[]{0.1f, 0.2f, 0.3f});
        }
        return new RecorderResponse.Success();
    }

    /** Makes every subsequent spawn fail with the given exception. */
    public void failSpawnsWith(RuntimeException failure) {
        this.spawnFailure = failure;
    }

    @Override
    public MessageChannel<RecorderCommand> spawn(MessageChannel<RecorderResponse> responses) {
        RuntimeException failure = spawnFailure;
        if (failure != null) {
            throw failure;
        }
        int n = spawnCount.incrementAndGet();
        MessageChannel<RecorderCommand> commands = new MessageChannel<>("command");
        Thread t = new Thread(() -> loop(commands, responses), "scripted-worker-" + n);
        t.setDaemon(true);
        t.start();
        return commands;
    }

    private void loop(MessageChannel<RecorderCommand> commands, MessageChannel<RecorderResponse> responses) {
        RecorderCommand next = null;
        try {
            while (true) {
                RecorderCommand command = next != null ? next : commands.receive();
                next = null;
                received.add(command);

                RecorderResponse response = script.apply(command);
                // A command already queued here was sent before this one was answered;
                // it is kept and handled next
                RecorderCommand queued = commands.receive(Duration.ZERO);
                if (queued != null) {
                    overlapping.incrementAndGet();
                    next = queued;
                }
                if (response == null) {
                    return;
                }
                responses.send(response);
                if (command instanceof RecorderCommand.CloseThread) {
                    return;
                }
            }
        } catch (ChannelClosedException e) {
            // Channel closed by the dispatcher; the worker simply ends
        } finally {
            commands.close();
            responses.close();
        }
    }
}
