package com.phillippitts.recorderbridge.service.worker;

import com.phillippitts.recorderbridge.testutil.FakeRecorderBackend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadWorkerSpawnerTest {

    @Test
    void spawnsNamedWorkerThatAnswersCommands() throws Exception {
        AtomicReference<String> threadName = new AtomicReference<>();
        FakeRecorderBackend backend = new FakeRecorderBackend() {
            @Override
            public java.util.List<String> listDevices() {
                threadName.set(Thread.currentThread().getName());
                return super.listDevices();
            }
        };
        ThreadWorkerSpawner spawner = new ThreadWorkerSpawner(() -> backend, "audio-worker-test");
        MessageChannel<RecorderResponse> responses = new MessageChannel<>("response");

        MessageChannel<RecorderCommand> commands = spawner.spawn(responses);
        commands.send(new RecorderCommand.EnumerateRecordingDevices());
        RecorderResponse response = responses.receive(Duration.ofSeconds(2));

        assertThat(response).isInstanceOf(RecorderResponse.RecordingDeviceList.class);
        assertThat(threadName.get()).isEqualTo("audio-worker-test");
        commands.close();
    }

    @Test
    void backendCreationFailureFailsTheSpawn() {
        ThreadWorkerSpawner spawner = new ThreadWorkerSpawner(() -> {
            throw new IllegalStateException("no audio subsystem");
        }, "audio-worker-test");

        assertThatThrownBy(() -> spawner.spawn(new MessageChannel<>("response")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("no audio subsystem");
    }
}
