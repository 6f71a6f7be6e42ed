package com.phillippitts.recorderbridge;

import com.phillippitts.recorderbridge.service.recorder.DeviceInfo;
import com.phillippitts.recorderbridge.service.worker.RecorderCommand;
import com.phillippitts.recorderbridge.service.worker.RecorderResponse;
import com.phillippitts.recorderbridge.service.worker.WorkerSpawner;
import com.phillippitts.recorderbridge.testutil.ScriptedWorkerSpawner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "recorder.worker.response-timeout=5s",
        "audio.capture.max-duration-ms=60000"
    }
)
class RecorderBridgeApplicationTests {

    @TestConfiguration
    static class ScriptedWorkerConfiguration {
        @Bean
        @Primary
        WorkerSpawner scriptedWorkerSpawner() {
            // No audio hardware in tests; "missing" plays an absent device
            return new ScriptedWorkerSpawner(cmd -> {
                if (cmd instanceof RecorderCommand.InitRecordingSession init && "missing".equals(init.deviceName())) {
                    return new RecorderResponse.Error("Audio device 'missing' unavailable: not found");
                }
                return ScriptedWorkerSpawner.defaultResponse(cmd);
            });
        }
    }

    @Autowired
    private TestRestTemplate rest;

    @Test
    void listsDevices() {
        ResponseEntity<DeviceInfo[]> response = rest.getForEntity("/recorder/devices", DeviceInfo[].class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).extracting(DeviceInfo::label).containsExactly("Mic A", "Mic B");
    }

    @Test
    void recordsThroughTheWorker() {
        ResponseEntity<Void> init = rest.postForEntity("/recorder/session", Map.of("deviceName", "Mic A"), Void.class);
        ResponseEntity<Void> start = rest.postForEntity("/recorder/recording/start", null, Void.class);
        ResponseEntity<float[]> stop = rest.postForEntity("/recorder/recording/stop", null, float[].class);

        assertThat(init.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(start.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(stop.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(stop.getBody()).containsExactly(0.1f, 0.2f, 0.3f);

        Map<?, ?> status = rest.getForObject("/recorder/status", Map.class);
        assertThat(status.get("recording")).isEqualTo(false);
        assertThat(status.get("workerRunning")).isEqualTo(true);
    }

    @Test
    void workerErrorIsRenderedAsAudioError() {
        ResponseEntity<Map> response = rest.postForEntity(
                "/recorder/session", Map.of("deviceName", "missing"), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).containsEntry("errorCode", "AUDIO_ERROR");
        assertThat(response.getBody()).containsEntry("details", "Audio device 'missing' unavailable: not found");
    }

    @Test
    void missingDeviceNameIsRejected() {
        ResponseEntity<Map> response = rest.postForEntity("/recorder/session", Map.of(), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("errorCode", "InvalidRequest");
    }

    @Test
    void closeWorkerStopsItAndNextCallRespawns() {
        rest.getForEntity("/recorder/devices", DeviceInfo[].class);

        ResponseEntity<Void> close = rest.exchange("/recorder/worker", HttpMethod.DELETE, null, Void.class);
        Map<?, ?> afterClose = rest.getForObject("/recorder/status", Map.class);
        rest.getForEntity("/recorder/devices", DeviceInfo[].class);
        Map<?, ?> afterReuse = rest.getForObject("/recorder/status", Map.class);

        assertThat(close.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(afterClose.get("workerRunning")).isEqualTo(false);
        assertThat(afterReuse.get("workerRunning")).isEqualTo(true);
    }

    @Test
    void healthReportsAudioWorker() {
        ResponseEntity<String> response = rest.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("audioWorker");
    }
}
