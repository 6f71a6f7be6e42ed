package com.phillippitts.recorderbridge.service.health;

import com.phillippitts.recorderbridge.service.recorder.RecorderService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the audio worker.
 *
 * <p>The worker is spawned lazily, so "not running" is a normal idle state and still reports UP.
 * Exposed via /actuator/health without touching the worker itself.
 */
@Component
public class AudioWorkerHealthIndicator implements HealthIndicator {

    private final RecorderService recorder;

    public AudioWorkerHealthIndicator(RecorderService recorder) {
        this.recorder = recorder;
    }

    @Override
    public Health health() {
        boolean running = recorder.isWorkerRunning();
        return Health.up()
                .withDetail("worker", running ? "running" : "idle")
                .withDetail("recording", recorder.isRecording())
                .build();
    }
}
