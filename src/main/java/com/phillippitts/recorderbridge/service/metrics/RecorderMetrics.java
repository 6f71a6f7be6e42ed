package com.phillippitts.recorderbridge.service.metrics;

import com.phillippitts.recorderbridge.exception.RecorderErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for worker round trips.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Round-trip latency per command (lock wait included)</li>
 *   <li>Success/failure counts per command, failures tagged by error kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class RecorderMetrics {

    private static final String METRIC_PREFIX = "recorder.command";

    private final MeterRegistry registry;

    public RecorderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the round-trip latency of one command.
     *
     * @param command command name (e.g. StartRecording)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String command, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time from dispatch to mapped worker response")
                .tag("command", command)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String command) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of commands answered as expected")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String command, RecorderErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of commands that ended in a recorder error")
                .tag("command", command)
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }
}
