package com.phillippitts.recorderbridge.config;

import com.phillippitts.recorderbridge.config.properties.AudioCaptureProperties;
import com.phillippitts.recorderbridge.config.properties.RecorderProperties;
import com.phillippitts.recorderbridge.service.audio.capture.JavaSoundRecorderBackend;
import com.phillippitts.recorderbridge.service.worker.ThreadWorkerSpawner;
import com.phillippitts.recorderbridge.service.worker.WorkerSpawner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the audio worker. Each spawned worker gets its own Java Sound backend.
 *
 * <p>Test configurations can provide an alternative {@link WorkerSpawner} marked {@code @Primary}
 * to run against a scripted worker instead of real audio hardware.
 */
@Configuration
public class WorkerConfig {

    private static final Logger LOG = LogManager.getLogger(WorkerConfig.class);

    @Bean
    public WorkerSpawner workerSpawner(RecorderProperties recorderProperties,
                                       AudioCaptureProperties captureProperties) {
        LOG.info("Audio worker: thread='{}', response-timeout={}, sample-rate={} Hz, chunk={}ms, max-duration={}ms",
                recorderProperties.getThreadName(),
                recorderProperties.hasResponseTimeout() ? recorderProperties.getResponseTimeout() : "none",
                captureProperties.getSampleRate(),
                captureProperties.getChunkMillis(),
                captureProperties.getMaxDurationMs());
        return new ThreadWorkerSpawner(
                () -> new JavaSoundRecorderBackend(captureProperties),
                recorderProperties.getThreadName());
    }
}
