package com.phillippitts.recorderbridge.config.properties;

import com.phillippitts.recorderbridge.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the Java Sound capture backend.
 *
 * Format (enforced by the backend): 16-bit PCM, mono, little-endian at {@code sampleRate}.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum capture duration in milliseconds (hard stop); older audio is dropped beyond it. */
    @Min(100)
    @Max(3_600_000)
    private final int maxDurationMs;

    /** Capture sample rate in Hz. */
    @Min(8_000)
    @Max(48_000)
    private final int sampleRate;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis, Integer maxDurationMs, Integer sampleRate) {
        this.chunkMillis = chunkMillis == null ? 40 : chunkMillis;
        this.maxDurationMs = maxDurationMs == null ? 600_000 : maxDurationMs;
        this.sampleRate = sampleRate == null ? AudioFormat.DEFAULT_SAMPLE_RATE : sampleRate;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getMaxDurationMs() { return maxDurationMs; }
    public int getSampleRate() { return sampleRate; }
}
