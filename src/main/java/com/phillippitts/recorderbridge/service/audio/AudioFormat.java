package com.phillippitts.recorderbridge.service.audio;

/**
 * Capture format used by the Java Sound backend: 16-bit signed PCM, mono, little-endian.
 * The sample rate is configurable; see {@code audio.capture.sample-rate}.
 */
public final class AudioFormat {

    /** Default sample rate in Hz. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes

    private AudioFormat() {}

    /** Bytes per second of capture at the given sample rate. */
    public static int byteRate(int sampleRate) {
        return sampleRate * BLOCK_ALIGN;
    }

    /** Java Sound format descriptor for the given sample rate. */
    public static javax.sound.sampled.AudioFormat javaSoundFormat(int sampleRate) {
        return new javax.sound.sampled.AudioFormat(sampleRate, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }
}
