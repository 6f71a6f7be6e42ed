package com.phillippitts.recorderbridge.service.audio.capture;

/**
 * Converts 16-bit signed little-endian mono PCM to normalized 32-bit float samples.
 */
public final class PcmConverter {

    private static final float SCALE = 32768f;

    private PcmConverter() {}

    /**
     * Converts PCM16LE bytes to floats in [-1, 1). A trailing odd byte is ignored.
     *
     * @param pcm raw PCM bytes (must not be null)
     * @return one float per 16-bit sample
     */
    public static float[] toFloatSamples(byte[] pcm) {
        float[] samples = new float[pcm.length / 2];
        for (int i = 0; i < samples.length; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            samples[i] = (short) ((hi << 8) | lo) / SCALE;
        }
        return samples;
    }
}
