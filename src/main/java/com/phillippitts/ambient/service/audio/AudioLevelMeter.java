package com.phillippitts.ambient.service.audio;

/**
 * Measures loudness of PCM16LE mono audio as RMS amplitude normalised to [0,1].
 *
 * <p>Full-scale 16-bit audio has an RMS of at most 32768; quiet rooms typically measure
 * below 0.02 and close speech between 0.05 and 0.3.
 */
public final class AudioLevelMeter {

    private static final double FULL_SCALE = 32768.0;

    private AudioLevelMeter() {
        // Utility class
    }

    /**
     * @param pcm PCM16LE mono buffer
     * @param length number of valid bytes in {@code pcm}
     * @return RMS level in [0,1]; 0 for empty input
     */
    public static double level(byte[] pcm, int length) {
        if (pcm == null || length < 2) {
            return 0.0;
        }
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(length, pcm.length);
        for (int i = 0; i + 1 < end; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.sqrt((double) sumSquares / sampleCount) / FULL_SCALE);
    }
}
