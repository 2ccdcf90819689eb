package com.phillippitts.ambient.service.audio;

/**
 * Single source of truth for the capture format.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;
    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;        // 32,000

    private AudioFormat() {}

    public static long bytesToMillis(long bytes) {
        return (bytes * 1000L) / BYTE_RATE;
    }

    public static int millisToBytes(int millis) {
        int bytes = (int) (((long) millis * BYTE_RATE) / 1000L);
        return bytes - (bytes % BLOCK_ALIGN);
    }
}
