package com.phillippitts.ambient.service.audio;

/**
 * Ring buffer for the PCM of the utterance window that has not been transcribed yet.
 * When more than {@code capacity} bytes are written the oldest bytes are dropped.
 *
 * <p>Guarded by the owning sentinel's lock; methods are synchronized for safe hand-off to
 * readers on other threads.
 */
final class PcmRingBuffer {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;

    PcmRingBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        this.buffer = new byte[capacityBytes];
    }

    synchronized void write(byte[] src) {
        int len = src.length;
        if (len == 0) {
            return;
        }
        if (len >= buffer.length) {
            System.arraycopy(src, len - buffer.length, buffer, 0, buffer.length);
            writePos = 0;
            size = buffer.length;
            return;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, 0, buffer, writePos, first);
        int remaining = len - first;
        if (remaining > 0) {
            System.arraycopy(src, first, buffer, 0, remaining);
            writePos = remaining;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size = Math.min(size + len, buffer.length);
    }

    synchronized long durationMillis() {
        return AudioFormat.bytesToMillis(size);
    }

    /**
     * Returns the buffered bytes in write order and empties the buffer.
     */
    synchronized byte[] drain() {
        byte[] out = new byte[size];
        if (size > 0) {
            int start = (writePos - size + buffer.length) % buffer.length;
            int first = Math.min(size, buffer.length - start);
            System.arraycopy(buffer, start, out, 0, first);
            if (first < size) {
                System.arraycopy(buffer, 0, out, first, size - first);
            }
        }
        writePos = 0;
        size = 0;
        return out;
    }
}
