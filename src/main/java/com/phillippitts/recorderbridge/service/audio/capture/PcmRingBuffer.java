package com.phillippitts.recorderbridge.service.audio.capture;

/**
 * Bounded byte buffer for captured PCM. When full, the oldest bytes are overwritten so the
 * buffer always holds the most recent {@code capacity} bytes.
 *
 * Thread-safe for one producer (capture thread) and one consumer (the worker after stop).
 */
final class PcmRingBuffer {

    private final byte[] buffer;
    private int writePos = 0;
    private int size = 0;
    private long droppedBytes = 0;

    PcmRingBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        this.buffer = new byte[capacityBytes];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized int size() {
        return size;
    }

    /** Total bytes overwritten since creation. */
    synchronized long droppedBytes() {
        return droppedBytes;
    }

    synchronized void write(byte[] src, int off, int len) {
        if (len <= 0) {
            return;
        }
        // Only the tail of an oversized write can survive
        if (len > buffer.length) {
            droppedBytes += size + (len - buffer.length);
            off += len - buffer.length;
            len = buffer.length;
            size = 0;
            writePos = 0;
        }
        int overflow = size + len - buffer.length;
        if (overflow > 0) {
            droppedBytes += overflow;
            size -= overflow;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        if (first < len) {
            System.arraycopy(src, off + first, buffer, 0, len - first);
        }
        writePos = (writePos + len) % buffer.length;
        size += len;
    }

    synchronized byte[] toByteArray() {
        byte[] out = new byte[size];
        if (size == 0) {
            return out;
        }
        int start = Math.floorMod(writePos - size, buffer.length);
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        return out;
    }
}
