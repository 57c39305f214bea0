package io.github.jaggr.codec;

import io.github.jaggr.ArrayUtil;

import java.util.Arrays;

/**
 * Growable write buffer reused across rows while building group keys.
 */
public class KeyEncoder {
    private byte[] buffer;
    private int position;

    public KeyEncoder() {
        this(64);
    }

    public KeyEncoder(int initialCapacity) {
        buffer = new byte[Math.max(initialCapacity, 16)];
    }

    private void ensure(int extra) {
        int required = position + extra;
        if (required > buffer.length) {
            int newLength = buffer.length;
            while (newLength < required) {
                newLength = ArrayUtil.calculateNewSize(newLength);
            }
            buffer = Arrays.copyOf(buffer, newLength);
        }
    }

    public void reset() {
        position = 0;
    }

    public int position() {
        return position;
    }

    public void writeByte(int b) {
        ensure(1);
        buffer[position++] = (byte) b;
    }

    public void writeInt(int v) {
        ensure(Integer.BYTES);
        buffer[position++] = (byte) (v >>> 24);
        buffer[position++] = (byte) (v >>> 16);
        buffer[position++] = (byte) (v >>> 8);
        buffer[position++] = (byte) v;
    }

    public void writeLong(long v) {
        ensure(Long.BYTES);
        for (int shift = 56; shift >= 0; shift -= 8) {
            buffer[position++] = (byte) (v >>> shift);
        }
    }

    public void writeBytes(byte[] bytes, int offset, int length) {
        ensure(length);
        System.arraycopy(bytes, offset, buffer, position, length);
        position += length;
    }

    /**
     * bitwise NOT of the bytes written since from
     */
    public void invertFrom(int from) {
        for (int i = from; i < position; i++) {
            buffer[i] = (byte) ~buffer[i];
        }
    }

    /**
     * the internal buffer, valid up to {@link #position()} until the next write
     */
    public byte[] buffer() {
        return buffer;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, position);
    }
}
