package io.github.jaggr.table;

import io.github.jaggr.util.ScalarUtil;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * A slice of a byte array. Compared unsigned and lexicographically, so it can serve both as
 * a VARBYTE/VARCHAR value and as an encoded group key.
 */
public class ByteArray implements Comparable<ByteArray> {
    private final byte[] bytes;
    private final int offset;
    private final int length;
    private int hash;

    public ByteArray(String string) {
        this(requireNonNull(string).getBytes(StandardCharsets.UTF_8));
    }

    public ByteArray(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    public ByteArray(byte[] bytes, int offset, int length) {
        this.bytes = requireNonNull(bytes);
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IndexOutOfBoundsException(String.format("offset: %d, length: %d, bytes.length: %d",
                    offset, length, bytes.length));
        }
        this.offset = offset;
        this.length = length;
    }

    public byte[] getBytes() {
        return bytes;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public byte get(int index) {
        return bytes[offset + index];
    }

    public byte[] toBytes() {
        return Arrays.copyOfRange(bytes, offset, offset + length);
    }

    @Override
    public int compareTo(ByteArray that) {
        int len = Math.min(length, that.length);
        for (int i = 0; i < len; i++) {
            int v = (bytes[offset + i] & 0xFF) - (that.bytes[that.offset + i] & 0xFF);
            if (v != 0) {
                return v;
            }
        }
        return Integer.compare(length, that.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ByteArray)) {
            return false;
        }
        ByteArray that = (ByteArray) o;
        if (length != that.length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (bytes[offset + i] != that.bytes[that.offset + i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (0 == h && length > 0) {
            h = ScalarUtil.murmur3Hash32(bytes, offset, length);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }
}
