package io.github.jaggr.codec;

import io.github.jaggr.exception.EncodingException;

import static java.lang.String.format;

public class KeyDecoder {
    private final byte[] key;
    private int position;

    public KeyDecoder(byte[] key) {
        this.key = key;
    }

    public int position() {
        return position;
    }

    public boolean hasRemaining() {
        return position < key.length;
    }

    private void require(int length) {
        if (position + length > key.length) {
            throw new EncodingException(format("truncated key: need %d bytes at offset %d, key length %d",
                    length, position, key.length));
        }
    }

    public int readByte() {
        require(1);
        return key[position++] & 0xFF;
    }

    public int readInt() {
        require(Integer.BYTES);
        int v = 0;
        for (int i = 0; i < Integer.BYTES; i++) {
            v = (v << 8) | (key[position++] & 0xFF);
        }
        return v;
    }

    public long readLong() {
        require(Long.BYTES);
        long v = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            v = (v << 8) | (key[position++] & 0xFF);
        }
        return v;
    }

    public void skip(int length) {
        require(length);
        position += length;
    }

    byte[] key() {
        return key;
    }
}
