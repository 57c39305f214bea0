package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;
import io.github.jaggr.exception.UnknownTypeException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * All values are appended into one byte array, offsets[i] and offsets[i + 1] bound the i-th value.
 */
public class VarbyteColumn implements ColumnInterface<Comparable> {
    private byte[] values;
    private int[] offsets;
    private byte[] valueIsNull;
    private int size;
    private int capacity;

    public VarbyteColumn(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException();
        }
        this.capacity = capacity;
        values = new byte[16 * capacity];
        offsets = new int[capacity + 1];
    }

    @Override
    public long size() {
        return size;
    }

    private void grow() {
        if (size > capacity) {
            throw new IllegalStateException();
        }
        if (size == capacity) {
            capacity = ArrayUtil.calculateNewSize(capacity);
            if (null != valueIsNull) {
                valueIsNull = Arrays.copyOf(valueIsNull, capacity);
            }

            offsets = Arrays.copyOf(offsets, capacity + 1);
        }
    }

    private void ensureValuesCapacity(int extra) {
        int required = offsets[size] + extra;
        if (required < 0) {
            throw new IllegalStateException("varbyte column exceeds 2GB");
        }
        if (required > values.length) {
            int newLength = values.length;
            while (newLength < required) {
                newLength = ArrayUtil.calculateNewSize(newLength);
            }
            values = Arrays.copyOf(values, newLength);
        }
    }

    @Override
    public void add(Comparable comparable) {
        if (null == comparable) {
            addNull();
            return;
        }

        Class clazz = comparable.getClass();
        if (clazz == String.class) {
            addBytes(((String) comparable).getBytes(StandardCharsets.UTF_8));
        } else if (clazz == ByteArray.class) {
            ByteArray byteArray = (ByteArray) comparable;
            addBytes(byteArray.getBytes(), byteArray.getOffset(), byteArray.getLength());
        } else {
            throw new UnknownTypeException(clazz.getName());
        }
    }

    public void addBytes(byte[] bytes) {
        if (null == bytes) {
            addNull();
            return;
        }
        addBytes(bytes, 0, bytes.length);
    }

    public void addBytes(byte[] bytes, int offset, int length) {
        grow();
        ensureValuesCapacity(length);
        System.arraycopy(bytes, offset, values, offsets[size], length);
        offsets[size + 1] = offsets[size] + length;
        size++;
    }

    private void addNull() {
        grow();
        if (null == valueIsNull) {
            valueIsNull = new byte[capacity];
        }
        valueIsNull[size] = 1;
        offsets[size + 1] = offsets[size];
        size++;
    }

    @Override
    public boolean isNull(int index) {
        if (index < 0) {
            throw new IllegalArgumentException();
        }
        if (index >= size) {
            throw new IndexOutOfBoundsException();
        }

        return valueIsNull != null && valueIsNull[index] == 1;
    }

    /**
     * the returned ByteArray shares the underlying buffer of this column
     */
    @Override
    public ByteArray get(int index) {
        if (isNull(index)) {
            return null;
        }
        return new ByteArray(values, offsets[index], offsets[index + 1] - offsets[index]);
    }

    /**
     * raw access for the aggregation loops, valid only when {@link #isNull(int)} is false
     */
    public byte[] rawValues() {
        return values;
    }

    public int offset(int index) {
        return offsets[index];
    }

    public int length(int index) {
        return offsets[index + 1] - offsets[index];
    }
}
