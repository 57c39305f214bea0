package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;

import java.util.Arrays;

public class LongColumn implements ColumnInterface<Long> {
    private long[] values;
    private byte[] valueIsNull;
    private int size;
    private int capacity;

    public LongColumn(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException();
        }
        this.capacity = capacity;
        values = new long[capacity];
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

            values = Arrays.copyOf(values, capacity);
        }
    }

    @Override
    public void add(Long value) {
        grow();
        if (null == value) {
            if (null == valueIsNull) {
                valueIsNull = new byte[capacity];
            }
            valueIsNull[size] = 1;
        } else {
            values[size] = value;
        }

        size++;
    }

    @Override
    public Long get(int index) {
        if (isNull(index)) {
            return null;
        }

        return values[index];
    }

    /**
     * unboxed access for the aggregation loops, the caller checks {@link #isNull(int)} first
     */
    public long getLong(int index) {
        return values[index];
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
}
