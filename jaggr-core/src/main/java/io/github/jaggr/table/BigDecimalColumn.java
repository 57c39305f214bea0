package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;

import java.math.BigDecimal;
import java.util.Arrays;

public class BigDecimalColumn implements ColumnInterface<BigDecimal> {
    // null element means NULL
    private BigDecimal[] values;
    private int size;

    public BigDecimalColumn(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException();
        }
        values = new BigDecimal[capacity];
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void add(BigDecimal value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, ArrayUtil.calculateNewSize(size));
        }
        values[size++] = value;
    }

    @Override
    public BigDecimal get(int index) {
        if (index < 0) {
            throw new IllegalArgumentException();
        }
        if (index >= size) {
            throw new IndexOutOfBoundsException();
        }
        return values[index];
    }

    @Override
    public boolean isNull(int index) {
        return null == get(index);
    }
}
