package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;
import io.github.jaggr.exception.InconsistentColumnTypeException;
import io.github.jaggr.exception.UnknownTypeException;
import io.github.jaggr.util.ScalarUtil;

import java.math.BigDecimal;

import static java.lang.String.format;

public class Column<T extends Comparable> {
    private final String name;
    private Type type;
    private int preNull;
    private final int initSize;
    private ColumnInterface column;

    public Column(String name) {
        this(name, ArrayUtil.DEFAULT_CAPACITY);
    }

    public Column(String name, int initSize) {
        this.name = name;
        this.initSize = initSize > 0 ? initSize : ArrayUtil.DEFAULT_CAPACITY;
    }

    public Column(String name, Type type) {
        this(name, type, ArrayUtil.DEFAULT_CAPACITY);
    }

    public Column(String name, Type type, int initSize) {
        this(name, initSize);
        initType(type);
    }

    public static Column of(String name, Type type, Comparable... values) {
        Column column = new Column(name, type, Math.max(values.length, 1));
        for (Comparable value : values) {
            column.add(value);
        }
        return column;
    }

    private void initType(Type type) {
        this.type = type;
        switch (type) {
            case DOUBLE:
                this.column = new DoubleColumn(this.initSize);
                break;
            case BIGINT:
                this.column = new LongColumn(this.initSize);
                break;
            case VARBYTE:
            case VARCHAR:
                this.column = new VarbyteColumn(this.initSize);
                break;
            case BIGDECIMAL:
                this.column = new BigDecimalColumn(this.initSize);
                break;
            case INT:
                this.column = new IntColumn(this.initSize);
                break;
            default:
                throw new UnknownTypeException(type.name());
        }
        for (int i = 0; i < preNull; i++) {
            column.add(null);
        }
        preNull = 0;
    }

    /**
     * Gives a column that holds only NULLs so far the storage of the declared type.
     *
     * @throws InconsistentColumnTypeException if the column already holds another type
     */
    public Column<T> ensureType(Type declared) {
        if (null == type) {
            initType(declared);
        } else if (type != declared) {
            throw new InconsistentColumnTypeException(format("column '%s' holds %s values but %s is declared",
                    name, type, declared));
        }
        return this;
    }

    public void add(T value) {
        if (null != value) {
            if (null == type) {
                initType(Type.getType(value));
            } else {
                if (!type.accepts(value)) {
                    throw new InconsistentColumnTypeException(format("%s %s", value.getClass().getName(), type.name()));
                }
            }

            column.add(value);
        } else {
            if (null == type) {
                preNull++;
            } else {
                column.add(null);
            }
        }
    }

    public T get(int row) {
        if (null == column) {
            checkPreNull(row);
            return null;
        }

        return (T) column.get(row);
    }

    public boolean isNull(int row) {
        if (null == column) {
            checkPreNull(row);
            return true;
        }

        return column.isNull(row);
    }

    private void checkPreNull(int row) {
        if (row < 0 || row >= preNull) {
            throw new IndexOutOfBoundsException(format("row %d, size %d", row, preNull));
        }
    }

    /**
     * The typed storage behind this column, aggregation loops cast it once per batch to the
     * concrete class of their specialization.
     */
    public ColumnInterface values() {
        if (null == column) {
            throw new IllegalStateException(format("column '%s' has no type yet", name));
        }
        return column;
    }

    public String getString(int row) {
        return ScalarUtil.toStr(get(row));
    }

    public BigDecimal getBigDecimal(int row) {
        return ScalarUtil.toBigDecimal(get(row));
    }

    public Double getDouble(int row) {
        return ScalarUtil.toDouble(get(row));
    }

    public Long getLong(int row) {
        return ScalarUtil.toLong(get(row));
    }

    public Integer getInteger(int row) {
        return ScalarUtil.toInteger(get(row));
    }

    public ByteArray getByteArray(int row) {
        return ScalarUtil.toByteArray(get(row));
    }

    public String name() {
        return name;
    }

    public int size() {
        if (null == column) {
            return preNull;
        }

        return (int) column.size();
    }

    public Type getType() {
        return type;
    }
}
