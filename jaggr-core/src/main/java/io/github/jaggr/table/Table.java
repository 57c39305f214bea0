package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;
import io.github.jaggr.exception.ColumnNotExistsException;
import io.github.jaggr.exception.IllegalSizeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A column batch: equally sized named columns plus an optional selection of the active rows.
 * Tables are not modified after they are built.
 */
public class Table {
    private final List<Column> columns;
    private final LinkedHashMap<String, Integer> columnIndex;
    private final int size;
    // null means every row is active
    private final int[] selection;

    public Table(List<Column> columns) {
        this(columns, null);
    }

    private Table(List<Column> columns, int[] selection) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(requireNonNull(columns)));
        this.columnIndex = new LinkedHashMap<>();
        int size = -1;
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (null != columnIndex.put(column.name(), i)) {
                throw new IllegalArgumentException(format("duplicate column name '%s'", column.name()));
            }
            if (-1 == size) {
                size = column.size();
            } else if (size != column.size()) {
                throw new IllegalSizeException(format("column '%s' has %d rows but '%s' has %d rows",
                        column.name(), column.size(), columns.get(0).name(), size));
            }
        }
        this.size = Math.max(size, 0);
        if (null != selection) {
            for (int row : selection) {
                if (row < 0 || row >= this.size) {
                    throw new IndexOutOfBoundsException(format("selected row %d, table size %d", row, this.size));
                }
            }
        }
        this.selection = selection;
    }

    /**
     * @param selection row numbers of the active rows, shared with the returned table
     * @return a table over the same columns whose active rows are restricted to selection
     */
    public Table select(int[] selection) {
        return new Table(columns, requireNonNull(selection));
    }

    /**
     * @return physical row count, regardless of the selection
     */
    public int size() {
        return size;
    }

    public boolean hasSelection() {
        return null != selection;
    }

    public int[] getSelection() {
        return selection;
    }

    public int activeCount() {
        return null == selection ? size : selection.length;
    }

    public int[] activeRows() {
        return null == selection ? ArrayUtil.sequence(size) : selection;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Map<String, Integer> getColumnIndex() {
        return columnIndex;
    }

    public Integer getIndex(String columnName) {
        return columnIndex.get(columnName);
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public Column getColumn(String columnName) {
        Integer index = columnIndex.get(columnName);
        if (null == index) {
            throw new ColumnNotExistsException(format("column '%s' not exists", columnName));
        }
        return columns.get(index);
    }

    public LinkedHashMap<String, Type> getColumnTypes() {
        LinkedHashMap<String, Type> types = new LinkedHashMap<>();
        for (Column column : columns) {
            types.put(column.name(), column.getType());
        }
        return types;
    }

    /**
     * @return the values of one physical row, in column order
     */
    public Comparable[] getRow(int row) {
        Comparable[] values = new Comparable[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = columns.get(i).get(row);
        }
        return values;
    }

    @Override
    public String toString() {
        return format("Table{columns=%s, size=%d, active=%d}", columnIndex.keySet(), size, activeCount());
    }
}
