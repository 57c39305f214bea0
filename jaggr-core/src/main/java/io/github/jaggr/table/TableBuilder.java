package io.github.jaggr.table;

import io.github.jaggr.ArrayUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

public class TableBuilder {
    private final List<Column> columns;

    public TableBuilder(Map<String, Type> columnTypeMap) {
        this(columnTypeMap, ArrayUtil.DEFAULT_CAPACITY);
    }

    public TableBuilder(Map<String, Type> columnTypeMap, int initSize) {
        columns = new ArrayList<>(columnTypeMap.size());
        for (Map.Entry<String, Type> entry : columnTypeMap.entrySet()) {
            columns.add(new Column(entry.getKey(), entry.getValue(), initSize));
        }
    }

    public void append(int columnIndex, Comparable comparable) {
        columns.get(columnIndex).add(comparable);
    }

    public void appendRow(Comparable... values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(format("row has %d values but table has %d columns",
                    values.length, columns.size()));
        }
        for (int i = 0; i < values.length; i++) {
            columns.get(i).add(values[i]);
        }
    }

    public int size() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public Table build() {
        return new Table(columns);
    }
}
