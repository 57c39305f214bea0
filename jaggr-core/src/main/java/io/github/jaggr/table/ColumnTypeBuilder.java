package io.github.jaggr.table;

import java.util.LinkedHashMap;

public class ColumnTypeBuilder {
    private final LinkedHashMap<String, Type> columnTypeMap = new LinkedHashMap<>();

    public ColumnTypeBuilder column(String name, Type type) {
        if (null != columnTypeMap.put(name, type)) {
            throw new IllegalArgumentException("duplicate column: " + name);
        }
        return this;
    }

    public LinkedHashMap<String, Type> build() {
        return columnTypeMap;
    }
}
