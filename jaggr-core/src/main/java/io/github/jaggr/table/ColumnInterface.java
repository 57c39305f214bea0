package io.github.jaggr.table;

public interface ColumnInterface<T extends Comparable> {
    long size();
    void add(T value);
    T get(int index);
    boolean isNull(int index);
}
