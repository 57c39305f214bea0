package io.github.jaggr.executor;

import io.github.jaggr.table.SortOrder;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

public class GroupByColumn {
    private final String name;
    private final SortOrder order;

    public GroupByColumn(String name, SortOrder order) {
        this.name = requireNonNull(name);
        this.order = null == order ? SortOrder.ASC : order;
    }

    public static GroupByColumn asc(String name) {
        return new GroupByColumn(name, SortOrder.ASC);
    }

    public static GroupByColumn desc(String name) {
        return new GroupByColumn(name, SortOrder.DESC);
    }

    public String getName() {
        return name;
    }

    public SortOrder getOrder() {
        return order;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupByColumn that = (GroupByColumn) o;
        return name.equals(that.name) && order == that.order;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, order);
    }

    @Override
    public String toString() {
        return name + " " + order;
    }
}
