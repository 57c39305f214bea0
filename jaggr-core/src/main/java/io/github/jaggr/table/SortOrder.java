package io.github.jaggr.table;

/**
 * NULL is the smallest value: first for ASC, last for DESC.
 */
public enum SortOrder {
    ASC,
    DESC
}
