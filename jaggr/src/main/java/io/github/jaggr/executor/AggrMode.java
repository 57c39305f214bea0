package io.github.jaggr.executor;

public enum AggrMode {
    // unordered input, one hash table entry per group
    HASH,
    // input sorted by the grouping columns, one live group
    STREAM,
    // no grouping columns, exactly one output row
    SIMPLE
}
