package io.github.jaggr.function;

public enum AggrFunctionKind {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    // value of the first row of the group, NULL included
    FIRST,
    BIT_AND,
    BIT_OR,
    BIT_XOR,
    VAR_POP,
    VAR_SAMP,
    STDDEV_POP,
    STDDEV_SAMP,
    APPROX_COUNT_DISTINCT;

    private static AggrFunctionKind[] cache = values();
    public static AggrFunctionKind valueOf(int ordinal) {
        if (ordinal < 0 || ordinal >= cache.length) {
            throw new IllegalArgumentException("aggregate function ordinal " + ordinal);
        }
        return cache[ordinal];
    }

    public boolean isVariance() {
        return this == VAR_POP || this == VAR_SAMP || this == STDDEV_POP || this == STDDEV_SAMP;
    }

    public boolean isBitwise() {
        return this == BIT_AND || this == BIT_OR || this == BIT_XOR;
    }
}
