package io.github.jaggr.table;

import io.github.jaggr.exception.UnknownTypeException;

import java.math.BigDecimal;

public enum Type {
    VARBYTE,
    INT,
    BIGINT,
    DOUBLE,
    BIGDECIMAL,
    // utf-8 encoded, stored the same way as VARBYTE
    VARCHAR;

    private static Type[] cache = values();
    public static Type valueOf(int ordinal) {
        if (ordinal < 0 || ordinal >= cache.length) {
            throw new UnknownTypeException("type ordinal " + ordinal);
        }
        return cache[ordinal];
    }

    public static Type getType(Object object) {
        if (null == object) {
            throw new NullPointerException();
        }

        Class clazz = object.getClass();
        if (clazz == Integer.class) {
            return INT;
        }
        if (clazz == Long.class) {
            return BIGINT;
        }
        if (clazz == Double.class) {
            return DOUBLE;
        }
        if (clazz == ByteArray.class || clazz == byte[].class) {
            return VARBYTE;
        }
        if (clazz == String.class) {
            return VARCHAR;
        }
        if (clazz == BigDecimal.class) {
            return BIGDECIMAL;
        }

        throw new UnknownTypeException(object.getClass().getName());
    }

    public boolean isBytes() {
        return this == VARBYTE || this == VARCHAR;
    }

    public boolean isInteger() {
        return this == INT || this == BIGINT;
    }

    public boolean accepts(Object object) {
        Type type = getType(object);
        if (type == this) {
            return true;
        }
        return isBytes() && type.isBytes();
    }
}
