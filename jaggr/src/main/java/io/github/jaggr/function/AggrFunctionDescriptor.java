package io.github.jaggr.function;

import io.github.jaggr.table.Type;

import java.util.Locale;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * What the caller asks for: function kind, the input column it reads, the declared argument and
 * return types and the DISTINCT flag. A null argument means {@code COUNT(*)}, a null return type
 * lets the factory pick the default return type of the specialization.
 */
public class AggrFunctionDescriptor {
    private final AggrFunctionKind kind;
    private final String arg;
    private final Type argType;
    private final Type returnType;
    private final boolean distinct;
    private final String name;

    public AggrFunctionDescriptor(AggrFunctionKind kind,
                                  String arg,
                                  Type argType,
                                  Type returnType,
                                  boolean distinct,
                                  String name) {
        this.kind = requireNonNull(kind);
        this.arg = arg;
        this.argType = argType;
        this.returnType = returnType;
        this.distinct = distinct;
        this.name = null == name ? defaultName(kind, arg, distinct) : name;
        if ((null == arg) != (null == argType)) {
            throw new IllegalArgumentException("arg and argType must both be set or both be null");
        }
    }

    public static AggrFunctionDescriptor countStar() {
        return new AggrFunctionDescriptor(AggrFunctionKind.COUNT, null, null, Type.BIGINT, false, null);
    }

    public static AggrFunctionDescriptor of(AggrFunctionKind kind, String arg, Type argType) {
        return new AggrFunctionDescriptor(kind, requireNonNull(arg), requireNonNull(argType), null, false, null);
    }

    public static AggrFunctionDescriptor of(AggrFunctionKind kind, String arg, Type argType, Type returnType) {
        return new AggrFunctionDescriptor(kind, requireNonNull(arg), requireNonNull(argType), returnType, false, null);
    }

    public static AggrFunctionDescriptor distinct(AggrFunctionKind kind, String arg, Type argType) {
        return new AggrFunctionDescriptor(kind, requireNonNull(arg), requireNonNull(argType), null, true, null);
    }

    public AggrFunctionDescriptor withName(String name) {
        return new AggrFunctionDescriptor(kind, arg, argType, returnType, distinct, requireNonNull(name));
    }

    public AggrFunctionDescriptor withReturnType(Type returnType) {
        return new AggrFunctionDescriptor(kind, arg, argType, returnType, distinct, name);
    }

    private static String defaultName(AggrFunctionKind kind, String arg, boolean distinct) {
        return kind.name().toLowerCase(Locale.ROOT) + "(" + (distinct ? "distinct " : "") + (null == arg ? "*" : arg) + ")";
    }

    public AggrFunctionKind getKind() {
        return kind;
    }

    public String getArg() {
        return arg;
    }

    public Type getArgType() {
        return argType;
    }

    public Type getReturnType() {
        return returnType;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public String getName() {
        return name;
    }

    public boolean isCountStar() {
        return kind == AggrFunctionKind.COUNT && null == arg;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggrFunctionDescriptor that = (AggrFunctionDescriptor) o;
        return distinct == that.distinct &&
                kind == that.kind &&
                Objects.equals(arg, that.arg) &&
                argType == that.argType &&
                returnType == that.returnType &&
                name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, arg, argType, returnType, distinct, name);
    }

    @Override
    public String toString() {
        return name + ":" + (null == argType ? "" : argType + "->") + (null == returnType ? "?" : returnType);
    }
}
