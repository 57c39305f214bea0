package io.github.jaggr.function;

import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.table.Type;

import java.util.Objects;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A descriptor resolved by {@link AggrFunctionFactory} to one concrete state class. Resolution
 * happens once at setup, {@link #newState()} only instantiates.
 */
public class AggrFunction {
    private final AggrFunctionDescriptor descriptor;
    private final Signature signature;
    private final AggrConfig config;
    private final Function<AggrFunction, AggrState> creator;

    AggrFunction(AggrFunctionDescriptor descriptor,
                 Signature signature,
                 AggrConfig config,
                 Function<AggrFunction, AggrState> creator) {
        this.descriptor = requireNonNull(descriptor);
        this.signature = requireNonNull(signature);
        this.config = requireNonNull(config);
        this.creator = requireNonNull(creator);
    }

    public AggrState newState() {
        return creator.apply(this);
    }

    public AggrFunctionDescriptor getDescriptor() {
        return descriptor;
    }

    public Signature getSignature() {
        return signature;
    }

    public AggrConfig getConfig() {
        return config;
    }

    public Type getReturnType() {
        return signature.returnType;
    }

    public Type getArgType() {
        return signature.argType;
    }

    public String getName() {
        return descriptor.getName();
    }

    @Override
    public String toString() {
        return descriptor.getName() + signature;
    }

    /**
     * Identifies a specialization: two states can be merged only if their signatures are equal.
     */
    public static final class Signature {
        private final AggrFunctionKind kind;
        // null for COUNT(*)
        private final Type argType;
        private final Type returnType;
        private final boolean distinct;

        public Signature(AggrFunctionKind kind, Type argType, Type returnType, boolean distinct) {
            this.kind = requireNonNull(kind);
            this.argType = argType;
            this.returnType = requireNonNull(returnType);
            this.distinct = distinct;
        }

        public AggrFunctionKind getKind() {
            return kind;
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

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Signature that = (Signature) o;
            return distinct == that.distinct &&
                    kind == that.kind &&
                    argType == that.argType &&
                    returnType == that.returnType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, argType, returnType, distinct);
        }

        @Override
        public String toString() {
            return "[" + kind + (distinct ? " DISTINCT" : "") + "(" + (null == argType ? "*" : argType) + ") -> " + returnType + "]";
        }
    }
}
