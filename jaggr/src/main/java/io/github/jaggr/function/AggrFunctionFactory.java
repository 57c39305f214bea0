package io.github.jaggr.function;

import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.exception.UnsupportedFunctionException;
import io.github.jaggr.function.state.BitState;
import io.github.jaggr.function.state.BytesMinMaxState;
import io.github.jaggr.function.state.CountStarState;
import io.github.jaggr.function.state.CountState;
import io.github.jaggr.function.state.DecimalAvgState;
import io.github.jaggr.function.state.DecimalMinMaxState;
import io.github.jaggr.function.state.DecimalSumState;
import io.github.jaggr.function.state.DistinctState;
import io.github.jaggr.function.state.DoubleAvgState;
import io.github.jaggr.function.state.DoubleMinMaxState;
import io.github.jaggr.function.state.DoubleSumState;
import io.github.jaggr.function.state.FirstState;
import io.github.jaggr.function.state.HyperLogLogState;
import io.github.jaggr.function.state.IntAvgState;
import io.github.jaggr.function.state.IntMinMaxState;
import io.github.jaggr.function.state.IntSumState;
import io.github.jaggr.function.state.IntegerDecimalSumState;
import io.github.jaggr.function.state.LongMinMaxState;
import io.github.jaggr.function.state.LongSumState;
import io.github.jaggr.function.state.VarianceState;
import io.github.jaggr.table.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolves descriptors to specializations. Each distinct signature is resolved once per factory,
 * later descriptors with the same signature reuse the state constructor.
 */
public class AggrFunctionFactory {
    private static final Logger logger = LoggerFactory.getLogger(AggrFunctionFactory.class);

    private final AggrConfig config;
    private final Map<AggrFunction.Signature, Function<AggrFunction, AggrState>> creators = new ConcurrentHashMap<>();

    public AggrFunctionFactory() {
        this(AggrConfig.get());
    }

    public AggrFunctionFactory(AggrConfig config) {
        this.config = requireNonNull(config);
    }

    public AggrConfig getConfig() {
        return config;
    }

    /**
     * @throws UnsupportedFunctionException if no specialization exists for the kind, argument
     *                                      type, return type and distinct flag of the descriptor
     */
    public AggrFunction create(AggrFunctionDescriptor descriptor) {
        requireNonNull(descriptor);
        if (null == descriptor.getArgType() && descriptor.getKind() != AggrFunctionKind.COUNT) {
            throw unsupported(descriptor.getKind(), null, descriptor.getReturnType(), descriptor.isDistinct());
        }
        Type returnType = null == descriptor.getReturnType()
                ? defaultReturnType(descriptor.getKind(), descriptor.getArgType())
                : descriptor.getReturnType();
        AggrFunction.Signature signature = new AggrFunction.Signature(descriptor.getKind(),
                descriptor.getArgType(),
                returnType,
                descriptor.isDistinct());
        Function<AggrFunction, AggrState> creator = creators.get(signature);
        if (null == creator) {
            creator = resolve(descriptor, signature);
            creators.putIfAbsent(signature, creator);
            logger.debug("resolved {} for {}", signature, descriptor.getName());
        }
        return new AggrFunction(descriptor, signature, config, creator);
    }

    private Type defaultReturnType(AggrFunctionKind kind, Type argType) {
        switch (kind) {
            case COUNT:
            case APPROX_COUNT_DISTINCT:
            case BIT_AND:
            case BIT_OR:
            case BIT_XOR:
                return Type.BIGINT;
            case SUM:
                if (argType == Type.INT || argType == Type.BIGINT) {
                    return Type.BIGINT;
                }
                return argType;
            case AVG:
                return argType == Type.DOUBLE ? Type.DOUBLE : Type.BIGDECIMAL;
            case VAR_POP:
            case VAR_SAMP:
            case STDDEV_POP:
            case STDDEV_SAMP:
                return Type.DOUBLE;
            default:
                return argType;
        }
    }

    private Function<AggrFunction, AggrState> resolve(AggrFunctionDescriptor descriptor, AggrFunction.Signature signature) {
        AggrFunctionKind kind = signature.getKind();
        Type argType = signature.getArgType();
        Type returnType = signature.getReturnType();
        if (!signature.isDistinct()) {
            return resolvePlain(kind, argType, returnType);
        }

        if (null == argType || !supportsDistinct(kind)) {
            throw unsupported(kind, argType, returnType, true);
        }
        AggrFunction inner = create(new AggrFunctionDescriptor(kind,
                descriptor.getArg(),
                argType,
                returnType,
                false,
                descriptor.getName()));
        return function -> new DistinctState(function, inner.newState());
    }

    private static boolean supportsDistinct(AggrFunctionKind kind) {
        switch (kind) {
            case COUNT:
            case SUM:
            case AVG:
            case MIN:
            case MAX:
                return true;
            default:
                return kind.isVariance();
        }
    }

    private Function<AggrFunction, AggrState> resolvePlain(AggrFunctionKind kind, Type argType, Type returnType) {
        if (null == argType) {
            if (kind == AggrFunctionKind.COUNT && returnType == Type.BIGINT) {
                return CountStarState::new;
            }
            throw unsupported(kind, null, returnType, false);
        }

        switch (kind) {
            case COUNT:
                if (returnType == Type.BIGINT) {
                    return CountState::new;
                }
                break;
            case SUM:
                return resolveSum(argType, returnType);
            case AVG:
                return resolveAvg(argType, returnType);
            case MIN:
            case MAX:
                if (returnType == argType) {
                    return resolveMinMax(argType);
                }
                break;
            case FIRST:
                if (returnType == argType) {
                    return FirstState::new;
                }
                break;
            case BIT_AND:
            case BIT_OR:
            case BIT_XOR:
                if (argType.isInteger() && returnType == Type.BIGINT) {
                    return BitState::new;
                }
                break;
            case VAR_POP:
            case VAR_SAMP:
            case STDDEV_POP:
            case STDDEV_SAMP:
                if (isNumeric(argType) && returnType == Type.DOUBLE) {
                    return VarianceState::new;
                }
                break;
            case APPROX_COUNT_DISTINCT:
                if (returnType == Type.BIGINT) {
                    return HyperLogLogState::new;
                }
                break;
            default:
                break;
        }
        throw unsupported(kind, argType, returnType, false);
    }

    private Function<AggrFunction, AggrState> resolveSum(Type argType, Type returnType) {
        switch (argType) {
            case INT:
                if (returnType == Type.BIGINT) {
                    return IntSumState::new;
                }
                if (returnType == Type.BIGDECIMAL) {
                    return IntegerDecimalSumState::new;
                }
                break;
            case BIGINT:
                if (returnType == Type.BIGINT) {
                    return LongSumState::new;
                }
                if (returnType == Type.BIGDECIMAL) {
                    return IntegerDecimalSumState::new;
                }
                break;
            case DOUBLE:
                if (returnType == Type.DOUBLE) {
                    return DoubleSumState::new;
                }
                break;
            case BIGDECIMAL:
                if (returnType == Type.BIGDECIMAL) {
                    return DecimalSumState::new;
                }
                break;
            default:
                break;
        }
        throw unsupported(AggrFunctionKind.SUM, argType, returnType, false);
    }

    private Function<AggrFunction, AggrState> resolveAvg(Type argType, Type returnType) {
        switch (argType) {
            case INT:
                if (returnType == Type.BIGDECIMAL) {
                    return IntAvgState::new;
                }
                break;
            case BIGINT:
            case BIGDECIMAL:
                if (returnType == Type.BIGDECIMAL) {
                    return DecimalAvgState::new;
                }
                break;
            case DOUBLE:
                if (returnType == Type.DOUBLE) {
                    return DoubleAvgState::new;
                }
                break;
            default:
                break;
        }
        throw unsupported(AggrFunctionKind.AVG, argType, returnType, false);
    }

    private static Function<AggrFunction, AggrState> resolveMinMax(Type argType) {
        switch (argType) {
            case INT:
                return IntMinMaxState::new;
            case BIGINT:
                return LongMinMaxState::new;
            case DOUBLE:
                return DoubleMinMaxState::new;
            case BIGDECIMAL:
                return DecimalMinMaxState::new;
            case VARBYTE:
            case VARCHAR:
                return BytesMinMaxState::new;
            default:
                throw new IllegalStateException(argType.name());
        }
    }

    private static boolean isNumeric(Type type) {
        return type == Type.INT || type == Type.BIGINT || type == Type.DOUBLE || type == Type.BIGDECIMAL;
    }

    private static UnsupportedFunctionException unsupported(AggrFunctionKind kind, Type argType, Type returnType, boolean distinct) {
        return new UnsupportedFunctionException(format("unsupported aggregate function %s%s(%s)%s",
                kind,
                distinct ? " DISTINCT" : "",
                null == argType ? "*" : argType,
                null == returnType ? "" : " -> " + returnType));
    }
}
