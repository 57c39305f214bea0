package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.IntColumn;
import io.github.jaggr.table.LongColumn;
import io.github.jaggr.table.Type;

/**
 * BIT_AND / BIT_OR / BIT_XOR over INT or BIGINT -> BIGINT. The seed is the identity of the
 * operation, so an empty group returns all ones for BIT_AND and 0 for the others. INT arguments
 * are sign extended.
 */
public class BitState extends AbstractAggrState<BitState> {
    private final AggrFunctionKind kind;
    private final boolean intArg;
    private long value;

    public BitState(AggrFunction function) {
        super(function);
        this.kind = function.getSignature().getKind();
        this.intArg = function.getArgType() == Type.INT;
        this.value = kind == AggrFunctionKind.BIT_AND ? -1L : 0L;
    }

    private long combine(long a, long b) {
        switch (kind) {
            case BIT_AND:
                return a & b;
            case BIT_OR:
                return a | b;
            case BIT_XOR:
                return a ^ b;
            default:
                throw new IllegalStateException(kind.name());
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        long v = intArg ? ((IntColumn) column.values()).getInt(row) : ((LongColumn) column.values()).getLong(row);
        value = combine(value, v);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        long acc = value;
        int applied = 0;
        if (intArg) {
            IntColumn values = (IntColumn) column.values();
            switch (kind) {
                case BIT_AND:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc &= values.getInt(rows[i]);
                            applied++;
                        }
                    }
                    break;
                case BIT_OR:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc |= values.getInt(rows[i]);
                            applied++;
                        }
                    }
                    break;
                default:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc ^= values.getInt(rows[i]);
                            applied++;
                        }
                    }
            }
        } else {
            LongColumn values = (LongColumn) column.values();
            switch (kind) {
                case BIT_AND:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc &= values.getLong(rows[i]);
                            applied++;
                        }
                    }
                    break;
                case BIT_OR:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc |= values.getLong(rows[i]);
                            applied++;
                        }
                    }
                    break;
                default:
                    for (int i = from; i < to; i++) {
                        if (!values.isNull(rows[i])) {
                            acc ^= values.getLong(rows[i]);
                            applied++;
                        }
                    }
            }
        }
        value = acc;
        return applied;
    }

    @Override
    protected void doMerge(BitState other) {
        value = combine(value, other.value);
    }

    @Override
    protected Comparable doFinish() {
        return value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        value = combine(value, in.readLong());
    }
}
