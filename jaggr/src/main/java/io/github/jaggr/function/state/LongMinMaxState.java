package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.LongColumn;

/**
 * MIN(BIGINT) / MAX(BIGINT) -> BIGINT
 */
public class LongMinMaxState extends AbstractAggrState<LongMinMaxState> {
    private final boolean max;
    private long value;

    public LongMinMaxState(AggrFunction function) {
        super(function);
        this.max = function.getSignature().getKind() == AggrFunctionKind.MAX;
    }

    private void accept(long v) {
        if (isEmpty() || (max ? v > value : v < value)) {
            value = v;
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        LongColumn values = (LongColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        accept(values.getLong(row));
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        LongColumn values = (LongColumn) column.values();
        boolean has = !isEmpty();
        long m = value;
        int applied = 0;
        if (max) {
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                long v = values.getLong(row);
                if (!has || v > m) {
                    m = v;
                    has = true;
                }
                applied++;
            }
        } else {
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                long v = values.getLong(row);
                if (!has || v < m) {
                    m = v;
                    has = true;
                }
                applied++;
            }
        }
        value = m;
        return applied;
    }

    @Override
    protected void doMerge(LongMinMaxState other) {
        accept(other.value);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        accept(in.readLong());
    }
}
