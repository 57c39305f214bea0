package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.IntColumn;

/**
 * MIN(INT) / MAX(INT) -> INT
 */
public class IntMinMaxState extends AbstractAggrState<IntMinMaxState> {
    private final boolean max;
    private int value;

    public IntMinMaxState(AggrFunction function) {
        super(function);
        this.max = function.getSignature().getKind() == AggrFunctionKind.MAX;
    }

    private void accept(int v) {
        if (isEmpty() || (max ? v > value : v < value)) {
            value = v;
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        IntColumn values = (IntColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        accept(values.getInt(row));
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        IntColumn values = (IntColumn) column.values();
        boolean has = !isEmpty();
        int m = value;
        int applied = 0;
        if (max) {
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                int v = values.getInt(row);
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
                int v = values.getInt(row);
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
    protected void doMerge(IntMinMaxState other) {
        accept(other.value);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeInt(value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        accept(in.readInt());
    }
}
