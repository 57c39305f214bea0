package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.IntColumn;

/**
 * SUM(INT) -> BIGINT
 */
public class IntSumState extends AbstractAggrState<IntSumState> {
    private long sum;

    public IntSumState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        IntColumn values = (IntColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        sum = CheckedMath.add(sum, values.getInt(row), function);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        IntColumn values = (IntColumn) column.values();
        long s = sum;
        int applied = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (values.isNull(row)) {
                continue;
            }
            s = CheckedMath.add(s, values.getInt(row), function);
            applied++;
        }
        sum = s;
        return applied;
    }

    @Override
    protected void doMerge(IntSumState other) {
        sum = CheckedMath.add(sum, other.sum, function);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : sum;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(sum);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        sum = CheckedMath.add(sum, in.readLong(), function);
    }
}
