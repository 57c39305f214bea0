package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.LongColumn;

/**
 * SUM(BIGINT) -> BIGINT, raises OverflowException past the BIGINT range
 */
public class LongSumState extends AbstractAggrState<LongSumState> {
    private long sum;

    public LongSumState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        LongColumn values = (LongColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        sum = CheckedMath.add(sum, values.getLong(row), function);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        LongColumn values = (LongColumn) column.values();
        long s = sum;
        int applied = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (values.isNull(row)) {
                continue;
            }
            s = CheckedMath.add(s, values.getLong(row), function);
            applied++;
        }
        sum = s;
        return applied;
    }

    @Override
    protected void doMerge(LongSumState other) {
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
