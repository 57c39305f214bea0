package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.DoubleColumn;

/**
 * AVG(DOUBLE) -> DOUBLE. Partial state: count, sum.
 */
public class DoubleAvgState extends AbstractAggrState<DoubleAvgState> {
    private long count;
    private double sum;

    public DoubleAvgState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        DoubleColumn values = (DoubleColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        sum = CheckedMath.checkFinite(sum + values.getDouble(row), function);
        count++;
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        DoubleColumn values = (DoubleColumn) column.values();
        double s = sum;
        int applied = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (values.isNull(row)) {
                continue;
            }
            s += values.getDouble(row);
            applied++;
        }
        sum = CheckedMath.checkFinite(s, function);
        count += applied;
        return applied;
    }

    @Override
    protected void doMerge(DoubleAvgState other) {
        sum = CheckedMath.checkFinite(sum + other.sum, function);
        count = CheckedMath.add(count, other.count, function);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : sum / count;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(count);
        out.writeDouble(sum);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        count = CheckedMath.add(count, in.readLong(), function);
        sum = CheckedMath.checkFinite(sum + in.readDouble(), function);
    }
}
