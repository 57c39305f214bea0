package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;

/**
 * COUNT(expr): counts the rows whose argument is not NULL, works for every argument type.
 */
public class CountState extends AbstractAggrState<CountState> {
    private long count;

    public CountState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        count = CheckedMath.add(count, 1, function);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        int applied = 0;
        for (int i = from; i < to; i++) {
            if (!column.isNull(rows[i])) {
                applied++;
            }
        }
        count = CheckedMath.add(count, applied, function);
        return applied;
    }

    @Override
    protected void doMerge(CountState other) {
        count = CheckedMath.add(count, other.count, function);
    }

    @Override
    protected Comparable doFinish() {
        return count;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(count);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        count = CheckedMath.add(count, in.readLong(), function);
    }
}
