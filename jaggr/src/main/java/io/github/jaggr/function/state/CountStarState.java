package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;

/**
 * COUNT(*): every row counts, NULL or not.
 */
public class CountStarState extends AbstractAggrState<CountStarState> {
    private long count;

    public CountStarState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        count = CheckedMath.add(count, 1, function);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        count = CheckedMath.add(count, to - from, function);
        return to - from;
    }

    @Override
    protected void doMerge(CountStarState other) {
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
