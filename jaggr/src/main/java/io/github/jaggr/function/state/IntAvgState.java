package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.IntColumn;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * AVG(INT) -> BIGDECIMAL with {@code jaggr.avg.div.precision.increment} fraction digits.
 * Partial state: count, sum.
 */
public class IntAvgState extends AbstractAggrState<IntAvgState> {
    private long count;
    private long sum;

    public IntAvgState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        IntColumn values = (IntColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        sum = CheckedMath.add(sum, values.getInt(row), function);
        count++;
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
        count += applied;
        return applied;
    }

    @Override
    protected void doMerge(IntAvgState other) {
        sum = CheckedMath.add(sum, other.sum, function);
        count = CheckedMath.add(count, other.count, function);
    }

    @Override
    protected Comparable doFinish() {
        if (isEmpty()) {
            return null;
        }
        return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count),
                function.getConfig().getAvgDivPrecisionIncrement(),
                RoundingMode.HALF_UP);
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(count);
        out.writeLong(sum);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        count = CheckedMath.add(count, in.readLong(), function);
        sum = CheckedMath.add(sum, in.readLong(), function);
    }
}
