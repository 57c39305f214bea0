package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.BigDecimalColumn;
import io.github.jaggr.table.Column;

import java.math.BigDecimal;

/**
 * SUM(BIGDECIMAL) -> BIGDECIMAL
 */
public class DecimalSumState extends AbstractAggrState<DecimalSumState> {
    private BigDecimal sum = BigDecimal.ZERO;

    public DecimalSumState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        BigDecimal value = ((BigDecimalColumn) column.values()).get(row);
        if (null == value) {
            return false;
        }
        sum = CheckedMath.checkPrecision(sum.add(value), function);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        BigDecimalColumn values = (BigDecimalColumn) column.values();
        int applied = 0;
        for (int i = from; i < to; i++) {
            BigDecimal value = values.get(rows[i]);
            if (null == value) {
                continue;
            }
            sum = CheckedMath.checkPrecision(sum.add(value), function);
            applied++;
        }
        return applied;
    }

    @Override
    protected void doMerge(DecimalSumState other) {
        sum = CheckedMath.checkPrecision(sum.add(other.sum), function);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : sum;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeUTF(sum.toString());
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        sum = CheckedMath.checkPrecision(sum.add(new BigDecimal(in.readUTF())), function);
    }
}
