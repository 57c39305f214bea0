package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.IntColumn;
import io.github.jaggr.table.LongColumn;
import io.github.jaggr.table.Type;

import java.math.BigDecimal;

/**
 * SUM(INT) / SUM(BIGINT) -> BIGDECIMAL. Adds in a long and carries into a BigDecimal only when
 * the long would overflow.
 */
public class IntegerDecimalSumState extends AbstractAggrState<IntegerDecimalSumState> {
    private long sum;
    private BigDecimal carry = BigDecimal.ZERO;

    public IntegerDecimalSumState(AggrFunction function) {
        super(function);
    }

    private void add(long v) {
        long r = sum + v;
        if (((sum ^ r) & (v ^ r)) < 0) {
            carry = CheckedMath.checkPrecision(carry.add(BigDecimal.valueOf(sum)), function);
            r = v;
        }
        sum = r;
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        if (function.getArgType() == Type.INT) {
            add(((IntColumn) column.values()).getInt(row));
        } else {
            add(((LongColumn) column.values()).getLong(row));
        }
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        int applied = 0;
        if (function.getArgType() == Type.INT) {
            IntColumn values = (IntColumn) column.values();
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (!values.isNull(row)) {
                    add(values.getInt(row));
                    applied++;
                }
            }
        } else {
            LongColumn values = (LongColumn) column.values();
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (!values.isNull(row)) {
                    add(values.getLong(row));
                    applied++;
                }
            }
        }
        return applied;
    }

    private BigDecimal total() {
        return CheckedMath.checkPrecision(carry.add(BigDecimal.valueOf(sum)), function);
    }

    @Override
    protected void doMerge(IntegerDecimalSumState other) {
        carry = CheckedMath.checkPrecision(carry.add(other.carry), function);
        add(other.sum);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : total();
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeUTF(total().toPlainString());
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        carry = CheckedMath.checkPrecision(carry.add(new BigDecimal(in.readUTF())), function);
    }
}
