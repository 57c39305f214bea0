package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.BigDecimalColumn;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.LongColumn;
import io.github.jaggr.table.Type;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * AVG(BIGINT) / AVG(BIGDECIMAL) -> BIGDECIMAL, the result scale is the scale of the sum plus
 * {@code jaggr.avg.div.precision.increment}. Partial state: count, sum.
 */
public class DecimalAvgState extends AbstractAggrState<DecimalAvgState> {
    private long count;
    private BigDecimal sum = BigDecimal.ZERO;
    // BIGINT arguments add up here until the next add would overflow
    private long longSum;

    public DecimalAvgState(AggrFunction function) {
        super(function);
    }

    private void addLong(long v) {
        long r = longSum + v;
        if (((longSum ^ r) & (v ^ r)) < 0) {
            sum = CheckedMath.checkPrecision(sum.add(BigDecimal.valueOf(longSum)), function);
            r = v;
        }
        longSum = r;
    }

    private BigDecimal total() {
        return CheckedMath.checkPrecision(sum.add(BigDecimal.valueOf(longSum)), function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        if (function.getArgType() == Type.BIGINT) {
            addLong(((LongColumn) column.values()).getLong(row));
        } else {
            sum = CheckedMath.checkPrecision(sum.add(((BigDecimalColumn) column.values()).get(row)), function);
        }
        count++;
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        int applied = 0;
        if (function.getArgType() == Type.BIGINT) {
            LongColumn values = (LongColumn) column.values();
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                addLong(values.getLong(row));
                applied++;
            }
        } else {
            BigDecimalColumn values = (BigDecimalColumn) column.values();
            for (int i = from; i < to; i++) {
                BigDecimal value = values.get(rows[i]);
                if (null == value) {
                    continue;
                }
                sum = CheckedMath.checkPrecision(sum.add(value), function);
                applied++;
            }
        }
        count += applied;
        return applied;
    }

    @Override
    protected void doMerge(DecimalAvgState other) {
        sum = CheckedMath.checkPrecision(sum.add(other.total()), function);
        count = CheckedMath.add(count, other.count, function);
    }

    @Override
    protected Comparable doFinish() {
        if (isEmpty()) {
            return null;
        }
        BigDecimal total = total();
        int scale = Math.max(total.scale(), 0) + function.getConfig().getAvgDivPrecisionIncrement();
        return total.divide(BigDecimal.valueOf(count), scale, RoundingMode.HALF_UP);
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(count);
        out.writeUTF(total().toString());
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        count = CheckedMath.add(count, in.readLong(), function);
        sum = CheckedMath.checkPrecision(sum.add(new BigDecimal(in.readUTF())), function);
    }
}
