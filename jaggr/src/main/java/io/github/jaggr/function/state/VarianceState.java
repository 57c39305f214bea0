package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.function.CheckedMath;
import io.github.jaggr.table.BigDecimalColumn;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.DoubleColumn;
import io.github.jaggr.table.IntColumn;
import io.github.jaggr.table.LongColumn;

/**
 * VAR_POP, VAR_SAMP, STDDEV_POP and STDDEV_SAMP -> DOUBLE.
 * <p>
 * Keeps count, mean and the sum of squared deviations (Welford), partial states are combined with
 * the pairwise formula of Chan et al. The sample variants are NULL for fewer than two rows.
 */
public class VarianceState extends AbstractAggrState<VarianceState> {
    private final AggrFunctionKind kind;
    private long count;
    private double mean;
    private double m2;

    public VarianceState(AggrFunction function) {
        super(function);
        this.kind = function.getSignature().getKind();
    }

    private void add(double x) {
        count++;
        double delta = x - mean;
        mean = CheckedMath.checkFinite(mean + delta / count, function);
        m2 = CheckedMath.checkFinite(m2 + delta * (x - mean), function);
    }

    private void combine(long otherCount, double otherMean, double otherM2) {
        long n = CheckedMath.add(count, otherCount, function);
        double delta = otherMean - mean;
        m2 = CheckedMath.checkFinite(m2 + otherM2 + delta * delta * ((double) count * otherCount / n), function);
        mean = mean + delta * otherCount / n;
        count = n;
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        add(((Number) column.get(row)).doubleValue());
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        long before = count;
        switch (function.getArgType()) {
            case INT: {
                IntColumn values = (IntColumn) column.values();
                for (int i = from; i < to; i++) {
                    if (!values.isNull(rows[i])) {
                        add(values.getInt(rows[i]));
                    }
                }
                break;
            }
            case BIGINT: {
                LongColumn values = (LongColumn) column.values();
                for (int i = from; i < to; i++) {
                    if (!values.isNull(rows[i])) {
                        add(values.getLong(rows[i]));
                    }
                }
                break;
            }
            case DOUBLE: {
                DoubleColumn values = (DoubleColumn) column.values();
                for (int i = from; i < to; i++) {
                    if (!values.isNull(rows[i])) {
                        add(values.getDouble(rows[i]));
                    }
                }
                break;
            }
            default: {
                BigDecimalColumn values = (BigDecimalColumn) column.values();
                for (int i = from; i < to; i++) {
                    if (!values.isNull(rows[i])) {
                        add(values.get(rows[i]).doubleValue());
                    }
                }
            }
        }
        return (int) (count - before);
    }

    @Override
    protected void doMerge(VarianceState other) {
        combine(other.count, other.mean, other.m2);
    }

    @Override
    protected Comparable doFinish() {
        if (isEmpty()) {
            return null;
        }
        boolean sample = kind == AggrFunctionKind.VAR_SAMP || kind == AggrFunctionKind.STDDEV_SAMP;
        if (sample && count < 2) {
            return null;
        }
        double variance = Math.max(m2, 0d) / (sample ? count - 1 : count);
        if (kind == AggrFunctionKind.STDDEV_POP || kind == AggrFunctionKind.STDDEV_SAMP) {
            return Math.sqrt(variance);
        }
        return variance;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeLong(count);
        out.writeDouble(mean);
        out.writeDouble(m2);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        long otherCount = in.readLong();
        double otherMean = in.readDouble();
        double otherM2 = in.readDouble();
        if (otherCount > 0) {
            combine(otherCount, otherMean, otherM2);
        }
    }
}
