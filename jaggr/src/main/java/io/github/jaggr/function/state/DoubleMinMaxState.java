package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.DoubleColumn;

/**
 * MIN(DOUBLE) / MAX(DOUBLE) -> DOUBLE
 */
public class DoubleMinMaxState extends AbstractAggrState<DoubleMinMaxState> {
    private final boolean max;
    private double value;

    public DoubleMinMaxState(AggrFunction function) {
        super(function);
        this.max = function.getSignature().getKind() == AggrFunctionKind.MAX;
    }

    private void accept(double v) {
        if (isEmpty() || (max ? Double.compare(v, value) > 0 : Double.compare(v, value) < 0)) {
            value = v;
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        DoubleColumn values = (DoubleColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        accept(values.getDouble(row));
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        DoubleColumn values = (DoubleColumn) column.values();
        boolean has = !isEmpty();
        double m = value;
        int applied = 0;
        if (max) {
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                double v = values.getDouble(row);
                if (!has || Double.compare(v, m) > 0) {
                    m = v;
                    has = true;
                }
                applied++;
            }
        } else {
            for (int i = from; i < to; i++) {
                int row = rows[i];
                if (values.isNull(row)) {
                    continue;
                }
                double v = values.getDouble(row);
                if (!has || Double.compare(v, m) < 0) {
                    m = v;
                    has = true;
                }
                applied++;
            }
        }
        value = m;
        return applied;
    }

    @Override
    protected void doMerge(DoubleMinMaxState other) {
        accept(other.value);
    }

    @Override
    protected Comparable doFinish() {
        return isEmpty() ? null : value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeDouble(value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        accept(in.readDouble());
    }
}
