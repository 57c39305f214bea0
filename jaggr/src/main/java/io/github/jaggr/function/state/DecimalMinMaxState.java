package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.BigDecimalColumn;
import io.github.jaggr.table.Column;

import java.math.BigDecimal;

/**
 * MIN(BIGDECIMAL) / MAX(BIGDECIMAL) -> BIGDECIMAL, values equal by compareTo keep the first seen.
 */
public class DecimalMinMaxState extends AbstractAggrState<DecimalMinMaxState> {
    private final int sign;
    private BigDecimal value;

    public DecimalMinMaxState(AggrFunction function) {
        super(function);
        this.sign = function.getSignature().getKind() == AggrFunctionKind.MAX ? 1 : -1;
    }

    private void accept(BigDecimal v) {
        if (null == value || v.compareTo(value) * sign > 0) {
            value = v;
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        BigDecimal v = ((BigDecimalColumn) column.values()).get(row);
        if (null == v) {
            return false;
        }
        accept(v);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        BigDecimalColumn values = (BigDecimalColumn) column.values();
        int applied = 0;
        for (int i = from; i < to; i++) {
            BigDecimal v = values.get(rows[i]);
            if (null == v) {
                continue;
            }
            accept(v);
            applied++;
        }
        return applied;
    }

    @Override
    protected void doMerge(DecimalMinMaxState other) {
        accept(other.value);
    }

    @Override
    protected Comparable doFinish() {
        return value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeUTF(value.toString());
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        accept(new BigDecimal(in.readUTF()));
    }
}
