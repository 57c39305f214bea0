package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;

/**
 * FIRST(expr): the argument of the first row of the group, which may be NULL. Merging keeps the
 * value already held, so across partial states the result is any one of the first values.
 */
public class FirstState extends AbstractAggrState<FirstState> {
    private Comparable value;

    public FirstState(AggrFunction function) {
        super(function);
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (!isEmpty()) {
            return false;
        }
        Comparable v = column.get(row);
        if (v instanceof ByteArray) {
            v = new ByteArray(((ByteArray) v).toBytes());
        }
        value = v;
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        return doUpdate(column, rows[from]) ? 1 : 0;
    }

    @Override
    protected void doMerge(FirstState other) {
        if (isEmpty()) {
            value = other.value;
        }
    }

    @Override
    protected Comparable doFinish() {
        return value;
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        PartialValues.write(out, argType(), value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        Comparable v = PartialValues.read(in, argType());
        if (isEmpty()) {
            value = v;
        }
    }

    private Type argType() {
        return function.getArgType();
    }
}
