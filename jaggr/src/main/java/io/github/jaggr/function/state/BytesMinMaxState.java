package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.VarbyteColumn;

import java.util.Arrays;

/**
 * MIN / MAX over VARBYTE and VARCHAR, compared as unsigned bytes (binary collation). The current
 * extremum is copied out of the batch so the batch buffer is not retained.
 */
public class BytesMinMaxState extends AbstractAggrState<BytesMinMaxState> {
    private final int sign;
    private byte[] value;

    public BytesMinMaxState(AggrFunction function) {
        super(function);
        this.sign = function.getSignature().getKind() == AggrFunctionKind.MAX ? 1 : -1;
    }

    private static int compare(byte[] left, int lOffset, int lLength, byte[] right) {
        int len = Math.min(lLength, right.length);
        for (int i = 0; i < len; i++) {
            int v = (left[lOffset + i] & 0xFF) - (right[i] & 0xFF);
            if (v != 0) {
                return v;
            }
        }
        return Integer.compare(lLength, right.length);
    }

    private void accept(byte[] bytes, int offset, int length) {
        if (null == value || compare(bytes, offset, length, value) * sign > 0) {
            value = Arrays.copyOfRange(bytes, offset, offset + length);
        }
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        VarbyteColumn values = (VarbyteColumn) column.values();
        if (values.isNull(row)) {
            return false;
        }
        accept(values.rawValues(), values.offset(row), values.length(row));
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        VarbyteColumn values = (VarbyteColumn) column.values();
        byte[] raw = values.rawValues();
        int applied = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (values.isNull(row)) {
                continue;
            }
            accept(raw, values.offset(row), values.length(row));
            applied++;
        }
        return applied;
    }

    @Override
    protected void doMerge(BytesMinMaxState other) {
        accept(other.value, 0, other.value.length);
    }

    @Override
    protected Comparable doFinish() {
        return null == value ? null : new ByteArray(value);
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeInt(value.length);
        out.write(value);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        byte[] bytes = new byte[in.readInt()];
        in.readFully(bytes);
        accept(bytes, 0, bytes.length);
    }
}
