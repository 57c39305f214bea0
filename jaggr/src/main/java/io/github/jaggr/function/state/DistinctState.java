package io.github.jaggr.function.state;

import com.google.common.collect.Maps;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.codec.GroupKeyCodec;
import io.github.jaggr.codec.KeyEncoder;
import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;

import java.util.Arrays;
import java.util.Map;

import static java.lang.String.format;

/**
 * The DISTINCT form of a function: values are deduplicated by their group key encoding, so
 * 1.5 and 1.50 are one value, and only the first occurrence of each is fed to the state of the
 * plain function. That occurrence is kept as is and travels in the partial state, merging
 * feeds the inner state exactly what a direct aggregation would have.
 */
public class DistinctState extends AbstractAggrState<DistinctState> {
    private final AggrState inner;
    private final Map<ByteArray, Comparable> seenValues = Maps.newHashMap();
    private final KeyEncoder encoder = new KeyEncoder(32);

    /**
     * @param function the DISTINCT function
     * @param inner    fresh state of the same function without DISTINCT
     */
    public DistinctState(AggrFunction function, AggrState inner) {
        super(function);
        this.inner = inner;
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        encoder.reset();
        GroupKeyCodec.encodeValue(encoder, column, function.getArgType(), row);
        ByteArray key = new ByteArray(Arrays.copyOf(encoder.buffer(), encoder.position()));
        if (!seenValues.containsKey(key)) {
            Comparable value = column.get(row);
            if (value instanceof ByteArray) {
                value = new ByteArray(((ByteArray) value).toBytes());
            }
            seenValues.put(key, value);
            inner.update(column, row);
        }
        return true;
    }

    private void addValue(ByteArray key, Comparable value) {
        if (null != seenValues.putIfAbsent(key, value)) {
            return;
        }
        inner.update(Column.of("distinct", function.getArgType(), value), 0);
    }

    @Override
    protected void doMerge(DistinctState other) {
        for (Map.Entry<ByteArray, Comparable> entry : other.seenValues.entrySet()) {
            addValue(entry.getKey(), entry.getValue());
        }
    }

    @Override
    protected Comparable doFinish() {
        return inner.finish();
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        Type argType = function.getArgType();
        out.writeInt(seenValues.size());
        for (Comparable value : seenValues.values()) {
            PartialValues.write(out, argType, value);
        }
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        Type argType = function.getArgType();
        int n = in.readInt();
        if (n < 0) {
            throw new EncodingException(format("%s: negative distinct value count %d", function, n));
        }
        for (int i = 0; i < n; i++) {
            Comparable value = PartialValues.read(in, argType);
            if (null == value) {
                throw new EncodingException(format("%s: NULL in distinct value set", function));
            }
            addValue(new ByteArray(GroupKeyCodec.encodeValue(argType, value)), value);
        }
    }
}
