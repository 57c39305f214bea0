package io.github.jaggr.executor;

import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.Type;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Aggregation without grouping columns. The single group exists from the start, so the output
 * has exactly one row even for empty input.
 */
public class SimpleAggrExecutor extends AbstractAggrExecutor {
    private static final byte[] EMPTY_KEY = new byte[0];

    private final GroupEntry entry;

    public SimpleAggrExecutor(Map<String, Type> schema,
                              List<AggrFunctionDescriptor> descriptors,
                              AggrFunctionFactory factory) {
        super(schema, Collections.<GroupByColumn>emptyList(), descriptors, factory);
        this.entry = newEntry(EMPTY_KEY);
    }

    @Override
    public void update(Table batch) {
        Column[] args = prepare(batch);
        int[] rows = batch.activeRows();
        if (rows.length == 0) {
            return;
        }
        AggrState[] states = entry.getStates();
        for (int f = 0; f < states.length; f++) {
            states[f].updateBatch(args[f], rows, 0, rows.length);
        }
    }

    @Override
    public Table finish() {
        end();
        return toFinalTable(Collections.singletonList(entry));
    }

    @Override
    public Table partial() {
        end();
        return toPartialTable(Collections.singletonList(entry));
    }

    @Override
    public void mergePartial(Table partial) {
        Column[] states = preparePartial(partial);
        for (int row : partial.activeRows()) {
            mergePartialRow(entry, states, row);
        }
    }
}
