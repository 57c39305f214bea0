package io.github.jaggr.executor;

import io.github.jaggr.codec.KeyComparator;
import io.github.jaggr.exception.OutOfOrderException;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Aggregates input sorted by the grouping columns with a single live group. A key change closes
 * the live group, closed groups wait in arrival order until {@link #takeOutput()} or the end of
 * input. Runs of equal keys within a batch are applied with one
 * {@link AggrState#updateBatch} call per function.
 */
public class StreamAggrExecutor extends AbstractAggrExecutor {
    private static final Logger logger = LoggerFactory.getLogger(StreamAggrExecutor.class);

    private final KeyComparator comparator;
    private final boolean checkOrder;
    private final List<GroupEntry> closed = new ArrayList<>();
    private GroupEntry current;
    private long groupCount;

    public StreamAggrExecutor(Map<String, Type> schema,
                              List<GroupByColumn> groupBy,
                              List<AggrFunctionDescriptor> descriptors,
                              AggrFunctionFactory factory) {
        super(schema, groupBy, descriptors, factory);
        this.comparator = new KeyComparator(groupOrders);
        this.checkOrder = factory.getConfig().isStreamCheckOrder();
    }

    /**
     * @return true if key opens a new group
     */
    private boolean advance(byte[] key) {
        if (null != current && Arrays.equals(current.getKey(), key)) {
            return false;
        }
        if (null != current) {
            if (checkOrder && comparator.compare(key, current.getKey()) < 0) {
                throw new OutOfOrderException(format("group %s arrived after group %s, group by %s",
                        Arrays.toString(codec.decode(key)), Arrays.toString(codec.decode(current.getKey())), groupBy));
            }
            closed.add(current);
        }
        current = newEntry(key);
        groupCount++;
        return true;
    }

    @Override
    public void update(Table batch) {
        Column[] args = prepare(batch);
        int[] rows = batch.activeRows();
        int runStart = 0;
        GroupEntry runEntry = current;
        for (int i = 0; i < rows.length; i++) {
            byte[] key = codec.encode(batch, rows[i]);
            if (advance(key)) {
                apply(runEntry, args, rows, runStart, i);
                runStart = i;
                runEntry = current;
            }
        }
        apply(runEntry, args, rows, runStart, rows.length);
        logger.debug("batch of {} rows, {} closed groups waiting", rows.length, closed.size());
    }

    private static void apply(GroupEntry entry, Column[] args, int[] rows, int from, int to) {
        if (null == entry || from >= to) {
            return;
        }
        AggrState[] states = entry.getStates();
        for (int f = 0; f < states.length; f++) {
            states[f].updateBatch(args[f], rows, from, to);
        }
    }

    /**
     * @return final results of the groups closed so far, which are then released
     */
    public Table takeOutput() {
        checkNotEnded();
        Table output = toFinalTable(closed);
        closed.clear();
        return output;
    }

    private List<GroupEntry> drain() {
        if (null != current) {
            closed.add(current);
            current = null;
        }
        return closed;
    }

    @Override
    public Table finish() {
        end();
        return toFinalTable(drain());
    }

    @Override
    public Table partial() {
        end();
        return toPartialTable(drain());
    }

    @Override
    public void mergePartial(Table partial) {
        Column[] states = preparePartial(partial);
        for (int row : partial.activeRows()) {
            advance(partialCodec.encode(partial, row));
            mergePartialRow(current, states, row);
        }
    }

    /**
     * @return groups opened so far, the live one included
     */
    public long groupCount() {
        return groupCount;
    }
}
