package io.github.jaggr.executor;

import com.google.common.collect.Maps;
import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups unordered input in a hash table keyed by the encoded group key.
 * <p>
 * Each batch is processed in two passes: the first finds the entry of every active row, the
 * second hands each touched entry its rows as one contiguous range of a reordered row array, so
 * every (group, function) pair gets one {@link AggrState#updateBatch} call per batch. Rows keep
 * their input order within a group.
 */
public class HashAggrExecutor extends AbstractAggrExecutor {
    private static final Logger logger = LoggerFactory.getLogger(HashAggrExecutor.class);

    private final HashMap<ByteArray, GroupEntry> groups;
    private final long warnGroups;
    private boolean warned;

    public HashAggrExecutor(Map<String, Type> schema,
                            List<GroupByColumn> groupBy,
                            List<AggrFunctionDescriptor> descriptors,
                            AggrFunctionFactory factory) {
        super(schema, groupBy, descriptors, factory);
        AggrConfig config = factory.getConfig();
        this.groups = Maps.newHashMapWithExpectedSize(config.getHashInitialCapacity());
        this.warnGroups = config.getHashWarnGroups();
    }

    private GroupEntry lookup(byte[] key) {
        ByteArray k = new ByteArray(key);
        GroupEntry entry = groups.get(k);
        if (null == entry) {
            entry = newEntry(key);
            groups.put(k, entry);
            if (!warned && groups.size() > warnGroups) {
                warned = true;
                logger.warn("hash aggregation holds more than {} groups, group by {}", warnGroups, groupBy);
            }
        }
        return entry;
    }

    @Override
    public void update(Table batch) {
        Column[] args = prepare(batch);
        int[] rows = batch.activeRows();
        if (rows.length == 0) {
            return;
        }

        GroupEntry[] rowEntries = new GroupEntry[rows.length];
        List<GroupEntry> touched = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            GroupEntry entry = lookup(codec.encode(batch, rows[i]));
            if (0 == entry.batchCount) {
                touched.add(entry);
            }
            entry.batchCount++;
            rowEntries[i] = entry;
        }

        int start = 0;
        for (GroupEntry entry : touched) {
            entry.batchStart = start;
            start += entry.batchCount;
            entry.batchCount = 0;
        }
        int[] ordered = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            GroupEntry entry = rowEntries[i];
            ordered[entry.batchStart + entry.batchCount++] = rows[i];
        }

        for (GroupEntry entry : touched) {
            AggrState[] states = entry.getStates();
            int from = entry.batchStart;
            int to = from + entry.batchCount;
            for (int f = 0; f < states.length; f++) {
                states[f].updateBatch(args[f], ordered, from, to);
            }
            entry.batchCount = 0;
        }
        logger.debug("batch of {} rows touched {} groups, {} groups in total", rows.length, touched.size(), groups.size());
    }

    @Override
    public Table finish() {
        end();
        return toFinalTable(groups.values());
    }

    @Override
    public Table partial() {
        end();
        return toPartialTable(groups.values());
    }

    @Override
    public void mergePartial(Table partial) {
        Column[] states = preparePartial(partial);
        for (int row : partial.activeRows()) {
            mergePartialRow(lookup(partialCodec.encode(partial, row)), states, row);
        }
    }

    public int groupCount() {
        return groups.size();
    }
}
