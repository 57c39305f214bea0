package io.github.jaggr.executor;

import io.github.jaggr.codec.GroupKeyCodec;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.ColumnTypeBuilder;
import io.github.jaggr.table.SortOrder;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.TableBuilder;
import io.github.jaggr.table.Type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Setup and batch plumbing shared by the executors: resolves the functions once, checks every
 * batch against the declared schema and builds output tables.
 */
public abstract class AbstractAggrExecutor implements AggrExecutor {
    protected final LinkedHashMap<String, Type> schema;
    protected final List<GroupByColumn> groupBy;
    protected final AggrFunction[] functions;

    protected final String[] groupNames;
    protected final Type[] groupTypes;
    protected final SortOrder[] groupOrders;
    // grouping columns by their position in the input tables
    protected final GroupKeyCodec codec;
    // grouping columns of partial tables come first
    protected final GroupKeyCodec partialCodec;

    private final int[] argIndexes;
    private final LinkedHashMap<String, Type> finalSchema;
    private final LinkedHashMap<String, Type> partialSchema;

    protected long inputBatches;
    protected long inputRows;
    private boolean ended;

    protected AbstractAggrExecutor(Map<String, Type> schema,
                                   List<GroupByColumn> groupBy,
                                   List<AggrFunctionDescriptor> descriptors,
                                   AggrFunctionFactory factory) {
        this.schema = new LinkedHashMap<>(requireNonNull(schema));
        this.groupBy = new ArrayList<>(requireNonNull(groupBy));
        requireNonNull(descriptors);
        requireNonNull(factory);
        List<String> columnNames = new ArrayList<>(this.schema.keySet());

        int groupCount = this.groupBy.size();
        groupNames = new String[groupCount];
        groupTypes = new Type[groupCount];
        groupOrders = new SortOrder[groupCount];
        int[] groupIndexes = new int[groupCount];
        int[] partialIndexes = new int[groupCount];
        ColumnTypeBuilder finalColumns = new ColumnTypeBuilder();
        ColumnTypeBuilder partialColumns = new ColumnTypeBuilder();
        for (int i = 0; i < groupCount; i++) {
            GroupByColumn column = this.groupBy.get(i);
            groupNames[i] = column.getName();
            groupOrders[i] = column.getOrder();
            groupIndexes[i] = columnNames.indexOf(column.getName());
            checkArgument(groupIndexes[i] >= 0, "grouping column '%s' is not in the schema %s", column.getName(), columnNames);
            groupTypes[i] = this.schema.get(column.getName());
            partialIndexes[i] = i;
            finalColumns.column(groupNames[i], groupTypes[i]);
            partialColumns.column(groupNames[i], groupTypes[i]);
        }
        codec = new GroupKeyCodec(groupIndexes, groupTypes);
        partialCodec = new GroupKeyCodec(partialIndexes, groupTypes);

        functions = new AggrFunction[descriptors.size()];
        argIndexes = new int[descriptors.size()];
        for (int i = 0; i < functions.length; i++) {
            AggrFunctionDescriptor descriptor = descriptors.get(i);
            if (null == descriptor.getArg()) {
                argIndexes[i] = -1;
            } else {
                argIndexes[i] = columnNames.indexOf(descriptor.getArg());
                checkArgument(argIndexes[i] >= 0, "argument column '%s' of %s is not in the schema %s",
                        descriptor.getArg(), descriptor.getName(), columnNames);
                Type declared = this.schema.get(descriptor.getArg());
                checkArgument(declared == descriptor.getArgType(), "%s declares %s but column '%s' is %s",
                        descriptor.getName(), descriptor.getArgType(), descriptor.getArg(), declared);
            }
            functions[i] = factory.create(descriptor);
            finalColumns.column(functions[i].getName(), functions[i].getReturnType());
            partialColumns.column(functions[i].getName(), Type.VARBYTE);
        }
        finalSchema = finalColumns.build();
        partialSchema = partialColumns.build();
    }

    protected AggrState[] newStates() {
        AggrState[] states = new AggrState[functions.length];
        for (int i = 0; i < functions.length; i++) {
            states[i] = functions[i].newState();
        }
        return states;
    }

    protected GroupEntry newEntry(byte[] key) {
        return new GroupEntry(key, newStates());
    }

    protected void checkNotEnded() {
        checkState(!ended, "%s already produced its output", getClass().getSimpleName());
    }

    protected void end() {
        checkNotEnded();
        ended = true;
    }

    /**
     * Checks batch against the schema and returns the argument column of every function, null
     * for {@code COUNT(*)}. Columns holding only NULLs get their declared storage type.
     */
    protected Column[] prepare(Table batch) {
        checkNotEnded();
        requireNonNull(batch);
        List<Column> columns = batch.getColumns();
        checkArgument(columns.size() == schema.size(), "batch has %s columns but the schema has %s",
                columns.size(), schema.size());
        int i = 0;
        for (Map.Entry<String, Type> entry : schema.entrySet()) {
            Column column = columns.get(i++);
            checkArgument(entry.getKey().equals(column.name()), "batch column %s is '%s' but the schema has '%s'",
                    i - 1, column.name(), entry.getKey());
            column.ensureType(entry.getValue());
        }
        inputBatches++;
        inputRows += batch.activeCount();

        Column[] args = new Column[functions.length];
        for (int f = 0; f < functions.length; f++) {
            args[f] = argIndexes[f] < 0 ? null : columns.get(argIndexes[f]);
        }
        return args;
    }

    /**
     * Checks a table produced by {@link #partial()} and returns its partial state columns.
     */
    protected Column[] preparePartial(Table partial) {
        checkNotEnded();
        requireNonNull(partial);
        List<Column> columns = partial.getColumns();
        checkArgument(columns.size() == partialSchema.size(), "partial table has %s columns but %s are expected",
                columns.size(), partialSchema.size());
        int i = 0;
        for (Map.Entry<String, Type> entry : partialSchema.entrySet()) {
            Column column = columns.get(i++);
            checkArgument(entry.getKey().equals(column.name()), "partial column %s is '%s' but '%s' is expected",
                    i - 1, column.name(), entry.getKey());
            column.ensureType(entry.getValue());
        }
        Column[] states = new Column[functions.length];
        for (int f = 0; f < functions.length; f++) {
            states[f] = columns.get(groupNames.length + f);
        }
        return states;
    }

    protected static void mergePartialRow(GroupEntry entry, Column[] partialColumns, int row) {
        AggrState[] states = entry.getStates();
        for (int f = 0; f < states.length; f++) {
            Column column = partialColumns[f];
            if (column.isNull(row)) {
                throw new IllegalArgumentException(format("NULL partial state in column '%s' row %d", column.name(), row));
            }
            states[f].mergePartial(column.getByteArray(row).toBytes());
        }
    }

    protected Table toFinalTable(Collection<GroupEntry> entries) {
        TableBuilder builder = new TableBuilder(finalSchema, entries.size());
        for (GroupEntry entry : entries) {
            Comparable[] row = new Comparable[finalSchema.size()];
            Comparable[] keys = codec.decode(entry.getKey());
            System.arraycopy(keys, 0, row, 0, keys.length);
            AggrState[] states = entry.getStates();
            for (int f = 0; f < states.length; f++) {
                row[keys.length + f] = states[f].finish();
            }
            builder.appendRow(row);
        }
        return builder.build();
    }

    protected Table toPartialTable(Collection<GroupEntry> entries) {
        TableBuilder builder = new TableBuilder(partialSchema, entries.size());
        for (GroupEntry entry : entries) {
            Comparable[] row = new Comparable[partialSchema.size()];
            Comparable[] keys = codec.decode(entry.getKey());
            System.arraycopy(keys, 0, row, 0, keys.length);
            AggrState[] states = entry.getStates();
            for (int f = 0; f < states.length; f++) {
                row[keys.length + f] = new ByteArray(states[f].toPartial());
            }
            builder.appendRow(row);
        }
        return builder.build();
    }

    public AggrFunction[] getFunctions() {
        return functions;
    }

    public List<GroupByColumn> getGroupBy() {
        return groupBy;
    }

    public long getInputBatches() {
        return inputBatches;
    }

    public long getInputRows() {
        return inputRows;
    }
}
