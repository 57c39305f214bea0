package io.github.jaggr.request;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.github.jaggr.executor.AggrMode;
import io.github.jaggr.executor.GroupByColumn;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.table.ColumnTypeBuilder;
import io.github.jaggr.table.Type;

import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;

/**
 * Reads {@link AggrRequest}s from JSON and converts their parts to engine types. Enum values are
 * written by name, unknown names are rejected.
 */
public class AggrRequestParser {
    private final Gson gson = new GsonBuilder().create();

    public AggrRequest parse(String json) {
        AggrRequest request;
        try {
            request = gson.fromJson(json, AggrRequest.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException(format("malformed aggregation request: %s", e.getMessage()), e);
        }
        return validate(request);
    }

    public AggrRequest parse(Reader reader) {
        AggrRequest request;
        try {
            request = gson.fromJson(reader, AggrRequest.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException(format("malformed aggregation request: %s", e.getMessage()), e);
        }
        return validate(request);
    }

    public String toJson(AggrRequest request) {
        return gson.toJson(request);
    }

    private static AggrRequest validate(AggrRequest request) {
        checkArgument(null != request, "empty aggregation request");
        checkArgument(null != request.getSchema() && !request.getSchema().isEmpty(), "request has no schema");
        checkArgument(null != request.getFunctions(), "request has no functions");
        if (null == request.getMode()) {
            request.setMode(null == request.getGroupBy() || request.getGroupBy().isEmpty() ? AggrMode.SIMPLE : AggrMode.HASH);
        }
        if (null == request.getGroupBy()) {
            request.setGroupBy(new ArrayList<>());
        }
        checkArgument(request.getMode() != AggrMode.SIMPLE || request.getGroupBy().isEmpty(),
                "SIMPLE mode takes no grouping columns");
        for (AggrRequest.ColumnSpec column : request.getSchema()) {
            checkArgument(null != column && null != column.getName(), "schema column without name");
            checkArgument(null != column.getType(), "schema column '%s' has no or an unknown type", column.getName());
        }
        for (AggrRequest.GroupBySpec groupBy : request.getGroupBy()) {
            checkArgument(null != groupBy && null != groupBy.getColumn(), "grouping entry without column");
        }
        for (AggrRequest.FunctionSpec function : request.getFunctions()) {
            checkArgument(null != function && null != function.getKind(), "function without or with an unknown kind");
            checkArgument(null == function.getArg() || null != function.getArgType(),
                    "function %s(%s) has no argType", function.getKind(), function.getArg());
        }
        return request;
    }

    public static LinkedHashMap<String, Type> schema(AggrRequest request) {
        ColumnTypeBuilder builder = new ColumnTypeBuilder();
        for (AggrRequest.ColumnSpec column : request.getSchema()) {
            builder.column(column.getName(), column.getType());
        }
        return builder.build();
    }

    public static List<GroupByColumn> groupBy(AggrRequest request) {
        List<GroupByColumn> groupBy = new ArrayList<>(request.getGroupBy().size());
        for (AggrRequest.GroupBySpec spec : request.getGroupBy()) {
            groupBy.add(new GroupByColumn(spec.getColumn(), spec.getOrder()));
        }
        return groupBy;
    }

    public static List<AggrFunctionDescriptor> functions(AggrRequest request) {
        List<AggrFunctionDescriptor> functions = new ArrayList<>(request.getFunctions().size());
        for (AggrRequest.FunctionSpec spec : request.getFunctions()) {
            functions.add(new AggrFunctionDescriptor(spec.getKind(),
                    spec.getArg(),
                    null == spec.getArg() ? null : spec.getArgType(),
                    spec.getReturnType(),
                    spec.isDistinct(),
                    spec.getName()));
        }
        return functions;
    }
}
