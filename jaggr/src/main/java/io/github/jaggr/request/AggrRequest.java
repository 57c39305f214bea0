package io.github.jaggr.request;

import io.github.jaggr.executor.AggrMode;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.SortOrder;
import io.github.jaggr.table.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of an aggregation request, mapped field by field by Gson:
 * <pre>
 * {
 *   "mode": "HASH",
 *   "schema": [{"name": "k", "type": "VARCHAR"}, {"name": "v", "type": "BIGINT"}],
 *   "groupBy": [{"column": "k", "order": "ASC"}],
 *   "functions": [{"kind": "SUM", "arg": "v", "argType": "BIGINT", "name": "sum_v"}]
 * }
 * </pre>
 */
public class AggrRequest {
    private AggrMode mode;
    private List<ColumnSpec> schema = new ArrayList<>();
    private List<GroupBySpec> groupBy = new ArrayList<>();
    private List<FunctionSpec> functions = new ArrayList<>();

    public AggrMode getMode() {
        return mode;
    }

    public AggrRequest setMode(AggrMode mode) {
        this.mode = mode;
        return this;
    }

    public List<ColumnSpec> getSchema() {
        return schema;
    }

    public AggrRequest setSchema(List<ColumnSpec> schema) {
        this.schema = schema;
        return this;
    }

    public List<GroupBySpec> getGroupBy() {
        return groupBy;
    }

    public AggrRequest setGroupBy(List<GroupBySpec> groupBy) {
        this.groupBy = groupBy;
        return this;
    }

    public List<FunctionSpec> getFunctions() {
        return functions;
    }

    public AggrRequest setFunctions(List<FunctionSpec> functions) {
        this.functions = functions;
        return this;
    }

    public static class ColumnSpec {
        private String name;
        private Type type;

        public ColumnSpec() {
        }

        public ColumnSpec(String name, Type type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public Type getType() {
            return type;
        }
    }

    public static class GroupBySpec {
        private String column;
        // ASC when absent
        private SortOrder order;

        public GroupBySpec() {
        }

        public GroupBySpec(String column, SortOrder order) {
            this.column = column;
            this.order = order;
        }

        public String getColumn() {
            return column;
        }

        public SortOrder getOrder() {
            return order;
        }
    }

    public static class FunctionSpec {
        private AggrFunctionKind kind;
        // absent for COUNT(*)
        private String arg;
        private Type argType;
        private Type returnType;
        private boolean distinct;
        private String name;

        public FunctionSpec() {
        }

        public FunctionSpec(AggrFunctionKind kind, String arg, Type argType, Type returnType, boolean distinct, String name) {
            this.kind = kind;
            this.arg = arg;
            this.argType = argType;
            this.returnType = returnType;
            this.distinct = distinct;
            this.name = name;
        }

        public AggrFunctionKind getKind() {
            return kind;
        }

        public String getArg() {
            return arg;
        }

        public Type getArgType() {
            return argType;
        }

        public Type getReturnType() {
            return returnType;
        }

        public boolean isDistinct() {
            return distinct;
        }

        public String getName() {
            return name;
        }
    }
}
