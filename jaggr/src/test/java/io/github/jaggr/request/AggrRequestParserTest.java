package io.github.jaggr.request;

import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.executor.AggrExecutor;
import io.github.jaggr.executor.AggrExecutors;
import io.github.jaggr.executor.AggrMode;
import io.github.jaggr.executor.GroupByColumn;
import io.github.jaggr.executor.HashAggrExecutor;
import io.github.jaggr.executor.SimpleAggrExecutor;
import io.github.jaggr.executor.StreamAggrExecutor;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.table.SortOrder;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.TableBuilder;
import io.github.jaggr.table.Type;
import org.junit.Test;

import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AggrRequestParserTest {
    private static final String REQUEST = "{\n" +
            "  \"mode\": \"HASH\",\n" +
            "  \"schema\": [{\"name\": \"k\", \"type\": \"VARCHAR\"}, {\"name\": \"v\", \"type\": \"BIGINT\"}],\n" +
            "  \"groupBy\": [{\"column\": \"k\", \"order\": \"DESC\"}],\n" +
            "  \"functions\": [\n" +
            "    {\"kind\": \"SUM\", \"arg\": \"v\", \"argType\": \"BIGINT\", \"returnType\": \"BIGINT\", \"distinct\": false, \"name\": \"sum_v\"},\n" +
            "    {\"kind\": \"COUNT\"},\n" +
            "    {\"kind\": \"COUNT\", \"arg\": \"v\", \"argType\": \"BIGINT\", \"distinct\": true}\n" +
            "  ]\n" +
            "}";

    private final AggrRequestParser parser = new AggrRequestParser();
    private final AggrFunctionFactory factory = new AggrFunctionFactory(AggrConfig.defaults());

    @Test
    public void parse() {
        AggrRequest request = parser.parse(REQUEST);
        assertEquals(AggrMode.HASH, request.getMode());
        assertEquals(Arrays.asList("k", "v"), Arrays.asList(AggrRequestParser.schema(request).keySet().toArray()));
        assertEquals(Type.VARCHAR, AggrRequestParser.schema(request).get("k"));
        assertEquals(Arrays.asList(new GroupByColumn("k", SortOrder.DESC)), AggrRequestParser.groupBy(request));

        List<AggrFunctionDescriptor> functions = AggrRequestParser.functions(request);
        assertEquals(3, functions.size());
        assertEquals("sum_v", functions.get(0).getName());
        assertEquals(Type.BIGINT, functions.get(0).getReturnType());
        assertTrue(functions.get(1).isCountStar());
        assertEquals("count(*)", functions.get(1).getName());
        assertTrue(functions.get(2).isDistinct());
        assertEquals("count(distinct v)", functions.get(2).getName());
        assertNull(functions.get(2).getReturnType());
    }

    @Test
    public void parseReader() {
        assertEquals(3, parser.parse(new StringReader(REQUEST)).getFunctions().size());
    }

    @Test
    public void executorFromRequest() {
        AggrExecutor executor = AggrExecutors.create(parser.parse(REQUEST), factory);
        assertTrue(executor instanceof HashAggrExecutor);

        TableBuilder builder = new TableBuilder(AggrRequestParser.schema(parser.parse(REQUEST)));
        builder.appendRow("a", 1L);
        builder.appendRow("a", 1L);
        builder.appendRow("b", 4L);
        executor.update(builder.build());
        Table output = executor.finish();
        assertEquals(Arrays.asList("k", "sum_v", "count(*)", "count(distinct v)"),
                Arrays.asList(output.getColumnIndex().keySet().toArray()));
        assertEquals(2, output.size());
    }

    @Test
    public void modeDefaultsFromGroupBy() {
        AggrRequest simple = parser.parse("{\"schema\": [{\"name\": \"v\", \"type\": \"INT\"}], \"functions\": [{\"kind\": \"COUNT\"}]}");
        assertEquals(AggrMode.SIMPLE, simple.getMode());
        assertTrue(AggrExecutors.create(simple, factory) instanceof SimpleAggrExecutor);

        AggrRequest grouped = parser.parse("{\"schema\": [{\"name\": \"v\", \"type\": \"INT\"}], \"groupBy\": [{\"column\": \"v\"}], \"functions\": []}");
        assertEquals(AggrMode.HASH, grouped.getMode());
        assertEquals(SortOrder.ASC, AggrRequestParser.groupBy(grouped).get(0).getOrder());
    }

    @Test
    public void streamMode() {
        String json = REQUEST.replace("\"HASH\"", "\"STREAM\"");
        assertTrue(AggrExecutors.create(parser.parse(json), factory) instanceof StreamAggrExecutor);
    }

    @Test
    public void toJsonAndBack() {
        AggrRequest request = new AggrRequest()
                .setMode(AggrMode.STREAM)
                .setSchema(Arrays.asList(new AggrRequest.ColumnSpec("v", Type.DOUBLE)))
                .setGroupBy(Arrays.asList(new AggrRequest.GroupBySpec("v", SortOrder.ASC)))
                .setFunctions(Arrays.asList(new AggrRequest.FunctionSpec(AggrFunctionKind.AVG, "v", Type.DOUBLE, null, false, null)));
        AggrRequest parsed = parser.parse(parser.toJson(request));
        assertEquals(AggrMode.STREAM, parsed.getMode());
        assertEquals(AggrFunctionKind.AVG, parsed.getFunctions().get(0).getKind());
        assertEquals(Type.DOUBLE, parsed.getSchema().get(0).getType());
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedJson() {
        parser.parse("{\"schema\": [");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownFunctionKind() {
        parser.parse("{\"schema\": [{\"name\": \"v\", \"type\": \"INT\"}], \"functions\": [{\"kind\": \"MEDIAN\", \"arg\": \"v\", \"argType\": \"INT\"}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownType() {
        parser.parse("{\"schema\": [{\"name\": \"v\", \"type\": \"TINYINT\"}], \"functions\": []}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void argumentWithoutType() {
        parser.parse("{\"schema\": [{\"name\": \"v\", \"type\": \"INT\"}], \"functions\": [{\"kind\": \"SUM\", \"arg\": \"v\"}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void simpleModeWithGroupBy() {
        parser.parse("{\"mode\": \"SIMPLE\", \"schema\": [{\"name\": \"v\", \"type\": \"INT\"}], \"groupBy\": [{\"column\": \"v\"}], \"functions\": []}");
    }
}
