package io.github.jaggr.executor;

import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.request.AggrRequest;
import io.github.jaggr.request.AggrRequestParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

public class AggrExecutors {
    private static final Logger logger = LoggerFactory.getLogger(AggrExecutors.class);

    private AggrExecutors() {
    }

    public static AggrExecutor create(AggrRequest request) {
        return create(request, new AggrFunctionFactory());
    }

    public static AggrExecutor create(AggrRequest request, AggrFunctionFactory factory) {
        AggrExecutor executor;
        switch (request.getMode()) {
            case HASH:
                executor = new HashAggrExecutor(AggrRequestParser.schema(request),
                        AggrRequestParser.groupBy(request),
                        AggrRequestParser.functions(request),
                        factory);
                break;
            case STREAM:
                executor = new StreamAggrExecutor(AggrRequestParser.schema(request),
                        AggrRequestParser.groupBy(request),
                        AggrRequestParser.functions(request),
                        factory);
                break;
            case SIMPLE:
                checkArgument(request.getGroupBy().isEmpty(), "SIMPLE mode takes no grouping columns");
                executor = new SimpleAggrExecutor(AggrRequestParser.schema(request),
                        AggrRequestParser.functions(request),
                        factory);
                break;
            default:
                throw new IllegalArgumentException(request.getMode().name());
        }
        logger.info("{} aggregation, {} grouping columns, {} functions",
                request.getMode(), request.getGroupBy().size(), request.getFunctions().size());
        return executor;
    }
}
