package io.github.jaggr.executor;

import io.github.jaggr.table.Table;

/**
 * Aggregates column batches. Output tables hold the grouping columns first, in group by order,
 * followed by one column per function, in request order.
 * <p>
 * {@link #finish()} and {@link #partial()} end the executor, it accepts no input afterwards.
 * An executor is used by one thread only.
 */
public interface AggrExecutor {
    /**
     * Aggregates the active rows of batch.
     */
    void update(Table batch);

    /**
     * @return final results, one row per group
     */
    Table finish();

    /**
     * @return grouping columns followed by one VARBYTE column of serialized partial state per
     * function, accepted by {@link #mergePartial(Table)} of an executor built from the same request
     */
    Table partial();

    /**
     * Merges a table produced by {@link #partial()}.
     */
    void mergePartial(Table partial);
}
