package io.github.jaggr.function;

import io.github.jaggr.table.Column;

/**
 * Accumulator of one aggregate function for one group.
 * <p>
 * Lifecycle: {@link Stage#INITIAL} until a row (or a non-empty state) is applied, then
 * {@link Stage#ACCUMULATING}; {@link #finish()} moves it to {@link Stage#FINALIZED} after which
 * the state is read only. A state is used by one thread only.
 */
public interface AggrState {
    enum Stage {
        INITIAL,
        ACCUMULATING,
        FINALIZED
    }

    AggrFunction function();

    Stage stage();

    /**
     * @param column the argument column, null for {@code COUNT(*)}
     */
    void update(Column column, int row);

    /**
     * Same result as calling {@link #update(Column, int)} for rows[from] ... rows[to - 1] in order.
     */
    void updateBatch(Column column, int[] rows, int from, int to);

    /**
     * Adds every row that contributed to other into this state. other is left unchanged.
     *
     * @throws io.github.jaggr.exception.MergeTypeMismatchException if other is another specialization
     */
    void merge(AggrState other);

    /**
     * @return the final value, NULL (null) where the function defines it for the input seen
     */
    Comparable finish();

    /**
     * @return a self describing serialized form that {@link #mergePartial(byte[])} of a state
     * of the same specialization accepts
     */
    byte[] toPartial();

    void mergePartial(byte[] partial);
}
