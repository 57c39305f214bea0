package io.github.jaggr.function;

import io.github.jaggr.ArrayUtil;
import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.exception.MergeTypeMismatchException;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class AggrStateTest {
    private final AggrFunctionFactory factory = new AggrFunctionFactory(AggrConfig.defaults());

    private AggrState newState(AggrFunctionKind kind, Type argType) {
        return factory.create(AggrFunctionDescriptor.of(kind, "v", argType)).newState();
    }

    @Test
    public void lifecycle() {
        AggrState state = newState(AggrFunctionKind.SUM, Type.BIGINT);
        assertEquals(AggrState.Stage.INITIAL, state.stage());

        Column column = Column.of("v", Type.BIGINT, null, 3L);
        state.update(column, 0);
        // a NULL argument is ignored
        assertEquals(AggrState.Stage.INITIAL, state.stage());
        state.update(column, 1);
        assertEquals(AggrState.Stage.ACCUMULATING, state.stage());

        assertEquals(3L, state.finish());
        assertEquals(AggrState.Stage.FINALIZED, state.stage());
        assertEquals(3L, state.finish());
    }

    @Test(expected = IllegalStateException.class)
    public void noUpdateAfterFinish() {
        AggrState state = newState(AggrFunctionKind.SUM, Type.BIGINT);
        state.finish();
        state.update(Column.of("v", Type.BIGINT, 1L), 0);
    }

    @Test(expected = IllegalStateException.class)
    public void noMergeAfterFinish() {
        AggrState state = newState(AggrFunctionKind.SUM, Type.BIGINT);
        AggrState other = newState(AggrFunctionKind.SUM, Type.BIGINT);
        state.finish();
        state.merge(other);
    }

    @Test
    public void emptyGroupValues() {
        assertEquals(0L, factory.create(AggrFunctionDescriptor.countStar()).newState().finish());
        assertEquals(0L, newState(AggrFunctionKind.COUNT, Type.INT).finish());
        assertNull(newState(AggrFunctionKind.SUM, Type.INT).finish());
        assertNull(newState(AggrFunctionKind.AVG, Type.DOUBLE).finish());
        assertNull(newState(AggrFunctionKind.MIN, Type.VARCHAR).finish());
        assertNull(newState(AggrFunctionKind.MAX, Type.BIGDECIMAL).finish());
        assertNull(newState(AggrFunctionKind.FIRST, Type.INT).finish());
        assertNull(newState(AggrFunctionKind.VAR_POP, Type.INT).finish());
        assertEquals(-1L, newState(AggrFunctionKind.BIT_AND, Type.INT).finish());
        assertEquals(0L, newState(AggrFunctionKind.BIT_OR, Type.BIGINT).finish());
        assertEquals(0L, newState(AggrFunctionKind.BIT_XOR, Type.BIGINT).finish());
        assertEquals(0L, newState(AggrFunctionKind.APPROX_COUNT_DISTINCT, Type.VARBYTE).finish());
    }

    @Test
    public void updateBatchMatchesUpdate() {
        Column column = Column.of("v", Type.INT, 5, null, -2, 9, null, 4);
        int[] rows = {5, 0, 2, 3};
        for (AggrFunctionKind kind : AggrFunctionKind.values()) {
            AggrState one = newState(kind, Type.INT);
            AggrState batch = newState(kind, Type.INT);
            for (int row : rows) {
                one.update(column, row);
            }
            batch.updateBatch(column, rows, 0, rows.length);
            assertEquals(kind.name(), one.finish(), batch.finish());
        }
    }

    @Test
    public void updateBatchRange() {
        AggrState state = factory.create(AggrFunctionDescriptor.countStar()).newState();
        state.updateBatch(null, ArrayUtil.sequence(10), 2, 7);
        state.updateBatch(null, ArrayUtil.sequence(10), 3, 3);
        assertEquals(5L, state.finish());
    }

    @Test
    public void mergeKeepsOtherUnchanged() {
        Column column = Column.of("v", Type.DOUBLE, 1.5d, 2.5d);
        AggrState a = newState(AggrFunctionKind.AVG, Type.DOUBLE);
        AggrState b = newState(AggrFunctionKind.AVG, Type.DOUBLE);
        AggrState empty = newState(AggrFunctionKind.AVG, Type.DOUBLE);
        a.update(column, 0);
        b.update(column, 1);
        a.merge(b);
        a.merge(empty);
        assertEquals(AggrState.Stage.INITIAL, empty.stage());
        assertEquals(2.0d, a.finish());
        assertEquals(2.5d, b.finish());
    }

    @Test
    public void mergeOfEmptyState() {
        AggrState target = newState(AggrFunctionKind.SUM, Type.BIGINT);
        target.merge(newState(AggrFunctionKind.SUM, Type.BIGINT));
        assertEquals(AggrState.Stage.INITIAL, target.stage());
        AggrState finishedEmpty = newState(AggrFunctionKind.SUM, Type.BIGINT);
        assertNull(finishedEmpty.finish());
        target.merge(finishedEmpty);
        assertEquals(AggrState.Stage.INITIAL, target.stage());

        AggrState seen = newState(AggrFunctionKind.SUM, Type.BIGINT);
        seen.update(Column.of("v", Type.BIGINT, 4L), 0);
        target.merge(seen);
        assertEquals(AggrState.Stage.ACCUMULATING, target.stage());
        assertEquals(4L, target.finish());
    }

    @Test(expected = MergeTypeMismatchException.class)
    public void mergeOtherSpecialization() {
        newState(AggrFunctionKind.SUM, Type.INT).merge(newState(AggrFunctionKind.SUM, Type.BIGINT));
    }

    @Test(expected = MergeTypeMismatchException.class)
    public void mergeMinIntoMax() {
        newState(AggrFunctionKind.MAX, Type.INT).merge(newState(AggrFunctionKind.MIN, Type.INT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void mergeIntoItself() {
        AggrState state = newState(AggrFunctionKind.SUM, Type.INT);
        state.merge(state);
    }

    @Test
    public void partialOfEveryFunction() {
        Column column = Column.of("v", Type.BIGINT, 7L, null, -3L, 7L, 12L);
        for (AggrFunctionKind kind : AggrFunctionKind.values()) {
            AggrState direct = newState(kind, Type.BIGINT);
            AggrState left = newState(kind, Type.BIGINT);
            AggrState right = newState(kind, Type.BIGINT);
            for (int row = 0; row < column.size(); row++) {
                direct.update(column, row);
                (row < 2 ? left : right).update(column, row);
            }
            AggrState merged = newState(kind, Type.BIGINT);
            merged.mergePartial(right.toPartial());
            merged.mergePartial(left.toPartial());
            if (kind == AggrFunctionKind.FIRST) {
                // merge order decides which first value survives
                assertEquals(-3L, merged.finish());
                continue;
            }
            if (kind.isVariance()) {
                assertEquals(kind.name(), (Double) direct.finish(), (Double) merged.finish(), 1e-9);
                continue;
            }
            assertEquals(kind.name(), direct.finish(), merged.finish());
        }
    }

    @Test
    public void partialOfEmptyState() {
        AggrState empty = newState(AggrFunctionKind.MIN, Type.VARCHAR);
        AggrState target = newState(AggrFunctionKind.MIN, Type.VARCHAR);
        target.mergePartial(empty.toPartial());
        assertEquals(AggrState.Stage.INITIAL, target.stage());
        assertNull(target.finish());
    }

    @Test(expected = MergeTypeMismatchException.class)
    public void partialOfOtherSpecialization() {
        AggrState sum = newState(AggrFunctionKind.SUM, Type.BIGINT);
        sum.update(Column.of("v", Type.BIGINT, 1L), 0);
        newState(AggrFunctionKind.AVG, Type.BIGINT).mergePartial(sum.toPartial());
    }

    @Test(expected = MergeTypeMismatchException.class)
    public void partialOfDistinctIntoPlain() {
        AggrState distinct = factory.create(AggrFunctionDescriptor.distinct(AggrFunctionKind.SUM, "v", Type.BIGINT)).newState();
        newState(AggrFunctionKind.SUM, Type.BIGINT).mergePartial(distinct.toPartial());
    }

    @Test(expected = EncodingException.class)
    public void truncatedPartial() {
        AggrState sum = newState(AggrFunctionKind.SUM, Type.BIGINT);
        sum.update(Column.of("v", Type.BIGINT, 1L), 0);
        byte[] partial = sum.toPartial();
        newState(AggrFunctionKind.SUM, Type.BIGINT).mergePartial(Arrays.copyOf(partial, partial.length - 1));
    }

    @Test(expected = EncodingException.class)
    public void trailingBytesInPartial() {
        byte[] partial = newState(AggrFunctionKind.SUM, Type.BIGINT).toPartial();
        newState(AggrFunctionKind.SUM, Type.BIGINT).mergePartial(Arrays.copyOf(partial, partial.length + 1));
    }

    @Test
    public void functionOfState() {
        AggrFunction function = factory.create(AggrFunctionDescriptor.of(AggrFunctionKind.MAX, "v", Type.INT));
        assertSame(function, function.newState().function());
    }
}
