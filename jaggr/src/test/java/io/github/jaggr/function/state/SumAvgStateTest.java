package io.github.jaggr.function.state;

import io.github.jaggr.ArrayUtil;
import io.github.jaggr.config.AggrConfig;
import io.github.jaggr.exception.OverflowException;
import io.github.jaggr.function.AggrFunctionDescriptor;
import io.github.jaggr.function.AggrFunctionFactory;
import io.github.jaggr.function.AggrFunctionKind;
import io.github.jaggr.function.AggrState;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class SumAvgStateTest {
    private final AggrFunctionFactory factory = new AggrFunctionFactory(AggrConfig.defaults());

    private static Comparable aggregate(AggrState state, Column column) {
        state.updateBatch(column, ArrayUtil.sequence(column.size()), 0, column.size());
        return state.finish();
    }

    private AggrState newState(AggrFunctionKind kind, Type argType, Type returnType) {
        return factory.create(AggrFunctionDescriptor.of(kind, "v", argType, returnType)).newState();
    }

    @Test
    public void sumSkipsNulls() {
        assertEquals(8L, aggregate(newState(AggrFunctionKind.SUM, Type.INT, null), Column.of("v", Type.INT, 3, null, 5)));
        assertEquals(4.0d, aggregate(newState(AggrFunctionKind.SUM, Type.DOUBLE, null), Column.of("v", Type.DOUBLE, 1.5d, null, 2.5d)));
        assertEquals(new BigDecimal("4.05"), aggregate(newState(AggrFunctionKind.SUM, Type.BIGDECIMAL, null),
                Column.of("v", Type.BIGDECIMAL, new BigDecimal("1.5"), null, new BigDecimal("2.55"))));
    }

    @Test(expected = OverflowException.class)
    public void bigintSumOverflow() {
        aggregate(newState(AggrFunctionKind.SUM, Type.BIGINT, null), Column.of("v", Type.BIGINT, Long.MAX_VALUE, 1L));
    }

    @Test(expected = OverflowException.class)
    public void bigintSumUnderflowOneRowAtATime() {
        AggrState state = newState(AggrFunctionKind.SUM, Type.BIGINT, null);
        Column column = Column.of("v", Type.BIGINT, Long.MIN_VALUE, -1L);
        state.update(column, 0);
        state.update(column, 1);
    }

    @Test(expected = OverflowException.class)
    public void bigintSumOverflowOnMerge() {
        AggrState a = newState(AggrFunctionKind.SUM, Type.BIGINT, null);
        AggrState b = newState(AggrFunctionKind.SUM, Type.BIGINT, null);
        Column column = Column.of("v", Type.BIGINT, Long.MAX_VALUE);
        a.update(column, 0);
        b.update(column, 0);
        a.merge(b);
    }

    @Test
    public void intSumWidensToBigint() {
        assertEquals(2L * Integer.MAX_VALUE, aggregate(newState(AggrFunctionKind.SUM, Type.INT, null),
                Column.of("v", Type.INT, Integer.MAX_VALUE, Integer.MAX_VALUE)));
    }

    @Test
    public void bigintSumToDecimalDoesNotOverflow() {
        Comparable sum = aggregate(newState(AggrFunctionKind.SUM, Type.BIGINT, Type.BIGDECIMAL),
                Column.of("v", Type.BIGINT, Long.MAX_VALUE, Long.MAX_VALUE, 2L, Long.MIN_VALUE));
        assertEquals(BigDecimal.valueOf(Long.MAX_VALUE).add(BigDecimal.ONE), sum);
    }

    @Test(expected = OverflowException.class)
    public void doubleSumOverflow() {
        aggregate(newState(AggrFunctionKind.SUM, Type.DOUBLE, null), Column.of("v", Type.DOUBLE, Double.MAX_VALUE, Double.MAX_VALUE));
    }

    @Test(expected = OverflowException.class)
    public void decimalSumPastMaxPrecision() {
        Properties properties = new Properties();
        properties.setProperty(AggrConfig.DECIMAL_MAX_PRECISION, "3");
        AggrState state = new AggrFunctionFactory(AggrConfig.fromProperties(properties))
                .create(AggrFunctionDescriptor.of(AggrFunctionKind.SUM, "v", Type.BIGDECIMAL))
                .newState();
        // fraction digits do not count
        Column column = Column.of("v", Type.BIGDECIMAL, new BigDecimal("999.12345"), new BigDecimal("0.9"));
        state.update(column, 0);
        state.update(column, 1);
    }

    private static AggrState withMaxPrecision(int maxPrecision, AggrFunctionKind kind, Type argType) {
        Properties properties = new Properties();
        properties.setProperty(AggrConfig.DECIMAL_MAX_PRECISION, String.valueOf(maxPrecision));
        return new AggrFunctionFactory(AggrConfig.fromProperties(properties))
                .create(AggrFunctionDescriptor.of(kind, "v", argType))
                .newState();
    }

    private static Column overshootingDecimals() {
        // the running sum reaches 1000 before it comes back to 999
        return Column.of("v", Type.BIGDECIMAL, new BigDecimal("999"), BigDecimal.ONE, BigDecimal.ONE.negate());
    }

    @Test(expected = OverflowException.class)
    public void decimalSumBatchChecksEveryRow() {
        aggregate(withMaxPrecision(3, AggrFunctionKind.SUM, Type.BIGDECIMAL), overshootingDecimals());
    }

    @Test(expected = OverflowException.class)
    public void decimalAvgBatchChecksEveryRow() {
        aggregate(withMaxPrecision(3, AggrFunctionKind.AVG, Type.BIGDECIMAL), overshootingDecimals());
    }

    @Test(expected = OverflowException.class)
    public void decimalAvgOneRowAtATime() {
        AggrState state = withMaxPrecision(3, AggrFunctionKind.AVG, Type.BIGDECIMAL);
        Column column = overshootingDecimals();
        for (int row = 0; row < column.size(); row++) {
            state.update(column, row);
        }
    }

    @Test
    public void avgOfBigintsOneRowAtATimeMatchesBatch() {
        Column column = Column.of("v", Type.BIGINT, Long.MAX_VALUE, Long.MAX_VALUE, null, Long.MIN_VALUE, 7L);
        AggrState single = newState(AggrFunctionKind.AVG, Type.BIGINT, null);
        for (int row = 0; row < column.size(); row++) {
            single.update(column, row);
        }
        assertEquals(aggregate(newState(AggrFunctionKind.AVG, Type.BIGINT, null), column), single.finish());

        AggrState merged = newState(AggrFunctionKind.AVG, Type.BIGINT, null);
        AggrState head = newState(AggrFunctionKind.AVG, Type.BIGINT, null);
        head.updateBatch(column, ArrayUtil.sequence(column.size()), 0, 2);
        AggrState tail = newState(AggrFunctionKind.AVG, Type.BIGINT, null);
        tail.updateBatch(column, ArrayUtil.sequence(column.size()), 2, column.size());
        merged.mergePartial(head.toPartial());
        merged.merge(tail);
        assertEquals(single.finish(), merged.finish());
    }

    @Test
    public void avg() {
        assertEquals(new BigDecimal("2.5000"), aggregate(newState(AggrFunctionKind.AVG, Type.INT, null),
                Column.of("v", Type.INT, 1, null, 4)));
        assertEquals(new BigDecimal("0.6667"), aggregate(newState(AggrFunctionKind.AVG, Type.BIGINT, null),
                Column.of("v", Type.BIGINT, 0L, 1L, 1L)));
        assertEquals(new BigDecimal("1.833333"), aggregate(newState(AggrFunctionKind.AVG, Type.BIGDECIMAL, null),
                Column.of("v", Type.BIGDECIMAL, new BigDecimal("1.5"), new BigDecimal("2.50"), new BigDecimal("1.5"))));
        assertEquals(2.0d, aggregate(newState(AggrFunctionKind.AVG, Type.DOUBLE, null),
                Column.of("v", Type.DOUBLE, 1.0d, 3.0d, null)));
    }

    @Test
    public void avgOfBigintsPastTheLongRange() {
        assertEquals(new BigDecimal(Long.MAX_VALUE + ".0000"), aggregate(newState(AggrFunctionKind.AVG, Type.BIGINT, null),
                Column.of("v", Type.BIGINT, Long.MAX_VALUE, Long.MAX_VALUE)));
    }

    @Test
    public void countSkipsNullsCountStarDoesNot() {
        Column column = Column.of("v", Type.VARCHAR, "a", null, "b");
        assertEquals(2L, aggregate(factory.create(AggrFunctionDescriptor.of(AggrFunctionKind.COUNT, "v", Type.VARCHAR)).newState(), column));
        assertEquals(3L, aggregate(factory.create(AggrFunctionDescriptor.countStar()).newState(), column));
    }
}
