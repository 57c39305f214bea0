package io.github.jaggr.table;

import io.github.jaggr.exception.ColumnNotExistsException;
import io.github.jaggr.exception.IllegalSizeException;
import io.github.jaggr.exception.InconsistentColumnTypeException;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TableTest {
    @Test
    public void buildAndRead() {
        TableBuilder tableBuilder = new TableBuilder(new ColumnTypeBuilder()
                .column("k", Type.VARCHAR)
                .column("v", Type.BIGINT)
                .column("d", Type.BIGDECIMAL)
                .build(), 2);
        tableBuilder.appendRow("a", 3L, new BigDecimal("1.5"));
        tableBuilder.appendRow("b", null, null);
        tableBuilder.appendRow(new ByteArray("c"), 5L, BigDecimal.ONE);
        Table table = tableBuilder.build();

        assertEquals(3, table.size());
        assertEquals(3, table.activeCount());
        assertEquals("a", table.getColumn("k").getString(0));
        assertEquals(Long.valueOf(5), table.getColumn(1).getLong(2));
        assertTrue(table.getColumn("v").isNull(1));
        assertNull(table.getColumn("d").getBigDecimal(1));
        assertEquals(Type.BIGDECIMAL, table.getColumnTypes().get("d"));
        assertEquals(Integer.valueOf(2), table.getIndex("d"));
        assertEquals("[c, 5, 1]", Arrays.toString(table.getRow(2)));
    }

    @Test
    public void selection() {
        Table table = new Table(Arrays.asList(Column.of("v", Type.INT, 1, 2, 3, 4)));
        Table selected = table.select(new int[]{1, 3});
        assertEquals(4, selected.size());
        assertEquals(2, selected.activeCount());
        assertArrayEquals(new int[]{1, 3}, selected.activeRows());
        assertArrayEquals(new int[]{0, 1, 2, 3}, table.activeRows());
        assert !table.hasSelection();
        assert selected.hasSelection();
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void selectionOutOfRange() {
        new Table(Arrays.asList(Column.of("v", Type.INT, 1))).select(new int[]{1});
    }

    @Test(expected = IllegalSizeException.class)
    public void columnsOfDifferentSize() {
        new Table(Arrays.asList(Column.of("a", Type.INT, 1, 2), Column.of("b", Type.INT, 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateColumnName() {
        new Table(Arrays.asList(Column.of("a", Type.INT, 1), Column.of("a", Type.BIGINT, 1L)));
    }

    @Test(expected = ColumnNotExistsException.class)
    public void missingColumn() {
        new Table(Arrays.asList(Column.of("a", Type.INT, 1))).getColumn("b");
    }

    @Test
    public void untypedColumnGetsTypeOfFirstValue() {
        Column column = new Column("c");
        column.add(null);
        column.add(null);
        assertEquals(2, column.size());
        assertNull(column.getType());
        assertTrue(column.isNull(1));

        column.add(7L);
        assertEquals(Type.BIGINT, column.getType());
        assertTrue(column.isNull(0));
        assertEquals(7L, ((LongColumn) column.values()).getLong(2));
    }

    @Test
    public void ensureType() {
        Column column = new Column("c");
        column.add(null);
        column.ensureType(Type.DOUBLE);
        assertEquals(Type.DOUBLE, column.getType());
        assertTrue(((DoubleColumn) column.values()).isNull(0));
        column.ensureType(Type.DOUBLE);
    }

    @Test(expected = InconsistentColumnTypeException.class)
    public void ensureTypeMismatch() {
        Column.of("c", Type.INT, 1).ensureType(Type.BIGINT);
    }

    @Test(expected = InconsistentColumnTypeException.class)
    public void addWrongType() {
        Column.of("c", Type.INT, 1).add(1L);
    }

    @Test(expected = IllegalStateException.class)
    public void untypedColumnHasNoStorage() {
        new Column("c").values();
    }

    @Test
    public void varbyteValuesShareOneBuffer() {
        VarbyteColumn column = new VarbyteColumn(1);
        column.add("ab");
        column.add(null);
        column.add("");
        column.add("cde");
        assertEquals(4, column.size());
        assertEquals("ab", column.get(0).toString());
        assertNull(column.get(1));
        assertEquals(0, column.get(2).getLength());
        assertEquals(2, column.offset(3));
        assertEquals(3, column.length(3));
        assert column.get(3).getBytes() == column.rawValues();
    }

    @Test
    public void byteArrayComparesUnsigned() {
        ByteArray small = new ByteArray(new byte[]{0x01});
        ByteArray large = new ByteArray(new byte[]{(byte) 0x80});
        assertTrue(small.compareTo(large) < 0);
        assertTrue(new ByteArray("ab").compareTo(new ByteArray("abc")) < 0);
        ByteArray slice = new ByteArray("xaby".getBytes(), 1, 2);
        assertEquals(new ByteArray("ab"), slice);
        assertEquals(new ByteArray("ab").hashCode(), slice.hashCode());
    }
}
