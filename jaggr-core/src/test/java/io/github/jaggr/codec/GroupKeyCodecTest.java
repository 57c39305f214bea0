package io.github.jaggr.codec;

import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.Type;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class GroupKeyCodecTest {
    private static byte[] encode(Type type, Comparable value) {
        return GroupKeyCodec.encodeValue(type, value);
    }

    private static int compare(byte[] left, byte[] right) {
        return KeyComparator.compareBytes(left, 0, left.length, right, 0, right.length);
    }

    private static void assertAscending(Type type, Comparable... values) {
        for (int i = 1; i < values.length; i++) {
            byte[] prev = encode(type, values[i - 1]);
            byte[] next = encode(type, values[i]);
            assertTrue(values[i - 1] + " should sort before " + values[i], compare(prev, next) < 0);
        }
    }

    @Test
    public void nullIsOneFlagByte() {
        assertArrayEquals(new byte[]{0}, encode(Type.BIGINT, null));
        assertArrayEquals(new byte[]{0}, encode(Type.VARCHAR, null));
    }

    @Test
    public void integersKeepOrder() {
        assertAscending(Type.BIGINT, null, Long.MIN_VALUE, -1L, 0L, 1L, Long.MAX_VALUE);
        assertAscending(Type.INT, null, Integer.MIN_VALUE, -7, 0, 7, Integer.MAX_VALUE);
    }

    @Test
    public void intAndBigintShareOneEncoding() {
        assertArrayEquals(encode(Type.BIGINT, 42L), encode(Type.INT, 42));
    }

    @Test
    public void doublesKeepOrder() {
        assertAscending(Type.DOUBLE, null, Double.NEGATIVE_INFINITY, -1.5d, -Double.MIN_VALUE, 0d, 1e-300d, 2.5d,
                Double.POSITIVE_INFINITY, Double.NaN);
    }

    @Test
    public void negativeZeroAndNaNAreCanonical() {
        assertArrayEquals(encode(Type.DOUBLE, 0.0d), encode(Type.DOUBLE, -0.0d));
        assertArrayEquals(encode(Type.DOUBLE, Double.NaN), encode(Type.DOUBLE, Double.longBitsToDouble(0x7ff8000000000001L)));
    }

    @Test
    public void decimalsKeepOrder() {
        assertAscending(Type.BIGDECIMAL, null,
                new BigDecimal("-100"),
                new BigDecimal("-10"),
                new BigDecimal("-1.5"),
                new BigDecimal("-1"),
                new BigDecimal("-0.11"),
                new BigDecimal("-0.1"),
                new BigDecimal("-0.01"),
                BigDecimal.ZERO,
                new BigDecimal("0.01"),
                new BigDecimal("0.1"),
                new BigDecimal("0.11"),
                BigDecimal.ONE,
                new BigDecimal("1.5"),
                BigDecimal.TEN,
                new BigDecimal("100"));
    }

    @Test
    public void decimalScaleDoesNotChangeTheKey() {
        assertArrayEquals(encode(Type.BIGDECIMAL, new BigDecimal("1.0")), encode(Type.BIGDECIMAL, new BigDecimal("1.00")));
        assertArrayEquals(encode(Type.BIGDECIMAL, new BigDecimal("0.000")), encode(Type.BIGDECIMAL, BigDecimal.ZERO));
        assertArrayEquals(encode(Type.BIGDECIMAL, new BigDecimal("1E+3")), encode(Type.BIGDECIMAL, new BigDecimal("1000")));
    }

    @Test
    public void bytesKeepOrder() {
        assertAscending(Type.VARBYTE, null,
                new ByteArray(new byte[0]),
                new ByteArray(new byte[]{0}),
                new ByteArray(new byte[]{0, 0}),
                new ByteArray("a"),
                new ByteArray("abcdefgh"),
                new ByteArray("abcdefgh\u0000"),
                new ByteArray("abcdefghi"),
                new ByteArray("b"),
                new ByteArray(new byte[]{(byte) 0xFF}));
    }

    @Test
    public void bytesAreGroupedByEight() {
        byte[] key = encode(Type.VARBYTE, new ByteArray("abcdefgh"));
        // flag, one full group, one empty group
        assertEquals(1 + 9 + 9, key.length);
        assertEquals(0xFF, key[9] & 0xFF);
        assertEquals(0xFF - 8, key[18] & 0xFF);
    }

    @Test
    public void encodeAndDecodeMultiColumnKey() {
        Table table = new Table(Arrays.asList(
                Column.of("s", Type.VARCHAR, "hello, world", null),
                Column.of("i", Type.INT, -3, 4),
                Column.of("d", Type.DOUBLE, 2.25d, null),
                Column.of("m", Type.BIGDECIMAL, new BigDecimal("-12.340"), BigDecimal.ZERO),
                Column.of("b", Type.VARBYTE, new ByteArray(new byte[]{1, 2, 3}), new ByteArray(new byte[0]))));
        GroupKeyCodec codec = new GroupKeyCodec(new int[]{0, 1, 2, 3, 4},
                new Type[]{Type.VARCHAR, Type.INT, Type.DOUBLE, Type.BIGDECIMAL, Type.VARBYTE});

        Comparable[] first = codec.decode(codec.encode(table, 0));
        assertEquals(new ByteArray("hello, world"), first[0]);
        assertEquals(-3, first[1]);
        assertEquals(2.25d, first[2]);
        assertEquals(0, new BigDecimal("-12.34").compareTo((BigDecimal) first[3]));
        assertEquals(new ByteArray(new byte[]{1, 2, 3}), first[4]);

        Comparable[] second = codec.decode(codec.encode(table, 1));
        assertNull(second[0]);
        assertEquals(4, second[1]);
        assertNull(second[2]);
        assertEquals(BigDecimal.ZERO, second[3]);
        assertEquals(0, ((ByteArray) second[4]).getLength());
    }

    @Test
    public void equalValuesFromDifferentColumnsGiveEqualKeys() {
        Table left = new Table(Arrays.asList(Column.of("k", Type.VARCHAR, "x", "y")));
        Table right = new Table(Arrays.asList(Column.of("v", Type.BIGINT, 1L), Column.of("k", Type.VARCHAR, "y")));
        byte[] l = new GroupKeyCodec(new int[]{0}, new Type[]{Type.VARCHAR}).encode(left, 1);
        byte[] r = new GroupKeyCodec(new int[]{1}, new Type[]{Type.VARCHAR}).encode(right, 0);
        assertArrayEquals(l, r);
        assertFalse(Arrays.equals(l, new GroupKeyCodec(new int[]{0}, new Type[]{Type.VARCHAR}).encode(left, 0)));
    }

    @Test(expected = EncodingException.class)
    public void invalidUtf8InVarchar() {
        Table table = new Table(Arrays.asList(Column.of("s", Type.VARCHAR, new ByteArray(new byte[]{(byte) 0xC3, 0x28}))));
        new GroupKeyCodec(new int[]{0}, new Type[]{Type.VARCHAR}).encode(table, 0);
    }

    @Test
    public void invalidUtf8IsFineInVarbyte() {
        Table table = new Table(Arrays.asList(Column.of("s", Type.VARBYTE, new ByteArray(new byte[]{(byte) 0xC3, 0x28}))));
        new GroupKeyCodec(new int[]{0}, new Type[]{Type.VARBYTE}).encode(table, 0);
    }

    @Test(expected = EncodingException.class)
    public void valueOfAnotherJavaType() {
        encode(Type.BIGINT, "1");
    }

    @Test(expected = EncodingException.class)
    public void truncatedKey() {
        byte[] key = encode(Type.BIGINT, 1L);
        GroupKeyCodec.decode(Arrays.copyOf(key, key.length - 1), new Type[]{Type.BIGINT});
    }

    @Test(expected = EncodingException.class)
    public void trailingBytes() {
        byte[] key = encode(Type.BIGINT, 1L);
        GroupKeyCodec.decode(Arrays.copyOf(key, key.length + 1), new Type[]{Type.BIGINT});
    }

    @Test(expected = EncodingException.class)
    public void flagOfAnotherType() {
        GroupKeyCodec.decode(encode(Type.DOUBLE, 1d), new Type[]{Type.BIGINT});
    }

    @Test
    public void skipValue() {
        KeyEncoder encoder = new KeyEncoder();
        GroupKeyCodec.encodeValue(encoder, Type.BIGDECIMAL, new BigDecimal("-3.5"));
        GroupKeyCodec.encodeValue(encoder, Type.VARCHAR, "0123456789");
        GroupKeyCodec.encodeValue(encoder, Type.BIGINT, null);
        GroupKeyCodec.encodeValue(encoder, Type.BIGINT, 9L);
        KeyDecoder decoder = new KeyDecoder(encoder.toByteArray());
        GroupKeyCodec.skipValue(decoder);
        GroupKeyCodec.skipValue(decoder);
        GroupKeyCodec.skipValue(decoder);
        assertEquals(9L, GroupKeyCodec.decodeValue(decoder, Type.BIGINT));
        assertFalse(decoder.hasRemaining());
    }
}
