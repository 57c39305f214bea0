package io.github.jaggr.codec;

import com.google.common.base.Utf8;
import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.table.BigDecimalColumn;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.ColumnInterface;
import io.github.jaggr.table.DoubleColumn;
import io.github.jaggr.table.IntColumn;
import io.github.jaggr.table.LongColumn;
import io.github.jaggr.table.Table;
import io.github.jaggr.table.Type;
import io.github.jaggr.table.VarbyteColumn;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Memcomparable encoding of grouping values. Every value is a flag byte followed by a payload:
 * <pre>
 *   NULL             0x00
 *   VARBYTE/VARCHAR  0x01  groups of 8 bytes, each followed by the marker 0xFF - padding
 *   INT/BIGINT       0x03  8 bytes big endian, sign bit flipped
 *   DOUBLE           0x05  8 bytes, sign bit flipped if non-negative else all bits flipped
 *   BIGDECIMAL       0x06  sign byte, then exponent and digits (inverted when negative)
 * </pre>
 * Comparing two encodings as unsigned bytes gives the same result as comparing the values, with
 * NULL smallest. Equal values always have equal encodings: -0.0 is written as 0.0, every NaN as
 * the canonical NaN and decimals without trailing zeros.
 */
public class GroupKeyCodec {
    public static final int NIL_FLAG = 0x00;
    public static final int BYTES_FLAG = 0x01;
    public static final int INT_FLAG = 0x03;
    public static final int FLOAT_FLAG = 0x05;
    public static final int DECIMAL_FLAG = 0x06;

    private static final int ENC_GROUP_SIZE = 8;
    private static final int ENC_MARKER = 0xFF;
    private static final long SIGN_MASK = 0x8000000000000000L;

    private static final int DECIMAL_NEGATIVE = 0;
    private static final int DECIMAL_ZERO = 1;
    private static final int DECIMAL_POSITIVE = 2;

    private final int[] columns;
    private final Type[] types;
    private final KeyEncoder encoder = new KeyEncoder();

    /**
     * @param columns indexes of the grouping columns in the input tables
     * @param types   declared types of the grouping columns
     */
    public GroupKeyCodec(int[] columns, Type[] types) {
        this.columns = requireNonNull(columns);
        this.types = requireNonNull(types);
        if (columns.length != types.length) {
            throw new IllegalArgumentException(format("%d grouping columns but %d types", columns.length, types.length));
        }
    }

    public int[] getColumns() {
        return columns;
    }

    public Type[] getTypes() {
        return types;
    }

    /**
     * fails if a grouping column of the batch is not stored with its declared type
     */
    public byte[] encode(Table table, int row) {
        encoder.reset();
        for (int i = 0; i < columns.length; i++) {
            encodeValue(encoder, table.getColumn(columns[i]), types[i], row);
        }
        return encoder.toByteArray();
    }

    public Comparable[] decode(byte[] key) {
        return decode(key, types);
    }

    public static Comparable[] decode(byte[] key, Type[] types) {
        KeyDecoder decoder = new KeyDecoder(key);
        Comparable[] values = new Comparable[types.length];
        for (int i = 0; i < types.length; i++) {
            values[i] = decodeValue(decoder, types[i]);
        }
        if (decoder.hasRemaining()) {
            throw new EncodingException(format("%d trailing bytes after decoding %d values",
                    key.length - decoder.position(), types.length));
        }
        return values;
    }

    /**
     * Encodes the value of one row straight from the typed storage of the column. A column
     * without a type holds only NULLs.
     */
    public static void encodeValue(KeyEncoder out, Column column, Type type, int row) {
        if (column.isNull(row)) {
            out.writeByte(NIL_FLAG);
            return;
        }
        ColumnInterface values = column.values();
        switch (type) {
            case INT:
                encodeLong(out, ((IntColumn) values).getInt(row));
                break;
            case BIGINT:
                encodeLong(out, ((LongColumn) values).getLong(row));
                break;
            case DOUBLE:
                encodeDouble(out, ((DoubleColumn) values).getDouble(row));
                break;
            case BIGDECIMAL:
                encodeDecimal(out, ((BigDecimalColumn) values).get(row));
                break;
            case VARCHAR:
            case VARBYTE: {
                VarbyteColumn varbyteColumn = (VarbyteColumn) values;
                encodeBytes(out, type, varbyteColumn.rawValues(), varbyteColumn.offset(row), varbyteColumn.length(row));
                break;
            }
            default:
                throw new EncodingException("unsupported grouping type " + type);
        }
    }

    public static void encodeValue(KeyEncoder out, Type type, Comparable value) {
        if (null == value) {
            out.writeByte(NIL_FLAG);
            return;
        }
        try {
            switch (type) {
                case INT:
                    encodeLong(out, (Integer) value);
                    break;
                case BIGINT:
                    encodeLong(out, (Long) value);
                    break;
                case DOUBLE:
                    encodeDouble(out, (Double) value);
                    break;
                case BIGDECIMAL:
                    encodeDecimal(out, (BigDecimal) value);
                    break;
                case VARCHAR:
                case VARBYTE:
                    if (value instanceof String) {
                        byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
                        encodeBytes(out, type, bytes, 0, bytes.length);
                    } else {
                        ByteArray byteArray = (ByteArray) value;
                        encodeBytes(out, type, byteArray.getBytes(), byteArray.getOffset(), byteArray.getLength());
                    }
                    break;
                default:
                    throw new EncodingException("unsupported grouping type " + type);
            }
        } catch (ClassCastException e) {
            throw new EncodingException(format("%s can not be encoded as %s", value.getClass().getName(), type), e);
        }
    }

    public static byte[] encodeValue(Type type, Comparable value) {
        KeyEncoder out = new KeyEncoder(16);
        encodeValue(out, type, value);
        return out.toByteArray();
    }

    private static void encodeLong(KeyEncoder out, long v) {
        out.writeByte(INT_FLAG);
        out.writeLong(v ^ SIGN_MASK);
    }

    private static void encodeDouble(KeyEncoder out, double v) {
        if (v == 0.0d) {
            v = 0.0d;
        }
        long bits = Double.doubleToLongBits(v);
        if (bits >= 0) {
            bits |= SIGN_MASK;
        } else {
            bits = ~bits;
        }
        out.writeByte(FLOAT_FLAG);
        out.writeLong(bits);
    }

    private static void encodeDecimal(KeyEncoder out, BigDecimal v) {
        out.writeByte(DECIMAL_FLAG);
        int signum = v.signum();
        if (0 == signum) {
            out.writeByte(DECIMAL_ZERO);
            return;
        }
        BigDecimal stripped = v.stripTrailingZeros();
        byte[] digits = stripped.unscaledValue().abs().toString().getBytes(StandardCharsets.US_ASCII);
        // value = 0.d1d2d3... * 10^exponent with d1 != 0
        long exponent = (long) digits.length - stripped.scale();
        if (exponent > Integer.MAX_VALUE || exponent < Integer.MIN_VALUE) {
            throw new EncodingException("decimal exponent out of range: " + v);
        }
        out.writeByte(signum > 0 ? DECIMAL_POSITIVE : DECIMAL_NEGATIVE);
        int from = out.position();
        out.writeInt((int) exponent ^ Integer.MIN_VALUE);
        out.writeBytes(digits, 0, digits.length);
        out.writeByte(0);
        if (signum < 0) {
            out.invertFrom(from);
        }
    }

    private static void encodeBytes(KeyEncoder out, Type type, byte[] bytes, int offset, int length) {
        if (type == Type.VARCHAR && !Utf8.isWellFormed(bytes, offset, length)) {
            throw new EncodingException(format("invalid utf-8 in VARCHAR value of %d bytes", length));
        }
        out.writeByte(BYTES_FLAG);
        int end = offset + length;
        for (int index = offset; index <= end; index += ENC_GROUP_SIZE) {
            int remain = end - index;
            int padCount = 0;
            if (remain >= ENC_GROUP_SIZE) {
                out.writeBytes(bytes, index, ENC_GROUP_SIZE);
            } else {
                padCount = ENC_GROUP_SIZE - remain;
                out.writeBytes(bytes, index, remain);
                for (int i = 0; i < padCount; i++) {
                    out.writeByte(0);
                }
            }
            out.writeByte(ENC_MARKER - padCount);
        }
    }

    public static Comparable decodeValue(KeyDecoder in, Type type) {
        int flag = in.readByte();
        if (NIL_FLAG == flag) {
            return null;
        }
        switch (type) {
            case INT: {
                checkFlag(flag, INT_FLAG, type);
                long v = in.readLong() ^ SIGN_MASK;
                if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                    throw new EncodingException(format("%d out of INT range", v));
                }
                return (int) v;
            }
            case BIGINT:
                checkFlag(flag, INT_FLAG, type);
                return in.readLong() ^ SIGN_MASK;
            case DOUBLE: {
                checkFlag(flag, FLOAT_FLAG, type);
                long bits = in.readLong();
                if ((bits & SIGN_MASK) != 0) {
                    bits &= ~SIGN_MASK;
                } else {
                    bits = ~bits;
                }
                return Double.longBitsToDouble(bits);
            }
            case BIGDECIMAL:
                checkFlag(flag, DECIMAL_FLAG, type);
                return decodeDecimal(in);
            case VARCHAR:
            case VARBYTE:
                checkFlag(flag, BYTES_FLAG, type);
                return new ByteArray(decodeBytes(in));
            default:
                throw new EncodingException("unsupported grouping type " + type);
        }
    }

    private static void checkFlag(int flag, int expected, Type type) {
        if (flag != expected) {
            throw new EncodingException(format("flag 0x%02x can not be decoded as %s", flag, type));
        }
    }

    private static BigDecimal decodeDecimal(KeyDecoder in) {
        int sign = in.readByte();
        if (DECIMAL_ZERO == sign) {
            return BigDecimal.ZERO;
        }
        if (DECIMAL_POSITIVE != sign && DECIMAL_NEGATIVE != sign) {
            throw new EncodingException(format("bad decimal sign byte 0x%02x", sign));
        }
        boolean negative = DECIMAL_NEGATIVE == sign;
        int mask = negative ? 0xFF : 0;
        int exponent = in.readInt();
        if (negative) {
            exponent = ~exponent;
        }
        exponent ^= Integer.MIN_VALUE;

        StringBuilder digits = new StringBuilder();
        while (true) {
            int b = in.readByte() ^ mask;
            if (0 == b) {
                break;
            }
            if (b < '0' || b > '9') {
                throw new EncodingException(format("bad decimal digit 0x%02x", b));
            }
            digits.append((char) b);
        }
        if (digits.length() == 0) {
            throw new EncodingException("decimal without digits");
        }
        BigDecimal v = new BigDecimal(new BigInteger(digits.toString()), digits.length() - exponent);
        return negative ? v.negate() : v;
    }

    private static byte[] decodeBytes(KeyDecoder in) {
        byte[] key = in.key();
        KeyEncoder out = new KeyEncoder(ENC_GROUP_SIZE * 2);
        while (true) {
            int start = in.position();
            in.skip(ENC_GROUP_SIZE + 1);
            int marker = key[start + ENC_GROUP_SIZE] & 0xFF;
            int padCount = ENC_MARKER - marker;
            if (padCount > ENC_GROUP_SIZE) {
                throw new EncodingException(format("bad bytes group marker 0x%02x", marker));
            }
            int realLength = ENC_GROUP_SIZE - padCount;
            out.writeBytes(key, start, realLength);
            if (padCount != 0) {
                for (int i = realLength; i < ENC_GROUP_SIZE; i++) {
                    if (key[start + i] != 0) {
                        throw new EncodingException("non zero padding in bytes group");
                    }
                }
                return out.toByteArray();
            }
        }
    }

    /**
     * advances past one encoded value without materializing it
     */
    public static void skipValue(KeyDecoder in) {
        int flag = in.readByte();
        switch (flag) {
            case NIL_FLAG:
                return;
            case INT_FLAG:
            case FLOAT_FLAG:
                in.skip(Long.BYTES);
                return;
            case DECIMAL_FLAG: {
                int sign = in.readByte();
                if (DECIMAL_ZERO == sign) {
                    return;
                }
                int terminator = DECIMAL_NEGATIVE == sign ? 0xFF : 0;
                in.skip(Integer.BYTES);
                while (in.readByte() != terminator) {
                    // digits
                }
                return;
            }
            case BYTES_FLAG: {
                byte[] key = in.key();
                while (true) {
                    int start = in.position();
                    in.skip(ENC_GROUP_SIZE + 1);
                    if ((key[start + ENC_GROUP_SIZE] & 0xFF) != ENC_MARKER) {
                        return;
                    }
                }
            }
            default:
                throw new EncodingException(format("unknown flag 0x%02x", flag));
        }
    }
}
