package io.github.jaggr.util;

import io.github.jaggr.table.ByteArray;
import org.apache.commons.codec.digest.MurmurHash3;

import java.math.BigDecimal;

public class ScalarUtil {
    public static Integer toInteger(Object object) {
        return null == object ? null : (Integer) object;
    }

    public static Long toLong(Object object) {
        return null == object ? null : (Long) object;
    }

    public static Double toDouble(Object object) {
        return null == object ? null : (Double) object;
    }

    public static String toStr(Object object) {
        return null == object ? null : object.toString();
    }

    public static BigDecimal toBigDecimal(Object object) {
        return null == object ? null : (BigDecimal) object;
    }

    public static ByteArray toByteArray(Object object) {
        if (null == object) {
            return null;
        }
        if (object instanceof String) {
            return new ByteArray((String) object);
        }
        return (ByteArray) object;
    }

    public static int murmur3Hash32(final byte[] data, int offset, int length) {
        return MurmurHash3.hash32x86(data, offset, length, MurmurHash3.DEFAULT_SEED);
    }

    public static long murmur3Hash64(final byte[] data, int offset, int length) {
        return MurmurHash3.hash128x64(data, offset, length, 0)[0];
    }
}
