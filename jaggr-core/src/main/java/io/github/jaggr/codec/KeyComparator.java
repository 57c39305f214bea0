package io.github.jaggr.codec;

import io.github.jaggr.table.SortOrder;

import java.util.Comparator;

import static java.util.Objects.requireNonNull;

/**
 * Orders encoded group keys by the declared sort order of each grouping column. Since the
 * encoding is memcomparable, an ascending column is compared on its raw bytes and a descending
 * column on the same bytes with the result negated, so keys never need to be decoded.
 */
public class KeyComparator implements Comparator<byte[]> {
    private final SortOrder[] orders;
    private final boolean allAscending;

    public KeyComparator(SortOrder[] orders) {
        this.orders = requireNonNull(orders);
        boolean asc = true;
        for (SortOrder order : orders) {
            if (order != SortOrder.ASC) {
                asc = false;
                break;
            }
        }
        this.allAscending = asc;
    }

    @Override
    public int compare(byte[] left, byte[] right) {
        if (allAscending) {
            return compareBytes(left, 0, left.length, right, 0, right.length);
        }

        KeyDecoder l = new KeyDecoder(left);
        KeyDecoder r = new KeyDecoder(right);
        for (SortOrder order : orders) {
            int lStart = l.position();
            int rStart = r.position();
            GroupKeyCodec.skipValue(l);
            GroupKeyCodec.skipValue(r);
            int c = compareBytes(left, lStart, l.position(), right, rStart, r.position());
            if (c != 0) {
                return order == SortOrder.ASC ? c : -c;
            }
        }
        return 0;
    }

    static int compareBytes(byte[] left, int lFrom, int lTo, byte[] right, int rFrom, int rTo) {
        int lLen = lTo - lFrom;
        int rLen = rTo - rFrom;
        int len = Math.min(lLen, rLen);
        for (int i = 0; i < len; i++) {
            int v = (left[lFrom + i] & 0xFF) - (right[rFrom + i] & 0xFF);
            if (v != 0) {
                return v;
            }
        }
        return Integer.compare(lLen, rLen);
    }
}
