package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.codec.GroupKeyCodec;
import io.github.jaggr.codec.KeyEncoder;
import io.github.jaggr.exception.MergeTypeMismatchException;
import io.github.jaggr.function.AbstractAggrState;
import io.github.jaggr.function.AggrFunction;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;
import io.github.jaggr.util.ScalarUtil;

import static java.lang.String.format;

/**
 * APPROX_COUNT_DISTINCT(expr) -> BIGINT, a HyperLogLog sketch with 2^p one byte registers,
 * p = {@code jaggr.hll.precision}. Values are hashed in their group key encoding, so equal values
 * of the declared type hash alike. NULLs are skipped. The estimate uses linear counting in the small
 * range.
 */
public class HyperLogLogState extends AbstractAggrState<HyperLogLogState> {
    private final int precision;
    private final byte[] registers;
    private final KeyEncoder encoder = new KeyEncoder(32);

    public HyperLogLogState(AggrFunction function) {
        super(function);
        this.precision = function.getConfig().getHllPrecision();
        this.registers = new byte[1 << precision];
    }

    private void addHash(long hash) {
        int index = (int) (hash >>> (64 - precision));
        long rest = hash << precision;
        int rank = rest == 0 ? 64 - precision + 1 : Long.numberOfLeadingZeros(rest) + 1;
        if (rank > registers[index]) {
            registers[index] = (byte) rank;
        }
    }

    private void add(Column column, Type type, int row) {
        encoder.reset();
        GroupKeyCodec.encodeValue(encoder, column, type, row);
        addHash(ScalarUtil.murmur3Hash64(encoder.buffer(), 0, encoder.position()));
    }

    @Override
    protected boolean doUpdate(Column column, int row) {
        if (column.isNull(row)) {
            return false;
        }
        add(column, function.getArgType(), row);
        return true;
    }

    @Override
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        Type type = function.getArgType();
        int applied = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (column.isNull(row)) {
                continue;
            }
            add(column, type, row);
            applied++;
        }
        return applied;
    }

    private void mergeRegisters(byte[] other) {
        for (int i = 0; i < registers.length; i++) {
            if (other[i] > registers[i]) {
                registers[i] = other[i];
            }
        }
    }

    @Override
    protected void doMerge(HyperLogLogState other) {
        checkPrecision(other.precision);
        mergeRegisters(other.registers);
    }

    private void checkPrecision(int other) {
        if (other != precision) {
            throw new MergeTypeMismatchException(format("%s: sketch precision %d can not be merged into precision %d",
                    function, other, precision));
        }
    }

    @Override
    protected Comparable doFinish() {
        if (isEmpty()) {
            return 0L;
        }
        int m = registers.length;
        double sum = 0;
        int zeros = 0;
        for (byte register : registers) {
            sum += 1.0d / (1L << register);
            if (register == 0) {
                zeros++;
            }
        }
        double estimate = alpha(m) * m * m / sum;
        if (estimate <= 2.5d * m && zeros > 0) {
            estimate = m * Math.log((double) m / zeros);
        }
        return Math.round(estimate);
    }

    private static double alpha(int m) {
        switch (m) {
            case 16:
                return 0.673d;
            case 32:
                return 0.697d;
            case 64:
                return 0.709d;
            default:
                return 0.7213d / (1 + 1.079d / m);
        }
    }

    @Override
    protected void writeBody(ByteArrayDataOutput out) {
        out.writeByte(precision);
        out.write(registers);
    }

    @Override
    protected void mergeBody(ByteArrayDataInput in) {
        checkPrecision(in.readByte());
        byte[] other = new byte[registers.length];
        in.readFully(other);
        mergeRegisters(other);
    }
}
