package io.github.jaggr.function;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.exception.MergeTypeMismatchException;
import io.github.jaggr.table.Column;
import io.github.jaggr.table.Type;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Lifecycle bookkeeping and the partial state envelope shared by every specialization.
 * <p>
 * Partial layout: format version, function kind, argument type (-1 for {@code COUNT(*)}),
 * return type, distinct flag, a "seen" flag and, when seen, the body written by
 * {@link #writeBody(ByteArrayDataOutput)}.
 *
 * @param <S> the concrete state class, merge only accepts the same class
 */
public abstract class AbstractAggrState<S extends AbstractAggrState<S>> implements AggrState {
    static final byte PARTIAL_FORMAT_VERSION = 1;

    protected final AggrFunction function;
    private boolean seen;
    private boolean finalized;
    private Comparable result;

    protected AbstractAggrState(AggrFunction function) {
        this.function = requireNonNull(function);
    }

    @Override
    public AggrFunction function() {
        return function;
    }

    @Override
    public Stage stage() {
        if (finalized) {
            return Stage.FINALIZED;
        }
        return seen ? Stage.ACCUMULATING : Stage.INITIAL;
    }

    /**
     * @return true while no row has been applied, the empty group case of {@link #doFinish()}
     */
    protected boolean isEmpty() {
        return !seen;
    }

    private void checkMutable() {
        if (finalized) {
            throw new IllegalStateException(format("%s is finalized", function));
        }
    }

    @Override
    public final void update(Column column, int row) {
        checkMutable();
        if (doUpdate(column, row)) {
            seen = true;
        }
    }

    @Override
    public final void updateBatch(Column column, int[] rows, int from, int to) {
        checkMutable();
        if (from < to && doUpdateBatch(column, rows, from, to) > 0) {
            seen = true;
        }
    }

    @Override
    public final void merge(AggrState other) {
        checkMutable();
        if (other == this) {
            throw new IllegalArgumentException("can not merge a state into itself");
        }
        if (other.getClass() != getClass() || !function.getSignature().equals(other.function().getSignature())) {
            throw new MergeTypeMismatchException(format("can not merge %s into %s", other.function(), function));
        }
        // a finished state can still be empty
        if (((AbstractAggrState<?>) other).seen) {
            doMerge((S) other);
            seen = true;
        }
    }

    @Override
    public final Comparable finish() {
        if (!finalized) {
            result = doFinish();
            finalized = true;
        }
        return result;
    }

    @Override
    public final byte[] toPartial() {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        AggrFunction.Signature signature = function.getSignature();
        out.writeByte(PARTIAL_FORMAT_VERSION);
        out.writeByte(signature.getKind().ordinal());
        out.writeByte(null == signature.getArgType() ? -1 : signature.getArgType().ordinal());
        out.writeByte(signature.getReturnType().ordinal());
        out.writeBoolean(signature.isDistinct());
        out.writeBoolean(seen);
        if (seen) {
            writeBody(out);
        }
        return out.toByteArray();
    }

    @Override
    public final void mergePartial(byte[] partial) {
        checkMutable();
        requireNonNull(partial);
        ByteArrayDataInput in = ByteStreams.newDataInput(partial);
        try {
            checkHeader(in);
            if (in.readBoolean()) {
                mergeBody(in);
                seen = true;
            }
        } catch (IllegalStateException e) {
            // ByteArrayDataInput reports a premature end of input this way
            throw new EncodingException(format("truncated partial state of %s", function), e);
        }
        if (in.skipBytes(1) != 0) {
            throw new EncodingException(format("trailing bytes in partial state of %s", function));
        }
    }

    private void checkHeader(ByteArrayDataInput in) {
        byte version = in.readByte();
        if (version != PARTIAL_FORMAT_VERSION) {
            throw new MergeTypeMismatchException(format("partial state format %d, expected %d", version, PARTIAL_FORMAT_VERSION));
        }
        AggrFunction.Signature expected = function.getSignature();
        int kind = in.readByte();
        int argType = in.readByte();
        int returnType = in.readByte();
        boolean distinct = in.readBoolean();
        if (kind != expected.getKind().ordinal()
                || argType != (null == expected.getArgType() ? -1 : expected.getArgType().ordinal())
                || returnType != expected.getReturnType().ordinal()
                || distinct != expected.isDistinct()) {
            throw new MergeTypeMismatchException(format("partial state of %s can not be merged into %s",
                    describe(kind, argType, returnType, distinct), function));
        }
    }

    private static String describe(int kind, int argType, int returnType, boolean distinct) {
        try {
            return new AggrFunction.Signature(AggrFunctionKind.valueOf(kind),
                    argType < 0 ? null : Type.valueOf(argType),
                    Type.valueOf(returnType),
                    distinct).toString();
        } catch (RuntimeException e) {
            return format("[kind=%d, argType=%d, returnType=%d, distinct=%s]", kind, argType, returnType, distinct);
        }
    }

    /**
     * @return true if the row changed the state, false if it was skipped (NULL argument)
     */
    protected abstract boolean doUpdate(Column column, int row);

    /**
     * Specializations override this with a loop over their concrete column storage.
     *
     * @return how many rows changed the state
     */
    protected int doUpdateBatch(Column column, int[] rows, int from, int to) {
        int applied = 0;
        for (int i = from; i < to; i++) {
            if (doUpdate(column, rows[i])) {
                applied++;
            }
        }
        return applied;
    }

    /**
     * called only with a non-empty other
     */
    protected abstract void doMerge(S other);

    protected abstract Comparable doFinish();

    protected abstract void writeBody(ByteArrayDataOutput out);

    /**
     * reads a body written by {@link #writeBody(ByteArrayDataOutput)} and merges it into this state
     */
    protected abstract void mergeBody(ByteArrayDataInput in);
}
