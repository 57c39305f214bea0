package io.github.jaggr.function.state;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import io.github.jaggr.exception.EncodingException;
import io.github.jaggr.exception.UnknownTypeException;
import io.github.jaggr.table.ByteArray;
import io.github.jaggr.table.Type;

import java.math.BigDecimal;

import static java.lang.String.format;

/**
 * Argument values inside partial state bodies. Unlike the group key encoding the value comes
 * back exactly as written, decimals keep their scale.
 */
final class PartialValues {
    private PartialValues() {
    }

    static void write(ByteArrayDataOutput out, Type type, Comparable value) {
        out.writeBoolean(null != value);
        if (null == value) {
            return;
        }
        switch (type) {
            case INT:
                out.writeInt((Integer) value);
                break;
            case BIGINT:
                out.writeLong((Long) value);
                break;
            case DOUBLE:
                out.writeDouble((Double) value);
                break;
            case BIGDECIMAL:
                out.writeUTF(value.toString());
                break;
            case VARCHAR:
            case VARBYTE:
                ByteArray bytes = (ByteArray) value;
                out.writeInt(bytes.getLength());
                out.write(bytes.getBytes(), bytes.getOffset(), bytes.getLength());
                break;
            default:
                throw new UnknownTypeException(type.name());
        }
    }

    static Comparable read(ByteArrayDataInput in, Type type) {
        if (!in.readBoolean()) {
            return null;
        }
        switch (type) {
            case INT:
                return in.readInt();
            case BIGINT:
                return in.readLong();
            case DOUBLE:
                return in.readDouble();
            case BIGDECIMAL:
                String decimal = in.readUTF();
                try {
                    return new BigDecimal(decimal);
                } catch (NumberFormatException e) {
                    throw new EncodingException(format("malformed decimal '%s' in partial state", decimal), e);
                }
            case VARCHAR:
            case VARBYTE:
                int length = in.readInt();
                if (length < 0) {
                    throw new EncodingException(format("negative value length %d in partial state", length));
                }
                byte[] bytes = new byte[length];
                in.readFully(bytes);
                return new ByteArray(bytes);
            default:
                throw new UnknownTypeException(type.name());
        }
    }
}
