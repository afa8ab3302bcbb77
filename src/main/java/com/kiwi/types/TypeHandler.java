package com.kiwi.types;

import com.kiwi.error.KiwiException;
import com.kiwi.schema.NativeType;
import com.kiwi.util.KiwiBuffer;

/**
 * Reads and writes the value of one native kiwi type.
 * <p>
 * Encoding accepts any {@link Value} whose {@code asX()} accessor matches the type and fails with
 * {@link com.kiwi.error.ErrorType#TYPE_MISMATCH} otherwise. Integer encodings wrap to the width of the
 * target type, as the wire format does.
 */
public interface TypeHandler {
    Value decode(KiwiBuffer buffer) throws KiwiException;
    void encode(Value value, KiwiBuffer buffer) throws KiwiException;

    TypeHandler BOOL = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromBoolean(buffer.getBool());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putBool(value.asBoolean());
        }
    };

    TypeHandler BYTE = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromInt(buffer.getByte() & 0xFF);
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putByte((byte) value.asLong());
        }
    };

    TypeHandler INT = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromInt(buffer.getVarInt());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putVarInt((int) value.asLong());
        }
    };

    TypeHandler UINT = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromInt(Integer.toUnsignedLong(buffer.getVarUint()));
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putVarUint((int) value.asLong());
        }
    };

    TypeHandler FLOAT = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromFloat(buffer.getVarFloat());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putVarFloat(value.asFloat());
        }
    };

    TypeHandler STRING = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromString(buffer.getString());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putString(value.asString());
        }
    };

    TypeHandler INT64 = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromInt(buffer.getVarInt64());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putVarInt64(value.asLong());
        }
    };

    // uint64 values above Long.MAX_VALUE read back as negative longs carrying the same 64 bits
    TypeHandler UINT64 = new TypeHandler() {
        @Override
        public Value decode(KiwiBuffer buffer) throws KiwiException {
            return Value.fromInt(buffer.getVarUint64());
        }

        @Override
        public void encode(Value value, KiwiBuffer buffer) throws KiwiException {
            buffer.putVarUint64(value.asLong());
        }
    };

    static TypeHandler forNative(NativeType type) {
        switch (type) {
            case BOOL: return BOOL;
            case BYTE: return BYTE;
            case INT: return INT;
            case UINT: return UINT;
            case FLOAT: return FLOAT;
            case STRING: return STRING;
            case INT64: return INT64;
            case UINT64: return UINT64;
            default: throw new IllegalArgumentException("Unhandled native type: " + type);
        }
    }
}
