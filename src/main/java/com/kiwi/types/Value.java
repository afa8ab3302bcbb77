package com.kiwi.types;

import com.kiwi.core.KiwiRecord;
import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A dynamically typed value held by a {@link KiwiRecord}.
 * <p>
 * Every kiwi integer type ({@code byte}, {@code int}, {@code uint}, {@code int64}, {@code uint64}) maps to
 * {@link IntValue}; enum members are carried by name as {@link StringValue}; structs and messages nest as
 * {@link RecordValue}. The {@code asX()} accessors fail with {@link ErrorType#TYPE_MISMATCH} when the value
 * holds a different variant.
 */
public abstract class Value {

    public abstract TypeCode getTypeCode();
    public abstract boolean equals(Object obj);
    public abstract int hashCode();
    public abstract String toString();

    public boolean asBoolean() throws KiwiException {
        throw mismatch("bool");
    }

    public long asLong() throws KiwiException {
        throw mismatch("integer");
    }

    public float asFloat() throws KiwiException {
        throw mismatch("float");
    }

    public String asString() throws KiwiException {
        throw mismatch("string");
    }

    public byte[] asBytes() throws KiwiException {
        throw mismatch("byte[]");
    }

    public List<Value> asList() throws KiwiException {
        throw mismatch("array");
    }

    public KiwiRecord asRecord() throws KiwiException {
        throw mismatch("record");
    }

    public boolean isNull() {
        return false;
    }

    protected KiwiException mismatch(String expected) {
        return new KiwiException(ErrorType.TYPE_MISMATCH, "Expected " + expected + " but found " + getTypeCode());
    }

    // Factory methods
    public static Value nullValue() {
        return NullValue.INSTANCE;
    }

    public static Value fromBoolean(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    public static Value fromInt(long value) {
        return new IntValue(value);
    }

    public static Value fromFloat(float value) {
        return new FloatValue(value);
    }

    public static Value fromString(String value) {
        return new StringValue(value);
    }

    public static Value fromBytes(byte[] value) {
        return new BytesValue(value);
    }

    public static Value fromArray(List<Value> value) {
        return new ArrayValue(value);
    }

    public static Value fromRecord(KiwiRecord value) {
        return new RecordValue(value);
    }

    /**
     * Convert a plain Java object: Boolean, Number, String, byte[], List, Map with String keys, KiwiRecord
     * or Value. Floating point numbers become {@link FloatValue}, other numbers {@link IntValue}.
     */
    public static Value fromObject(Object obj) {
        if (obj == null) return nullValue();
        if (obj instanceof Value) return (Value) obj;
        if (obj instanceof Boolean) return fromBoolean((Boolean) obj);
        if (obj instanceof Float || obj instanceof Double) return fromFloat(((Number) obj).floatValue());
        if (obj instanceof Number) return fromInt(((Number) obj).longValue());
        if (obj instanceof String) return fromString((String) obj);
        if (obj instanceof byte[]) return fromBytes((byte[]) obj);
        if (obj instanceof KiwiRecord) return fromRecord((KiwiRecord) obj);
        if (obj instanceof List) {
            var list = (List<?>) obj;
            var values = new ArrayList<Value>(list.size());
            for (var element : list) {
                values.add(fromObject(element));
            }
            return fromArray(values);
        }
        if (obj instanceof Map) {
            var builder = KiwiRecord.builder();
            for (var entry : ((Map<?, ?>) obj).entrySet()) {
                builder.field(String.valueOf(entry.getKey()), fromObject(entry.getValue()));
            }
            return fromRecord(builder.build());
        }
        throw new IllegalArgumentException("Unsupported value type: " + obj.getClass().getName());
    }

    // Null Value
    @EqualsAndHashCode(callSuper = false)
    public static class NullValue extends Value {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public TypeCode getTypeCode() { return TypeCode.NULL; }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    // Boolean Value
    @EqualsAndHashCode(callSuper = false)
    public static class BoolValue extends Value {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        private final boolean value;

        public BoolValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public boolean asBoolean() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.BOOL; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Integer Value, wide enough for every kiwi integer type
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class IntValue extends Value {
        private final long value;

        public IntValue(long value) {
            this.value = value;
        }

        @Override
        public long asLong() { return value; }

        @Override
        public float asFloat() { return (float) value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.INT; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // Float Value; equality is bit-exact
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FloatValue extends Value {
        private final float value;

        public FloatValue(float value) {
            this.value = value;
        }

        @Override
        public float asFloat() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.FLOAT; }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // String Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class StringValue extends Value {
        private final String value;

        public StringValue(String value) {
            this.value = Objects.requireNonNull(value, "String cannot be null");
        }

        @Override
        public String asString() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.STRING; }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    // Bytes Value
    @Getter
    public static class BytesValue extends Value {
        /**
         *  Returns internal array. MUST NOT be modified by caller.
         */
        private final byte[] value;

        /**
         * Takes ownership of the byte array. Caller must not modify after construction.
         */
        public BytesValue(byte[] value) {
            this.value = Objects.requireNonNull(value, "Bytes cannot be null");
        }

        @Override
        public byte[] asBytes() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.BYTES; }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof BytesValue)) return false;
            return Arrays.equals(value, ((BytesValue) obj).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "bytes[" + value.length + "]";
        }
    }

    // Array Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class ArrayValue extends Value {
        private final List<Value> value;

        public ArrayValue(List<Value> value) {
            this.value = List.copyOf(Objects.requireNonNull(value, "Array cannot be null"));
        }

        @Override
        public List<Value> asList() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.ARRAY; }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    // Record Value
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class RecordValue extends Value {
        private final KiwiRecord value;

        public RecordValue(KiwiRecord value) {
            this.value = Objects.requireNonNull(value, "Record cannot be null");
        }

        @Override
        public KiwiRecord asRecord() { return value; }

        @Override
        public TypeCode getTypeCode() { return TypeCode.RECORD; }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
