package com.kiwi.core;

import com.kiwi.types.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fluent builder for {@link KiwiRecord} instances.
 * <p>
 * Calling {@code field()} again with the same name replaces the previous value but keeps its position.
 * <p>
 * Usage:
 * <pre>
 *   var record = KiwiRecord.builder()
 *       .field("id", 5)                 // int to IntValue
 *       .field("kind", "B")             // String to StringValue (also used for enum members)
 *       .field("color", KiwiRecord.builder()
 *           .field("r", 10).field("g", 20).field("b", 30)
 *           .build())                   // nested struct or message
 *       .field("tags", List.of("a", "b"))
 *       .build();
 * </pre>
 */
@SuppressWarnings("unused")
public final class KiwiRecordBuilder {
    private final LinkedHashMap<String, Value> fields = new LinkedHashMap<>();

    KiwiRecordBuilder() {}

    public KiwiRecordBuilder field(String name, boolean value) {
        return addField(name, Value.fromBoolean(value));
    }

    public KiwiRecordBuilder field(String name, int value) {
        return addField(name, Value.fromInt(value));
    }

    public KiwiRecordBuilder field(String name, long value) {
        return addField(name, Value.fromInt(value));
    }

    public KiwiRecordBuilder field(String name, float value) {
        return addField(name, Value.fromFloat(value));
    }

    public KiwiRecordBuilder field(String name, double value) {
        return addField(name, Value.fromFloat((float) value));
    }

    public KiwiRecordBuilder field(String name, String value) {
        return addField(name, Value.fromString(value));
    }

    public KiwiRecordBuilder field(String name, byte[] value) {
        return addField(name, Value.fromBytes(value));
    }

    public KiwiRecordBuilder field(String name, KiwiRecord value) {
        return addField(name, Value.fromRecord(value));
    }

    public KiwiRecordBuilder field(String name, List<?> values) {
        return addField(name, Value.fromObject(values));
    }

    public KiwiRecordBuilder field(String name, Map<String, ?> values) {
        return addField(name, Value.fromObject(values));
    }

    public KiwiRecordBuilder field(String name, Value value) {
        return addField(name, value == null ? Value.nullValue() : value);
    }

    /**
     * Mark a field as explicitly absent. Encoding skips it like a field that was never set.
     */
    public KiwiRecordBuilder nullField(String name) {
        return addField(name, Value.nullValue());
    }

    public KiwiRecordBuilder remove(String name) {
        fields.remove(name);
        return this;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public int fieldCount() {
        return fields.size();
    }

    public KiwiRecord build() {
        return new KiwiRecord(new LinkedHashMap<>(fields));
    }

    private KiwiRecordBuilder addField(String name, Value value) {
        if (name == null) {
            throw new IllegalArgumentException("Field name cannot be null");
        }
        fields.put(name, value);
        return this;
    }
}
