package com.kiwi.core;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.types.Value;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A dynamic struct or message instance: field names mapped to {@link Value}s.
 * <p>
 * Fields keep the order they were added or decoded in; equality ignores that order. Records are immutable
 * and are created with {@link #builder()} or by {@link CompiledSchema#decode}.
 */
@EqualsAndHashCode
public final class KiwiRecord {
    private static final KiwiRecord EMPTY = new KiwiRecord(new LinkedHashMap<>());

    private final Map<String, Value> fields;

    /**
     * Takes ownership of the map. Caller must not modify after construction.
     */
    KiwiRecord(LinkedHashMap<String, Value> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static KiwiRecordBuilder builder() {
        return new KiwiRecordBuilder();
    }

    public static KiwiRecord empty() {
        return EMPTY;
    }

    /**
     * Raw value of a field, or null when the record does not hold it.
     */
    public Value get(String name) {
        return fields.get(name);
    }

    /**
     * True if the record holds a non-null value for the field.
     */
    public boolean has(String name) {
        var value = fields.get(name);
        return value != null && !value.isNull();
    }

    public int size() {
        return fields.size();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Value> getFields() {
        return fields;
    }

    public boolean getBoolean(String name) throws KiwiException {
        return require(name).asBoolean();
    }

    public long getLong(String name) throws KiwiException {
        return require(name).asLong();
    }

    public int getInt(String name) throws KiwiException {
        return (int) require(name).asLong();
    }

    public float getFloat(String name) throws KiwiException {
        return require(name).asFloat();
    }

    public String getString(String name) throws KiwiException {
        return require(name).asString();
    }

    public byte[] getBytes(String name) throws KiwiException {
        return require(name).asBytes();
    }

    public List<Value> getArray(String name) throws KiwiException {
        return require(name).asList();
    }

    public KiwiRecord getRecord(String name) throws KiwiException {
        return require(name).asRecord();
    }

    private Value require(String name) throws KiwiException {
        var value = fields.get(name);
        if (value == null || value.isNull()) {
            throw new KiwiException(ErrorType.FIELD_NOT_FOUND, "Field \"" + name + "\" not found");
        }
        return value;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
