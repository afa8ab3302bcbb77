package com.kiwi.schema;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * A field of a definition.
 * <p>
 * For enum members {@code type} is null and {@code id} is the member's value. For struct fields {@code id} is
 * the 1-based declaration ordinal; for message fields it is the wire tag. Source positions are 0 when the
 * field did not come from schema text and take no part in equality.
 */
@Value
public class Field {
    String name;
    String type;
    boolean array;
    boolean deprecated;
    int id;
    @EqualsAndHashCode.Exclude
    int line;
    @EqualsAndHashCode.Exclude
    int column;

    public Field(String name, String type, boolean array, boolean deprecated, int id, int line, int column) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.type = type;
        this.array = array;
        this.deprecated = deprecated;
        this.id = id;
        this.line = line;
        this.column = column;
    }

    public static Field enumMember(String name, int value) {
        return new Field(name, null, false, false, value, 0, 0);
    }

    public static Field of(String name, String type, boolean array, int id) {
        return new Field(name, Objects.requireNonNull(type, "Field type cannot be null"), array, false, id, 0, 0);
    }

    public Optional<String> getTypeRef() {
        return Optional.ofNullable(type);
    }

    /**
     * True for the {@code byte[]} type, which is written as a length-prefixed blob instead of element by element.
     */
    public boolean isByteArray() {
        return array && NativeType.BYTE.getTypeName().equals(type);
    }
}
