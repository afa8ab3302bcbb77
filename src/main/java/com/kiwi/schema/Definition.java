package com.kiwi.schema;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An enum, struct or message definition with its fields in declaration order.
 */
@Value
public class Definition {
    String name;
    DefinitionKind kind;
    List<Field> fields;
    @EqualsAndHashCode.Exclude
    int line;
    @EqualsAndHashCode.Exclude
    int column;

    public Definition(String name, DefinitionKind kind, List<Field> fields, int line, int column) {
        this.name = Objects.requireNonNull(name, "Definition name cannot be null");
        this.kind = Objects.requireNonNull(kind, "Definition kind cannot be null");
        this.fields = List.copyOf(fields);
        this.line = line;
        this.column = column;
    }

    public Definition(String name, DefinitionKind kind, List<Field> fields) {
        this(name, kind, fields, 0, 0);
    }

    public Optional<Field> findField(String fieldName) {
        for (var field : fields) {
            if (field.getName().equals(fieldName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
