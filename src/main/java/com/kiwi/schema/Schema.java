package com.kiwi.schema;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * An immutable kiwi schema: an optional package name and the ordered list of definitions.
 * <p>
 * Built once from text ({@link SchemaParser}) or from its binary form ({@link BinarySchema}) and never
 * modified afterwards. The package name is null when none was declared; binary schemas never carry one.
 */
@Value
public class Schema {
    String packageName;
    List<Definition> definitions;

    public Schema(String packageName, List<Definition> definitions) {
        this.packageName = packageName;
        this.definitions = List.copyOf(definitions);
    }

    public Optional<Definition> findDefinition(String name) {
        for (var definition : definitions) {
            if (definition.getName().equals(name)) {
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }
}
