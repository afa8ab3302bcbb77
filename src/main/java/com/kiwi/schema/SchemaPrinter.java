package com.kiwi.schema;

/**
 * Renders a schema back into text that {@link SchemaParser} accepts.
 */
public final class SchemaPrinter {

    private SchemaPrinter() {}

    public static String print(Schema schema) {
        var text = new StringBuilder();
        var definitions = schema.getDefinitions();

        if (schema.getPackageName() != null) {
            text.append("package ").append(schema.getPackageName()).append(";\n");
        }

        for (int i = 0; i < definitions.size(); i++) {
            var definition = definitions.get(i);
            if (i > 0 || schema.getPackageName() != null) {
                text.append('\n');
            }
            text.append(definition.getKind().keyword()).append(' ').append(definition.getName()).append(" {\n");

            for (var field : definition.getFields()) {
                text.append("  ");
                if (definition.getKind() != DefinitionKind.ENUM) {
                    text.append(field.getType());
                    if (field.isArray()) {
                        text.append("[]");
                    }
                    text.append(' ');
                }
                text.append(field.getName());
                if (definition.getKind() != DefinitionKind.STRUCT) {
                    text.append(" = ").append(field.getId());
                }
                if (field.isDeprecated()) {
                    text.append(" [deprecated]");
                }
                text.append(";\n");
            }

            text.append("}\n");
        }

        return text.toString();
    }
}
