package com.kiwi;

import com.kiwi.container.CompressionKind;
import com.kiwi.container.ContainerParser;
import com.kiwi.container.ContainerStructure;
import com.kiwi.container.Decompressor;
import com.kiwi.container.ParsedContainer;
import com.kiwi.core.CompiledSchema;
import com.kiwi.error.KiwiException;
import com.kiwi.schema.BinarySchema;
import com.kiwi.schema.Schema;
import com.kiwi.schema.SchemaParser;
import com.kiwi.schema.SchemaPrinter;
import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Entry points for working with kiwi schemas, messages and containers.
 */
@UtilityClass
public class Kiwi {

    /**
     * Parse and verify schema text.
     *
     * @throws KiwiException {@code MALFORMED_SYNTAX} for text that doesn't parse, {@code SEMANTIC_ERROR} for a
     *                       schema that parses but is inconsistent
     */
    public static Schema parseSchema(String text) throws KiwiException {
        return SchemaParser.parse(text);
    }

    public static String prettyPrint(Schema schema) {
        return SchemaPrinter.print(schema);
    }

    public static byte[] encodeBinarySchema(Schema schema) throws KiwiException {
        return BinarySchema.encode(schema);
    }

    public static Schema decodeBinarySchema(byte[] bytes) throws KiwiException {
        return BinarySchema.decode(bytes);
    }

    public static CompiledSchema compile(Schema schema) throws KiwiException {
        return CompiledSchema.compile(schema);
    }

    public static CompiledSchema compile(String schemaText) throws KiwiException {
        return CompiledSchema.compile(schemaText);
    }

    public static ContainerStructure parseContainerStructure(byte[] bytes) throws KiwiException {
        return ContainerParser.parseStructure(bytes);
    }

    public static ParsedContainer parseContainer(byte[] bytes, Map<CompressionKind, Decompressor> decompressors)
            throws KiwiException {
        return ContainerParser.parse(bytes, decompressors);
    }
}
