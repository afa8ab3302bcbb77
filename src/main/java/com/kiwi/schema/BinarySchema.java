package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.util.KiwiBuffer;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The binary form of a schema, written with the same primitives the schema itself describes.
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * [varuint definitionCount]
 *   per definition: [string name][byte kind][varuint fieldCount]
 *     per field:    [string name][varint typeCode][byte flags][varuint id]
 * </pre>
 *
 * <p>A negative type code is {@code ~index} into the {@link NativeType} table, a non-negative one indexes the
 * definitions array. Flag bit 0 marks arrays. Enum members carry a placeholder type code of 0. Package name
 * and deprecation are not part of the binary form.</p>
 */
public final class BinarySchema {

    private static final Logger log = LoggerFactory.getLogger(BinarySchema.class);

    private static final int FLAG_ARRAY = 1;

    private BinarySchema() {}

    public static byte[] encode(Schema schema) throws KiwiException {
        var buffer = KiwiBuffer.growable();
        encode(schema, buffer);
        return buffer.toByteArray();
    }

    public static void encode(Schema schema, KiwiBuffer buffer) throws KiwiException {
        var definitions = schema.getDefinitions();
        var definitionIndex = new Object2IntOpenHashMap<String>(definitions.size());
        definitionIndex.defaultReturnValue(-1);
        for (int i = 0; i < definitions.size(); i++) {
            definitionIndex.put(definitions.get(i).getName(), i);
        }

        buffer.putVarUint(definitions.size());
        for (var definition : definitions) {
            buffer.putString(definition.getName());
            buffer.putByte((byte) definition.getKind().getIndex());
            buffer.putVarUint(definition.getFields().size());

            for (var field : definition.getFields()) {
                buffer.putString(field.getName());
                buffer.putVarInt(typeCode(definition, field, definitionIndex));
                buffer.putByte((byte) (field.isArray() ? FLAG_ARRAY : 0));
                buffer.putVarUint(field.getId());
            }
        }
    }

    private static int typeCode(Definition definition, Field field, Object2IntOpenHashMap<String> definitionIndex)
            throws KiwiException {
        if (definition.getKind() == DefinitionKind.ENUM || field.getType() == null) {
            return 0;
        }
        var nativeType = NativeType.lookup(field.getType());
        if (nativeType.isPresent()) {
            return ~nativeType.get().getIndex();
        }
        int index = definitionIndex.getInt(field.getType());
        if (index < 0) {
            throw new KiwiException(ErrorType.UNKNOWN_TYPE, "The type \"" + field.getType()
                    + "\" is not defined for field \"" + field.getName() + "\" in \"" + definition.getName() + "\"");
        }
        return index;
    }

    public static Schema decode(byte[] bytes) throws KiwiException {
        return decode(new KiwiBuffer(bytes));
    }

    /**
     * Decode in two passes: read every definition with raw type codes, then bind the codes to names once the
     * whole definitions array is known, so fields may refer to their own or later definitions.
     */
    public static Schema decode(KiwiBuffer buffer) throws KiwiException {
        int definitionCount = buffer.getVarUint();
        var pending = new ArrayList<PendingDefinition>();

        for (int i = 0; i < definitionCount; i++) {
            String name = buffer.getString();
            int kindOffset = buffer.position();
            int kindIndex = buffer.getByte() & 0xFF;
            if (kindIndex >= DefinitionKind.values().length) {
                throw new KiwiException(ErrorType.UNKNOWN_TYPE,
                        "Unknown definition kind " + kindIndex + " for \"" + name + "\" at offset " + kindOffset);
            }
            var kind = DefinitionKind.fromIndex(kindIndex);
            int fieldCount = buffer.getVarUint();

            var fields = new ArrayList<PendingField>();
            for (int j = 0; j < fieldCount; j++) {
                String fieldName = buffer.getString();
                int typeCode = buffer.getVarInt();
                boolean isArray = (buffer.getByte() & FLAG_ARRAY) != 0;
                int id = buffer.getVarUint();
                fields.add(new PendingField(fieldName, typeCode, isArray, id));
            }
            pending.add(new PendingDefinition(name, kind, fields));
        }

        var definitions = new ArrayList<Definition>(pending.size());
        for (var definition : pending) {
            var fields = new ArrayList<Field>(definition.getFields().size());
            for (var field : definition.getFields()) {
                String type = definition.getKind() == DefinitionKind.ENUM
                        ? null
                        : resolveType(field.getTypeCode(), pending, definition, field);
                fields.add(new Field(field.getName(), type, field.isArray(), false, field.getId(), 0, 0));
            }
            definitions.add(new Definition(definition.getName(), definition.getKind(), fields));
        }

        log.debug("Decoded binary schema with {} definitions", definitions.size());
        return new Schema(null, definitions);
    }

    private static String resolveType(int typeCode, List<PendingDefinition> definitions,
                                      PendingDefinition owner, PendingField field) throws KiwiException {
        if (typeCode < 0) {
            int nativeIndex = ~typeCode;
            if (nativeIndex >= NativeType.values().length) {
                throw invalidType(typeCode, owner, field);
            }
            return NativeType.fromIndex(nativeIndex).getTypeName();
        }
        if (typeCode >= definitions.size()) {
            throw invalidType(typeCode, owner, field);
        }
        return definitions.get(typeCode).getName();
    }

    private static KiwiException invalidType(int typeCode, PendingDefinition owner, PendingField field) {
        return new KiwiException(ErrorType.UNKNOWN_TYPE,
                "Invalid type " + typeCode + " for field \"" + field.getName() + "\" in \"" + owner.getName() + "\"");
    }

    @Value
    private static class PendingDefinition {
        String name;
        DefinitionKind kind;
        List<PendingField> fields;
    }

    @Value
    private static class PendingField {
        String name;
        int typeCode;
        boolean array;
        int id;
    }
}
