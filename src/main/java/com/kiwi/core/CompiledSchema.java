package com.kiwi.core;

import com.kiwi.Constants;
import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.schema.Definition;
import com.kiwi.schema.DefinitionKind;
import com.kiwi.schema.Field;
import com.kiwi.schema.NativeType;
import com.kiwi.schema.Schema;
import com.kiwi.schema.SchemaParser;
import com.kiwi.types.TypeHandler;
import com.kiwi.types.Value;
import com.kiwi.util.KiwiBuffer;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A schema prepared for encoding and decoding records.
 * <p>
 * Compilation resolves every field type once and builds the id and enum lookup tables, so a compiled schema
 * can be reused for any number of messages. Instances are immutable and may be shared between threads.
 *
 * <pre>
 *   var compiled = CompiledSchema.compile("message Point { int x = 1; int y = 2; }");
 *   byte[] bytes = compiled.encode("Point", KiwiRecord.builder().field("x", 3).build());
 *   KiwiRecord point = compiled.decode("Point", bytes);
 * </pre>
 */
public final class CompiledSchema {

    private static final Logger log = LoggerFactory.getLogger(CompiledSchema.class);

    @Getter
    private final Schema schema;
    private final Map<String, Definition> definitions;
    private final Map<String, Int2ObjectMap<Field>> messageFields;
    private final Map<String, Object2IntMap<String>> enumValues;
    private final Map<String, Int2ObjectMap<String>> enumNames;
    // structs whose encoding can be empty
    private final Set<String> zeroWidthStructs;

    private CompiledSchema(Schema schema,
                           Map<String, Definition> definitions,
                           Map<String, Int2ObjectMap<Field>> messageFields,
                           Map<String, Object2IntMap<String>> enumValues,
                           Map<String, Int2ObjectMap<String>> enumNames,
                           Set<String> zeroWidthStructs) {
        this.schema = schema;
        this.definitions = definitions;
        this.messageFields = messageFields;
        this.enumValues = enumValues;
        this.enumNames = enumNames;
        this.zeroWidthStructs = zeroWidthStructs;
    }

    /**
     * Parse, verify and compile schema text.
     */
    public static CompiledSchema compile(String schemaText) throws KiwiException {
        return compile(SchemaParser.parse(schemaText));
    }

    public static CompiledSchema compile(Schema schema) throws KiwiException {
        var definitions = new LinkedHashMap<String, Definition>();
        for (var definition : schema.getDefinitions()) {
            definitions.put(definition.getName(), definition);
        }

        var messageFields = new HashMap<String, Int2ObjectMap<Field>>();
        var enumValues = new HashMap<String, Object2IntMap<String>>();
        var enumNames = new HashMap<String, Int2ObjectMap<String>>();

        for (var definition : schema.getDefinitions()) {
            switch (definition.getKind()) {
                case ENUM: {
                    var values = new Object2IntOpenHashMap<String>(definition.getFields().size());
                    var names = new Int2ObjectOpenHashMap<String>(definition.getFields().size());
                    for (var member : definition.getFields()) {
                        values.put(member.getName(), member.getId());
                        names.put(member.getId(), member.getName());
                    }
                    enumValues.put(definition.getName(), Object2IntMaps.unmodifiable(values));
                    enumNames.put(definition.getName(), Int2ObjectMaps.unmodifiable(names));
                    break;
                }
                case MESSAGE: {
                    var byId = new Int2ObjectOpenHashMap<Field>(definition.getFields().size());
                    for (var field : definition.getFields()) {
                        checkResolvable(definition, field, definitions);
                        byId.put(field.getId(), field);
                    }
                    messageFields.put(definition.getName(), Int2ObjectMaps.unmodifiable(byId));
                    break;
                }
                case STRUCT:
                    for (var field : definition.getFields()) {
                        checkResolvable(definition, field, definitions);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled definition kind: " + definition.getKind());
            }
        }

        log.debug("Compiled schema with {} definitions ({} enums, {} messages)",
                definitions.size(), enumValues.size(), messageFields.size());
        return new CompiledSchema(schema, Map.copyOf(definitions), Map.copyOf(messageFields),
                Map.copyOf(enumValues), Map.copyOf(enumNames), zeroWidthStructs(schema));
    }

    /**
     * Structs made only of non-array fields of other zero-width structs, the empty struct included.
     * Grown to a fixed point, so self-containing structs stay out.
     */
    private static Set<String> zeroWidthStructs(Schema schema) {
        var result = new HashSet<String>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var definition : schema.getDefinitions()) {
                if (definition.getKind() != DefinitionKind.STRUCT || result.contains(definition.getName())) {
                    continue;
                }
                boolean empty = definition.getFields().stream()
                        .allMatch(field -> !field.isArray() && result.contains(field.getType()));
                if (empty) {
                    result.add(definition.getName());
                    changed = true;
                }
            }
        }
        return Set.copyOf(result);
    }

    private static void checkResolvable(Definition owner, Field field, Map<String, Definition> definitions)
            throws KiwiException {
        String type = field.getType();
        if (type == null || (!NativeType.isNative(type) && !definitions.containsKey(type))) {
            throw new KiwiException(ErrorType.UNKNOWN_TYPE, "The type \"" + type
                    + "\" is not defined for field \"" + field.getName() + "\" in \"" + owner.getName() + "\"");
        }
    }

    public Optional<Definition> getDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * Member name to value table of an enum, or empty when no enum has that name.
     */
    public Optional<Object2IntMap<String>> getEnumValues(String enumName) {
        return Optional.ofNullable(enumValues.get(enumName));
    }

    /**
     * Value to member name table of an enum, or empty when no enum has that name.
     */
    public Optional<Int2ObjectMap<String>> getEnumNames(String enumName) {
        return Optional.ofNullable(enumNames.get(enumName));
    }

    // ========== ENCODING ==========

    public byte[] encode(String typeName, KiwiRecord record) throws KiwiException {
        var buffer = KiwiBuffer.growable();
        encode(typeName, record, buffer);
        return buffer.toByteArray();
    }

    /**
     * Append the encoding of {@code record} as {@code typeName} at the buffer's position.
     */
    public void encode(String typeName, KiwiRecord record, KiwiBuffer buffer) throws KiwiException {
        var definition = requireDefinition(typeName);
        if (definition.getKind() == DefinitionKind.ENUM) {
            throw new KiwiException(ErrorType.TYPE_MISMATCH,
                    "Cannot encode enum \"" + typeName + "\" as a top-level value");
        }
        encodeRecord(definition, record, buffer, 0);
    }

    private void encodeRecord(Definition definition, KiwiRecord record, KiwiBuffer buffer, int depth)
            throws KiwiException {
        checkDepth(definition, depth);
        boolean message = definition.getKind() == DefinitionKind.MESSAGE;
        for (var field : definition.getFields()) {
            var value = record.get(field.getName());
            boolean present = value != null && !value.isNull();

            if (message) {
                if (!present) {
                    continue;
                }
                buffer.putVarUint(field.getId());
            } else if (!present) {
                throw new KiwiException(ErrorType.MISSING_REQUIRED_FIELD,
                        "Missing required field \"" + field.getName() + "\" of \"" + definition.getName() + "\"");
            }

            try {
                encodeField(field, value, buffer, depth);
            } catch (KiwiException e) {
                if (e.getErrorType() != ErrorType.TYPE_MISMATCH) {
                    throw e;
                }
                throw new KiwiException(ErrorType.TYPE_MISMATCH,
                        "Field \"" + field.getName() + "\" of \"" + definition.getName() + "\": " + e.getMessage(), e);
            }
        }
        if (message) {
            buffer.putVarUint(0);
        }
    }

    private void encodeField(Field field, Value value, KiwiBuffer buffer, int depth) throws KiwiException {
        if (!field.isArray()) {
            encodeValue(field.getType(), value, buffer, depth);
            return;
        }
        if (field.isByteArray()) {
            buffer.putByteArray(value.asBytes());
            return;
        }
        var elements = value.asList();
        buffer.putVarUint(elements.size());
        for (var element : elements) {
            encodeValue(field.getType(), element, buffer, depth);
        }
    }

    private void encodeValue(String type, Value value, KiwiBuffer buffer, int depth) throws KiwiException {
        var nativeType = NativeType.lookup(type);
        if (nativeType.isPresent()) {
            TypeHandler.forNative(nativeType.get()).encode(value, buffer);
            return;
        }

        var definition = requireDefinition(type);
        if (definition.getKind() == DefinitionKind.ENUM) {
            String name = value.asString();
            var values = enumValues.get(type);
            if (!values.containsKey(name)) {
                throw new KiwiException(ErrorType.INVALID_ENUM_VALUE,
                        "Invalid value \"" + name + "\" for enum \"" + type + "\"");
            }
            buffer.putVarUint(values.getInt(name));
        } else {
            encodeRecord(definition, value.asRecord(), buffer, depth + 1);
        }
    }

    // ========== DECODING ==========

    public KiwiRecord decode(String typeName, byte[] bytes) throws KiwiException {
        return decode(typeName, new KiwiBuffer(bytes));
    }

    /**
     * Decode one {@code typeName} starting at the buffer's current position, leaving the position just past it.
     */
    public KiwiRecord decode(String typeName, KiwiBuffer buffer) throws KiwiException {
        var definition = requireDefinition(typeName);
        if (definition.getKind() == DefinitionKind.ENUM) {
            throw new KiwiException(ErrorType.TYPE_MISMATCH,
                    "Cannot decode enum \"" + typeName + "\" as a top-level value");
        }
        return decodeRecord(definition, buffer, 0);
    }

    private KiwiRecord decodeRecord(Definition definition, KiwiBuffer buffer, int depth) throws KiwiException {
        checkDepth(definition, depth);
        var fields = new LinkedHashMap<String, Value>();

        if (definition.getKind() == DefinitionKind.STRUCT) {
            for (var field : definition.getFields()) {
                fields.put(field.getName(), decodeField(field, buffer, depth));
            }
            return new KiwiRecord(fields);
        }

        var byId = messageFields.get(definition.getName());
        while (true) {
            int offset = buffer.position();
            int id = buffer.getVarUint();
            if (id == 0) {
                return new KiwiRecord(fields);
            }
            var field = byId.get(id);
            if (field == null) {
                throw new KiwiException(ErrorType.UNKNOWN_FIELD, "Attempted to parse invalid field "
                        + Integer.toUnsignedString(id) + " for type \"" + definition.getName()
                        + "\" at offset " + offset);
            }
            var value = decodeField(field, buffer, depth);
            if (!field.isDeprecated()) {
                fields.put(field.getName(), value);
            }
        }
    }

    private Value decodeField(Field field, KiwiBuffer buffer, int depth) throws KiwiException {
        if (!field.isArray()) {
            return decodeValue(field.getType(), buffer, depth);
        }
        if (field.isByteArray()) {
            return Value.fromBytes(buffer.getByteArray());
        }
        int count = buffer.getVarUint();
        if (zeroWidthStructs.contains(field.getType())) {
            // elements take no bytes, so only a fixed cap bounds the count
            if (count < 0 || count > Constants.MAX_ZERO_WIDTH_ARRAY_LENGTH) {
                throw new KiwiException(ErrorType.LIMIT_EXCEEDED, "Array of " + Integer.toUnsignedString(count)
                        + " elements for field \"" + field.getName() + "\" exceeds the limit of "
                        + Constants.MAX_ZERO_WIDTH_ARRAY_LENGTH);
            }
        } else if (count < 0 || count > buffer.remaining()) {
            throw new KiwiException(ErrorType.BUFFER_UNDERFLOW, "Array of " + Integer.toUnsignedString(count)
                    + " elements for field \"" + field.getName() + "\" exceeds the buffer at offset "
                    + buffer.position());
        }
        var elements = new ArrayList<Value>(Math.min(count, buffer.remaining()));
        for (int i = 0; i < count; i++) {
            elements.add(decodeValue(field.getType(), buffer, depth));
        }
        return Value.fromArray(elements);
    }

    private Value decodeValue(String type, KiwiBuffer buffer, int depth) throws KiwiException {
        var nativeType = NativeType.lookup(type);
        if (nativeType.isPresent()) {
            return TypeHandler.forNative(nativeType.get()).decode(buffer);
        }

        var definition = requireDefinition(type);
        if (definition.getKind() == DefinitionKind.ENUM) {
            int offset = buffer.position();
            int ordinal = buffer.getVarUint();
            String name = enumNames.get(type).get(ordinal);
            if (name == null) {
                throw new KiwiException(ErrorType.INVALID_ENUM_VALUE, "Invalid value "
                        + Integer.toUnsignedString(ordinal) + " for enum \"" + type + "\" at offset " + offset);
            }
            return Value.fromString(name);
        }
        return Value.fromRecord(decodeRecord(definition, buffer, depth + 1));
    }

    private static void checkDepth(Definition definition, int depth) throws KiwiException {
        if (depth > Constants.MAX_NESTING_DEPTH) {
            throw new KiwiException(ErrorType.LIMIT_EXCEEDED, "Nesting of \"" + definition.getName()
                    + "\" exceeds the maximum depth of " + Constants.MAX_NESTING_DEPTH);
        }
    }

    private Definition requireDefinition(String typeName) throws KiwiException {
        var definition = definitions.get(typeName);
        if (definition == null) {
            throw new KiwiException(ErrorType.NOT_FOUND, "No definition named \"" + typeName + "\"");
        }
        return definition;
    }

    @Override
    public String toString() {
        return "CompiledSchema{definitions=" + definitions.keySet() + "}";
    }
}
