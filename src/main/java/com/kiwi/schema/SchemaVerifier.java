package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.SchemaSyntaxException;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Semantic checks for a parsed schema: unique and non-reserved definition names, resolvable field types,
 * valid field ids, deprecation only on message fields, and no struct that contains itself by value.
 */
public final class SchemaVerifier {

    static final Set<String> RESERVED_NAMES = Set.of("ByteBuffer", "package");

    private static final byte UNVISITED = 0;
    private static final byte VISITING = 1;
    private static final byte DONE = 2;

    private SchemaVerifier() {}

    public static void verify(Schema schema) throws SchemaSyntaxException {
        var definitions = schema.getDefinitions();
        var indexByName = new Object2IntOpenHashMap<String>(definitions.size());
        indexByName.defaultReturnValue(-1);

        for (int i = 0; i < definitions.size(); i++) {
            var definition = definitions.get(i);
            if (NativeType.isNative(definition.getName()) || indexByName.containsKey(definition.getName())) {
                throw error("The type \"" + definition.getName() + "\" is defined twice",
                        definition.getLine(), definition.getColumn());
            }
            if (RESERVED_NAMES.contains(definition.getName())) {
                throw error("The type name \"" + definition.getName() + "\" is reserved",
                        definition.getLine(), definition.getColumn());
            }
            indexByName.put(definition.getName(), i);
        }

        for (var definition : definitions) {
            checkFields(definition, indexByName);
        }
        checkStructNesting(definitions, indexByName);
    }

    private static void checkFields(Definition definition, Object2IntMap<String> indexByName)
            throws SchemaSyntaxException {
        var fields = definition.getFields();

        for (var field : fields) {
            if (field.isDeprecated() && definition.getKind() != DefinitionKind.MESSAGE) {
                throw error("Cannot deprecate this field", field.getLine(), field.getColumn());
            }
        }

        if (definition.getKind() == DefinitionKind.ENUM || fields.isEmpty()) {
            return;
        }

        for (var field : fields) {
            var type = field.getType();
            if (type == null || !(NativeType.isNative(type) || indexByName.containsKey(type))) {
                throw error("The type \"" + type + "\" is not defined for field \"" + field.getName() + "\"",
                        field.getLine(), field.getColumn());
            }
        }

        IntSet ids = new IntOpenHashSet(fields.size());
        for (var field : fields) {
            if (!ids.add(field.getId())) {
                throw error("The id for field \"" + field.getName() + "\" is used twice",
                        field.getLine(), field.getColumn());
            }
            if (field.getId() <= 0) {
                throw error("The id for field \"" + field.getName() + "\" must be positive",
                        field.getLine(), field.getColumn());
            }
            if (field.getId() > fields.size()) {
                throw error("The id for field \"" + field.getName() + "\" cannot be larger than " + fields.size(),
                        field.getLine(), field.getColumn());
            }
        }
    }

    /**
     * Three-color depth-first search over non-array struct fields, driven by an explicit stack so that deeply
     * nested schemas cannot exhaust the call stack. Reaching a struct that is still being visited is a cycle.
     */
    private static void checkStructNesting(List<Definition> definitions, Object2IntMap<String> indexByName)
            throws SchemaSyntaxException {
        byte[] state = new byte[definitions.size()];
        Deque<int[]> stack = new ArrayDeque<>();

        for (int root = 0; root < definitions.size(); root++) {
            if (definitions.get(root).getKind() != DefinitionKind.STRUCT || state[root] != UNVISITED) {
                continue;
            }
            state[root] = VISITING;
            stack.push(new int[]{root, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                var fields = definitions.get(frame[0]).getFields();
                if (frame[1] == fields.size()) {
                    state[frame[0]] = DONE;
                    stack.pop();
                    continue;
                }

                var field = fields.get(frame[1]++);
                if (field.isArray()) {
                    continue;
                }
                int child = indexByName.getInt(field.getType());
                if (child < 0 || definitions.get(child).getKind() != DefinitionKind.STRUCT) {
                    continue;
                }
                if (state[child] == VISITING) {
                    var nested = definitions.get(child);
                    throw error("Recursive nesting of \"" + nested.getName() + "\" is not allowed",
                            nested.getLine(), nested.getColumn());
                }
                if (state[child] == UNVISITED) {
                    state[child] = VISITING;
                    stack.push(new int[]{child, 0});
                }
            }
        }
    }

    private static SchemaSyntaxException error(String message, int line, int column) {
        return new SchemaSyntaxException(ErrorType.SEMANTIC_ERROR, message, line, column);
    }
}
