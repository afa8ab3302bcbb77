package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.error.SchemaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for kiwi schema text.
 * <pre>
 *   package example;
 *
 *   enum Kind { A = 0; B = 1; }
 *   struct Color { byte r; byte g; byte b; }
 *   message Node { uint id = 1; Kind kind = 2; Color[] colors = 3; string label = 4 [deprecated]; }
 * </pre>
 * The parse tree is verified by {@link SchemaVerifier} only after it is complete, so definitions may refer
 * to types declared further down.
 */
public final class SchemaParser {

    private final List<Token> tokens;
    private int index;

    private SchemaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse and verify schema text.
     * @throws SchemaSyntaxException with {@link ErrorType#MALFORMED_SYNTAX} or {@link ErrorType#SEMANTIC_ERROR}
     */
    public static Schema parse(String text) throws KiwiException {
        var schema = parseUnverified(text);
        SchemaVerifier.verify(schema);
        return schema;
    }

    /**
     * Parse schema text without the semantic checks.
     */
    public static Schema parseUnverified(String text) throws SchemaSyntaxException {
        return new SchemaParser(SchemaTokenizer.tokenize(text)).parseSchema();
    }

    private Schema parseSchema() throws SchemaSyntaxException {
        String packageName = null;
        if (eat("package")) {
            packageName = expectIdentifier().getText();
            expect(";");
        }

        var definitions = new ArrayList<Definition>();
        while (current().getKind() != Token.Kind.END_OF_FILE) {
            definitions.add(parseDefinition());
        }
        return new Schema(packageName, definitions);
    }

    private Definition parseDefinition() throws SchemaSyntaxException {
        DefinitionKind kind;
        if (eat("enum")) {
            kind = DefinitionKind.ENUM;
        } else if (eat("struct")) {
            kind = DefinitionKind.STRUCT;
        } else if (eat("message")) {
            kind = DefinitionKind.MESSAGE;
        } else {
            throw unexpectedToken();
        }

        var name = expectIdentifier();
        expect("{");

        var fields = new ArrayList<Field>();
        int nextEnumValue = 0;
        while (!eat("}")) {
            String type = null;
            boolean isArray = false;

            if (kind != DefinitionKind.ENUM) {
                type = expectIdentifier().getText();
                isArray = eat(SchemaTokenizer.ARRAY);
            }

            var fieldName = expectIdentifier();

            int id;
            if (kind == DefinitionKind.STRUCT) {
                id = fields.size() + 1;
            } else if (kind == DefinitionKind.MESSAGE) {
                expect("=");
                id = expectInteger();
            } else {
                id = eat("=") ? expectInteger() : nextEnumValue;
                nextEnumValue = id + 1;
            }

            boolean isDeprecated = eat(SchemaTokenizer.DEPRECATED);
            expect(";");

            fields.add(new Field(fieldName.getText(), type, isArray, isDeprecated, id,
                    fieldName.getLine(), fieldName.getColumn()));
        }

        return new Definition(name.getText(), kind, fields, name.getLine(), name.getColumn());
    }

    private Token current() {
        return tokens.get(index);
    }

    private boolean eat(String text) {
        if (current().is(text)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(String text) throws SchemaSyntaxException {
        if (!eat(text)) {
            throw expected("\"" + text + "\"");
        }
    }

    private Token expectIdentifier() throws SchemaSyntaxException {
        var token = current();
        if (token.getKind() != Token.Kind.IDENTIFIER) {
            throw expected("identifier");
        }
        index++;
        return token;
    }

    private int expectInteger() throws SchemaSyntaxException {
        var token = current();
        if (token.getKind() != Token.Kind.INTEGER) {
            throw expected("integer");
        }
        index++;

        int value;
        try {
            value = Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw invalidInteger(token);
        }
        // Rejects leading zeros and "-0"
        if (!Integer.toString(value).equals(token.getText())) {
            throw invalidInteger(token);
        }
        return value;
    }

    private SchemaSyntaxException expected(String what) {
        var token = current();
        return new SchemaSyntaxException(ErrorType.MALFORMED_SYNTAX,
                "Expected " + what + " but found \"" + token.getText() + "\"", token.getLine(), token.getColumn());
    }

    private SchemaSyntaxException unexpectedToken() {
        var token = current();
        return new SchemaSyntaxException(ErrorType.MALFORMED_SYNTAX,
                "Unexpected token \"" + token.getText() + "\"", token.getLine(), token.getColumn());
    }

    private static SchemaSyntaxException invalidInteger(Token token) {
        return new SchemaSyntaxException(ErrorType.MALFORMED_SYNTAX,
                "Invalid integer \"" + token.getText() + "\"", token.getLine(), token.getColumn());
    }
}
