package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.error.SchemaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class SchemaParserTest {

    private static final String SAMPLE = String.join("\n",
            "package test;",
            "",
            "// shapes",
            "enum Kind { CIRCLE = 0; SQUARE = 1; }",
            "struct Color { byte r; byte g; byte b; }",
            "message Shape {",
            "  uint id = 1;",
            "  Kind kind = 2;",
            "  Color[] colors = 3;",
            "  string label = 4 [deprecated];",
            "  byte[] payload = 5;",
            "}");

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("definitions, fields and flags are read in order")
        void parsesDefinitions() throws KiwiException {
            var schema = SchemaParser.parse(SAMPLE);

            assertThat(schema.getPackageName()).isEqualTo("test");
            assertThat(schema.getDefinitions()).extracting(Definition::getName)
                    .containsExactly("Kind", "Color", "Shape");
            assertThat(schema.getDefinitions()).extracting(Definition::getKind)
                    .containsExactly(DefinitionKind.ENUM, DefinitionKind.STRUCT, DefinitionKind.MESSAGE);

            var shape = schema.findDefinition("Shape").orElseThrow();
            assertThat(shape.getFields()).extracting(Field::getName)
                    .containsExactly("id", "kind", "colors", "label", "payload");
            assertThat(shape.findField("colors").orElseThrow().isArray()).isTrue();
            assertThat(shape.findField("label").orElseThrow().isDeprecated()).isTrue();
            assertThat(shape.findField("payload").orElseThrow().isByteArray()).isTrue();
            assertThat(shape.findField("kind").orElseThrow().getId()).isEqualTo(2);
        }

        @Test
        @DisplayName("struct field ids are declaration ordinals")
        void structIdsAreOrdinals() throws KiwiException {
            var color = SchemaParser.parse(SAMPLE).findDefinition("Color").orElseThrow();

            assertThat(color.getFields()).extracting(Field::getId).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("enum members carry their values and no type")
        void enumMembers() throws KiwiException {
            var kind = SchemaParser.parse("enum E { A = 100; B = 200; }").findDefinition("E").orElseThrow();

            assertThat(kind.getFields()).containsExactly(Field.enumMember("A", 100), Field.enumMember("B", 200));
            assertThat(kind.getFields().get(0).getTypeRef()).isEmpty();
        }

        @Test
        @DisplayName("enum members without a value follow the previous one")
        void enumValuesAutoIncrement() throws KiwiException {
            var kind = SchemaParser.parse("enum E { A; B; C = 10; D; }").findDefinition("E").orElseThrow();

            assertThat(kind.getFields()).extracting(Field::getId).containsExactly(0, 1, 10, 11);
        }

        @Test
        @DisplayName("source positions are 1-based")
        void recordsPositions() throws KiwiException {
            var schema = SchemaParser.parse("message M {\n  int a = 1;\n}");
            var definition = schema.getDefinitions().get(0);
            var field = definition.getFields().get(0);

            assertThat(definition.getLine()).isEqualTo(1);
            assertThat(definition.getColumn()).isEqualTo(9);
            assertThat(field.getLine()).isEqualTo(2);
            assertThat(field.getColumn()).isEqualTo(7);
        }

        @Test
        @DisplayName("definitions may refer to types declared later")
        void forwardReferences() throws KiwiException {
            var schema = SchemaParser.parse("message A { B b = 1; } struct B { int x; }");

            assertThat(schema.getDefinitions()).hasSize(2);
        }

        @Test
        @DisplayName("an empty schema has no definitions")
        void emptySchema() throws KiwiException {
            var schema = SchemaParser.parse("  // nothing here\n");

            assertThat(schema.getPackageName()).isNull();
            assertThat(schema.getDefinitions()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("unknown characters are reported with their position")
        void unknownCharacter() {
            assertThatThrownBy(() -> SchemaParser.parse("message M {\n  int a = 1 @\n}"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessage("Syntax error \"@\" at line 2, column 13")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_SYNTAX);
        }

        @Test
        @DisplayName("a missing semicolon names the token found instead")
        void missingSemicolon() {
            assertThatThrownBy(() -> SchemaParser.parse("struct A {\n  int x\n}"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessage("Expected \";\" but found \"}\" at line 3, column 1");
        }

        @Test
        @DisplayName("a definition must start with a keyword")
        void unexpectedKeyword() {
            assertThatThrownBy(() -> SchemaParser.parse("union U { }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .extracting("line", "column")
                    .containsExactly(1, 1);
        }

        @Test
        @DisplayName("message fields need an explicit id")
        void messageFieldWithoutId() {
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("Expected \"=\"");
        }

        @ParameterizedTest
        @ValueSource(strings = {"01", "-0", "99999999999"})
        @DisplayName("non-canonical or out of range integers are rejected")
        void invalidIntegers(String id) {
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a = " + id + "; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("Invalid integer")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_SYNTAX);
        }

        @Test
        @DisplayName("an integer running into an identifier is one bad token")
        void integerFollowedByLetters() {
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a = 1abc; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageStartingWith("Syntax error \"1abc\"");
        }

        @Test
        @DisplayName("an unterminated definition reports end of input")
        void unterminatedDefinition() {
            assertThatThrownBy(() -> SchemaParser.parse("struct A { int x;"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("found \"\"");
        }
    }

    @Nested
    @DisplayName("Verification")
    class Verification {

        @Test
        @DisplayName("a struct containing itself is rejected")
        void directRecursion() {
            assertThatThrownBy(() -> SchemaParser.parse("struct A { A a; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageStartingWith("Recursive nesting of \"A\" is not allowed")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.SEMANTIC_ERROR);
        }

        @Test
        @DisplayName("indirect struct recursion is rejected")
        void indirectRecursion() {
            assertThatThrownBy(() -> SchemaParser.parse("struct A { B b; } struct B { C c; } struct C { A a; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("Recursive nesting")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.SEMANTIC_ERROR);
        }

        @Test
        @DisplayName("arrays break struct cycles and messages may nest themselves")
        void allowedRecursion() throws KiwiException {
            assertThat(SchemaParser.parse("struct A { A[] a; }").getDefinitions()).hasSize(1);
            assertThat(SchemaParser.parse("message M { M m = 1; }").getDefinitions()).hasSize(1);
            assertThat(SchemaParser.parse("struct A { B b; B c; } struct B { int x; }").getDefinitions()).hasSize(2);
        }

        @Test
        @DisplayName("duplicate definitions are rejected")
        void duplicateDefinition() {
            assertThatThrownBy(() -> SchemaParser.parse("struct A { int x; }\nmessage A { int x = 1; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessage("The type \"A\" is defined twice at line 2, column 9");
        }

        @ParameterizedTest
        @ValueSource(strings = {"int", "string", "uint64"})
        @DisplayName("native type names cannot be redefined")
        void nativeNameClash(String name) {
            assertThatThrownBy(() -> SchemaParser.parse("struct " + name + " { int x; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("is defined twice");
        }

        @Test
        @DisplayName("reserved names cannot be used")
        void reservedName() {
            assertThatThrownBy(() -> SchemaParser.parse("struct ByteBuffer { int x; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("The type name \"ByteBuffer\" is reserved");
        }

        @Test
        @DisplayName("unresolved field types are rejected")
        void unknownFieldType() {
            assertThatThrownBy(() -> SchemaParser.parse("message M { Missing m = 1; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageContaining("The type \"Missing\" is not defined for field \"m\"")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.SEMANTIC_ERROR);
        }

        @Test
        @DisplayName("message ids must be unique, positive and at most the field count")
        void invalidIds() {
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a = 1; int b = 1; }"))
                    .hasMessageContaining("is used twice");
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a = 0; }"))
                    .hasMessageContaining("must be positive");
            assertThatThrownBy(() -> SchemaParser.parse("message M { int a = 1; int b = 3; }"))
                    .hasMessageContaining("cannot be larger than 2");
        }

        @Test
        @DisplayName("only message fields can be deprecated")
        void deprecationPlacement() {
            assertThatThrownBy(() -> SchemaParser.parse("struct S { int a [deprecated]; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageStartingWith("Cannot deprecate this field")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.SEMANTIC_ERROR);
            assertThatThrownBy(() -> SchemaParser.parse("enum E { A = 1 [deprecated]; }"))
                    .isInstanceOf(SchemaSyntaxException.class)
                    .hasMessageStartingWith("Cannot deprecate this field");
        }

        @Test
        @DisplayName("parseUnverified skips the semantic checks")
        void unverifiedParse() throws KiwiException {
            var schema = SchemaParser.parseUnverified("struct A { A a; }");

            assertThat(schema.getDefinitions()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Printing")
    class Printing {

        @Test
        @DisplayName("printed text parses back to an equal schema")
        void printRoundtrip() throws KiwiException {
            var schema = SchemaParser.parse(SAMPLE);
            var reparsed = SchemaParser.parse(SchemaPrinter.print(schema));

            assertThat(reparsed).isEqualTo(schema);
        }

        @Test
        @DisplayName("printer layout")
        void printLayout() throws KiwiException {
            var schema = SchemaParser.parse(
                    "package p; enum E { A = 1; } struct S { int[] xs; } message M { E e = 1 [deprecated]; }");

            assertThat(SchemaPrinter.print(schema)).isEqualTo(String.join("\n",
                    "package p;",
                    "",
                    "enum E {",
                    "  A = 1;",
                    "}",
                    "",
                    "struct S {",
                    "  int[] xs;",
                    "}",
                    "",
                    "message M {",
                    "  E e = 1 [deprecated];",
                    "}",
                    ""));
        }
    }
}
