package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.SchemaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits schema text into identifiers, integers and punctuation, skipping whitespace and {@code //} comments.
 * The returned list always ends with an {@link Token.Kind#END_OF_FILE} token.
 */
final class SchemaTokenizer {
    static final String ARRAY = "[]";
    static final String DEPRECATED = "[deprecated]";

    private final String text;
    private int index;
    private int line = 1;
    private int column = 1;

    private SchemaTokenizer(String text) {
        this.text = text;
    }

    static List<Token> tokenize(String text) throws SchemaSyntaxException {
        return new SchemaTokenizer(text).run();
    }

    private List<Token> run() throws SchemaSyntaxException {
        var tokens = new ArrayList<Token>();

        while (index < text.length()) {
            char c = text.charAt(index);

            if (Character.isWhitespace(c)) {
                advance(1);
            } else if (text.startsWith("//", index)) {
                while (index < text.length() && text.charAt(index) != '\n') {
                    advance(1);
                }
            } else if (isIdentifierStart(c)) {
                tokens.add(take(Token.Kind.IDENTIFIER, scanWord()));
            } else if (isDigit(c) || (c == '-' && index + 1 < text.length() && isDigit(text.charAt(index + 1)))) {
                int end = index + 1;
                while (end < text.length() && isDigit(text.charAt(end))) {
                    end++;
                }
                if (end < text.length() && isIdentifierPart(text.charAt(end))) {
                    throw syntaxError(text.substring(index, scanEnd(end)));
                }
                tokens.add(take(Token.Kind.INTEGER, end - index));
            } else if (c == '{' || c == '}' || c == ';' || c == '=') {
                tokens.add(take(Token.Kind.PUNCTUATION, 1));
            } else if (text.startsWith(ARRAY, index)) {
                tokens.add(take(Token.Kind.PUNCTUATION, ARRAY.length()));
            } else if (text.startsWith(DEPRECATED, index)) {
                tokens.add(take(Token.Kind.PUNCTUATION, DEPRECATED.length()));
            } else {
                throw syntaxError(String.valueOf(c));
            }
        }

        tokens.add(new Token(Token.Kind.END_OF_FILE, "", line, column));
        return tokens;
    }

    private int scanWord() {
        return scanEnd(index + 1) - index;
    }

    private int scanEnd(int from) {
        int end = from;
        while (end < text.length() && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private Token take(Token.Kind kind, int length) {
        var token = new Token(kind, text.substring(index, index + length), line, column);
        advance(length);
        return token;
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            if (text.charAt(index) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            index++;
        }
    }

    private SchemaSyntaxException syntaxError(String part) {
        return new SchemaSyntaxException(ErrorType.MALFORMED_SYNTAX, "Syntax error \"" + part + "\"", line, column);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
