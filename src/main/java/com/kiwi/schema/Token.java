package com.kiwi.schema;

import lombok.Value;

/**
 * A lexical token of schema text with its 1-based source position.
 */
@Value
public class Token {

    public enum Kind {
        IDENTIFIER,
        INTEGER,
        PUNCTUATION,
        END_OF_FILE
    }

    Kind kind;
    String text;
    int line;
    int column;

    public boolean is(String expected) {
        return kind != Kind.END_OF_FILE && text.equals(expected);
    }
}
