package com.kiwi.error;

import lombok.Getter;

/**
 * Schema text diagnostic carrying the 1-based source location it refers to.
 */
@Getter
public class SchemaSyntaxException extends KiwiException {
    private final int line;
    private final int column;

    public SchemaSyntaxException(ErrorType errorType, String message, int line, int column) {
        super(errorType, message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }
}
