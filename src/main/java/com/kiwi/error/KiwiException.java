package com.kiwi.error;

import lombok.Getter;

/**
 * Exception thrown by kiwi operations.
 */
@Getter
public class KiwiException extends Exception {
    private final ErrorType errorType;

    public KiwiException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public KiwiException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("KiwiException{type=%s, message='%s'}", errorType, getMessage());
    }
}
