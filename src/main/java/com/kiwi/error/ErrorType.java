package com.kiwi.error;

/**
 * Types of errors that can occur in kiwi operations.
 */
public enum ErrorType {
    BUFFER_UNDERFLOW,
    MALFORMED_VARINT,
    MALFORMED_SYNTAX,
    SEMANTIC_ERROR,
    UNKNOWN_TYPE,
    UNKNOWN_FIELD,
    NOT_FOUND,
    FIELD_NOT_FOUND,
    MISSING_REQUIRED_FIELD,
    INVALID_ENUM_VALUE,
    TYPE_MISMATCH,
    LIMIT_EXCEEDED,
    INVALID_STRING_CONTENT,
    INVALID_CONTAINER_FORMAT,
    UNSUPPORTED_COMPRESSION,
    DECOMPRESSION_FAILED
}
