package com.kiwi.types;

/**
 * Type codes for dynamic kiwi values.
 */
public enum TypeCode {
    NULL,
    BOOL,
    INT,
    FLOAT,
    STRING,
    BYTES,
    ARRAY,
    RECORD
}
