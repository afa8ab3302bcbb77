package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in kiwi types. The index is the position in the binary schema's native type table,
 * where a field's type code is {@code ~index}.
 */
public enum NativeType {
    BOOL("bool", 0),
    BYTE("byte", 1),
    INT("int", 2),
    UINT("uint", 3),
    FLOAT("float", 4),
    STRING("string", 5),
    INT64("int64", 6),
    UINT64("uint64", 7);

    @Getter
    private final String typeName;
    @Getter
    private final int index;

    private static final NativeType[] BY_INDEX = new NativeType[8];
    private static final Map<String, NativeType> BY_NAME = new HashMap<>();

    static {
        for (var type : values()) {
            BY_INDEX[type.index] = type;
            BY_NAME.put(type.typeName, type);
        }
    }

    NativeType(String typeName, int index) {
        this.typeName = typeName;
        this.index = index;
    }

    public static Optional<NativeType> lookup(String typeName) {
        return Optional.ofNullable(BY_NAME.get(typeName));
    }

    public static boolean isNative(String typeName) {
        return BY_NAME.containsKey(typeName);
    }

    public static NativeType fromIndex(int index) throws KiwiException {
        if (index >= 0 && index < BY_INDEX.length) {
            return BY_INDEX[index];
        }
        throw new KiwiException(ErrorType.UNKNOWN_TYPE, "Unknown native type index: " + index);
    }
}
