package com.kiwi.schema;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import lombok.Getter;

import java.util.Locale;

/**
 * The three kinds of kiwi definitions, with the index each one has in the binary schema format.
 */
public enum DefinitionKind {
    ENUM(0),
    STRUCT(1),
    MESSAGE(2);

    @Getter
    private final int index;

    private static final DefinitionKind[] LOOKUP = values();

    DefinitionKind(int index) {
        this.index = index;
    }

    /**
     * Keyword introducing this kind in schema text.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DefinitionKind fromIndex(int index) throws KiwiException {
        if (index >= 0 && index < LOOKUP.length) {
            return LOOKUP[index];
        }
        throw new KiwiException(ErrorType.UNKNOWN_TYPE, "Unknown definition kind: " + index);
    }
}
