package com.kiwi.container;

import com.kiwi.core.CompiledSchema;
import com.kiwi.core.KiwiRecord;
import com.kiwi.error.KiwiException;
import com.kiwi.schema.Schema;
import com.kiwi.types.Value;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A fully decoded container: the embedded schema, the root message decoded with it and the raw preview.
 */
@Getter
@AllArgsConstructor
public final class ParsedContainer {
    private final ContainerHeader header;
    private final Schema schema;
    private final CompiledSchema compiledSchema;
    private final KiwiRecord message;
    @Getter(AccessLevel.NONE)
    private final Chunk preview;

    public Optional<Chunk> getPreview() {
        return Optional.ofNullable(preview);
    }

    /**
     * The {@code nodeChanges} records of the root message, empty when the field is absent.
     */
    public List<KiwiRecord> getNodeChanges() throws KiwiException {
        return recordList("nodeChanges");
    }

    /**
     * The {@code blobs} records of the root message, empty when the field is absent.
     */
    public List<KiwiRecord> getBlobs() throws KiwiException {
        return recordList("blobs");
    }

    private List<KiwiRecord> recordList(String fieldName) throws KiwiException {
        if (!message.has(fieldName)) {
            return List.of();
        }
        var records = new ArrayList<KiwiRecord>();
        for (Value element : message.getArray(fieldName)) {
            records.add(element.asRecord());
        }
        return List.copyOf(records);
    }
}
