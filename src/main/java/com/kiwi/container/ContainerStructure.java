package com.kiwi.container;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * The framing of a container: header plus schema, data and optional preview chunks, none of them decoded.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ContainerStructure {
    private final ContainerHeader header;
    private final Chunk schemaChunk;
    private final Chunk dataChunk;
    @Getter(AccessLevel.NONE)
    private final Chunk previewChunk;

    public Optional<Chunk> getPreviewChunk() {
        return Optional.ofNullable(previewChunk);
    }
}
