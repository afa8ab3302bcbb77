package com.kiwi.container;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One length-prefixed payload of a container, still in its stored (possibly compressed) form.
 */
@Getter
@EqualsAndHashCode
public final class Chunk {
    private final byte[] data;
    private final CompressionKind compression;

    public Chunk(byte[] data, CompressionKind compression) {
        this.data = data;
        this.compression = compression;
    }

    public int size() {
        return data.length;
    }

    public boolean isZstd() {
        return compression == CompressionKind.ZSTD;
    }

    public boolean isZlib() {
        return compression == CompressionKind.ZLIB;
    }

    public boolean isDeflate() {
        return compression == CompressionKind.DEFLATE;
    }

    public boolean isUnknown() {
        return compression == CompressionKind.UNKNOWN;
    }

    @Override
    public String toString() {
        return "Chunk{size=" + data.length + ", compression=" + compression + "}";
    }
}
