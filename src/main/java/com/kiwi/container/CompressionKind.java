package com.kiwi.container;

/**
 * Compression applied to a container chunk, guessed from the chunk's leading bytes.
 */
public enum CompressionKind {
    ZSTD,
    ZLIB,
    DEFLATE,
    UNKNOWN;

    private static final byte[] ZSTD_MAGIC = {0x28, (byte) 0xB5, 0x2F, (byte) 0xFD};
    private static final int ZLIB_HEADER = 0x78;

    /**
     * Sniff the compression of a chunk payload without decompressing it.
     * <p>
     * Schema chunks without a zstd or zlib signature are raw deflate, which has no magic of its own.
     */
    public static CompressionKind detect(byte[] data, boolean schemaChunk) {
        if (data.length < 4) {
            return UNKNOWN;
        }
        if (data[0] == ZSTD_MAGIC[0] && data[1] == ZSTD_MAGIC[1]
                && data[2] == ZSTD_MAGIC[2] && data[3] == ZSTD_MAGIC[3]) {
            return ZSTD;
        }
        if ((data[0] & 0xFF) == ZLIB_HEADER) {
            int level = data[1] & 0xFF;
            if (level == 0x01 || level == 0x9C || level == 0xDA) {
                return ZLIB;
            }
        }
        return schemaChunk ? DEFLATE : UNKNOWN;
    }
}
