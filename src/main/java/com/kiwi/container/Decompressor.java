package com.kiwi.container;

import java.io.IOException;

/**
 * Inflates one chunk payload. Supplied by the caller for each {@link CompressionKind} it can handle.
 */
@FunctionalInterface
public interface Decompressor {
    byte[] decompress(byte[] compressed) throws IOException;
}
