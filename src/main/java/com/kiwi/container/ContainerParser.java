package com.kiwi.container;

import com.kiwi.Constants;
import com.kiwi.core.CompiledSchema;
import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import com.kiwi.schema.BinarySchema;
import com.kiwi.util.KiwiBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code fig-kiwi} container files: a magic prelude followed by length-prefixed chunks holding a binary
 * schema, a message encoded with that schema and an optional preview.
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * ["fig-kiwi" | "fig-kiwie" | "fig-jam."][padding to a multiple of 4]
 *   per chunk: [uint32 LE size][size bytes]
 * </pre>
 *
 * <p>Decompression is left to the caller through {@link Decompressor}s keyed by {@link CompressionKind}.</p>
 */
public final class ContainerParser {

    private static final Logger log = LoggerFactory.getLogger(ContainerParser.class);

    private static final int CONTAINER_VERSION = 0;

    private ContainerParser() {}

    /**
     * Frame the container into its chunks without decompressing or decoding anything.
     */
    public static ContainerStructure parseStructure(byte[] bytes) throws KiwiException {
        var buffer = new KiwiBuffer(bytes);
        var header = readHeader(buffer);

        int aligned = align(buffer.position());
        buffer.position(Math.min(aligned, buffer.limit()));

        var chunks = readChunks(buffer);
        if (chunks.size() < 2) {
            throw new KiwiException(ErrorType.INVALID_CONTAINER_FORMAT,
                    "Expected at least 2 chunks but found " + chunks.size());
        }

        var schemaChunk = new Chunk(chunks.get(0), CompressionKind.detect(chunks.get(0), true));
        var dataChunk = new Chunk(chunks.get(1), CompressionKind.detect(chunks.get(1), false));
        var previewChunk = chunks.size() > 2
                ? new Chunk(chunks.get(2), CompressionKind.detect(chunks.get(2), false))
                : null;

        log.debug("Framed {} container: schema chunk {} bytes ({}), data chunk {} bytes ({}), preview {}",
                header.getPrelude(), schemaChunk.size(), schemaChunk.getCompression(),
                dataChunk.size(), dataChunk.getCompression(),
                previewChunk == null ? "absent" : previewChunk.size() + " bytes");
        return new ContainerStructure(header, schemaChunk, dataChunk, previewChunk);
    }

    /**
     * Frame, decompress and decode a {@code fig-kiwi} container.
     * <p>
     * Chunks whose compression cannot be recognized are treated as already uncompressed.
     *
     * @param decompressors decompressor per compression kind; kinds the container needs must be present
     */
    public static ParsedContainer parse(byte[] bytes, Map<CompressionKind, Decompressor> decompressors)
            throws KiwiException {
        var structure = parseStructure(bytes);
        var header = structure.getHeader();
        if (!header.isFigKiwi()) {
            throw new KiwiException(ErrorType.INVALID_CONTAINER_FORMAT,
                    "Cannot decode a \"" + header.getPrelude() + "\" container");
        }

        byte[] schemaBytes = inflate("schema", structure.getSchemaChunk(), decompressors);
        byte[] messageBytes = inflate("data", structure.getDataChunk(), decompressors);

        var schema = BinarySchema.decode(schemaBytes);
        var compiled = CompiledSchema.compile(schema);
        var message = compiled.decode(Constants.ROOT_MESSAGE_TYPE, messageBytes);

        log.debug("Decoded container message with {} top-level fields", message.size());
        return new ParsedContainer(header, schema, compiled, message,
                structure.getPreviewChunk().orElse(null));
    }

    private static ContainerHeader readHeader(KiwiBuffer buffer) throws KiwiException {
        if (buffer.remaining() < Constants.PRELUDE_BYTES) {
            throw new KiwiException(ErrorType.INVALID_CONTAINER_FORMAT,
                    "Container too short for a prelude: " + buffer.remaining() + " bytes");
        }
        String prelude = new String(buffer.getBytes(Constants.PRELUDE_BYTES), StandardCharsets.ISO_8859_1);

        if (Constants.FIG_KIWI_MAGIC.equals(prelude)) {
            if (buffer.hasRemaining() && buffer.peekByte() == 'e') {
                buffer.skip(1);
                prelude = Constants.FIG_KIWIE_MAGIC;
            }
        } else if (!Constants.FIG_JAM_MAGIC.equals(prelude)) {
            throw new KiwiException(ErrorType.INVALID_CONTAINER_FORMAT,
                    "Invalid container prelude \"" + prelude + "\"");
        }
        return new ContainerHeader(prelude, CONTAINER_VERSION);
    }

    private static List<byte[]> readChunks(KiwiBuffer buffer) throws KiwiException {
        var chunks = new ArrayList<byte[]>(Constants.MAX_CHUNKS);
        while (chunks.size() < Constants.MAX_CHUNKS && buffer.remaining() >= 4) {
            int offset = buffer.position();
            int size = buffer.getInt();
            if (size <= 0 || size > buffer.remaining()) {
                log.debug("Stopping at chunk {}: size {} at offset {} with {} bytes left",
                        chunks.size(), Integer.toUnsignedString(size), offset, buffer.remaining());
                break;
            }
            chunks.add(buffer.getBytes(size));
        }
        return chunks;
    }

    private static byte[] inflate(String chunkName, Chunk chunk, Map<CompressionKind, Decompressor> decompressors)
            throws KiwiException {
        var kind = chunk.getCompression();
        if (kind == CompressionKind.UNKNOWN) {
            return chunk.getData();
        }
        var decompressor = decompressors.get(kind);
        if (decompressor == null) {
            throw new KiwiException(ErrorType.UNSUPPORTED_COMPRESSION,
                    "No decompressor for " + kind + " " + chunkName + " chunk");
        }
        byte[] inflated;
        try {
            inflated = decompressor.decompress(chunk.getData());
        } catch (IOException | RuntimeException e) {
            throw new KiwiException(ErrorType.DECOMPRESSION_FAILED,
                    "Failed to decompress " + kind + " " + chunkName + " chunk: " + e.getMessage(), e);
        }
        if (inflated == null) {
            throw new KiwiException(ErrorType.DECOMPRESSION_FAILED,
                    "Decompressor for " + kind + " " + chunkName + " chunk returned no data");
        }
        log.debug("Inflated {} chunk from {} to {} bytes ({})", chunkName, chunk.size(), inflated.length, kind);
        return inflated;
    }

    private static int align(int offset) {
        int mask = Constants.CHUNK_ALIGNMENT - 1;
        return (offset + mask) & ~mask;
    }
}
