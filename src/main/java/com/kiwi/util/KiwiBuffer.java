package com.kiwi.util;

import com.kiwi.Constants;
import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cursor-based reader/writer over a byte array, carrying every primitive of the kiwi wire format.
 * <p>
 * A buffer is either read-only (wrapping existing bytes, reads fail past {@link #limit()}) or growable
 * (backing storage doubles as bytes are written). Decoded strings and byte arrays are always copies.
 */
@SuppressWarnings("UnusedReturnValue")
public final class KiwiBuffer {

    // Largest array size the JVM reliably allocates
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private byte[] array;
    private int position;
    private int limit;

    @Getter
    private final boolean growable;

    /**
     * Create buffer wrapping a byte array for reading.
     */
    public KiwiBuffer(byte[] array) {
        this(array, false);
    }

    private KiwiBuffer(byte[] array, boolean growable) {
        this.array = array;
        this.position = 0;
        this.limit = growable ? 0 : array.length;
        this.growable = growable;
    }

    /**
     * Create growable buffer with initial capacity.
     */
    public static KiwiBuffer growable(int initialCapacity) {
        return new KiwiBuffer(new byte[Math.max(initialCapacity, 1)], true);
    }

    /**
     * Create growable buffer with the default capacity.
     */
    public static KiwiBuffer growable() {
        return growable(Constants.DEFAULT_BUFFER_CAPACITY);
    }

    public int position() {
        return position;
    }

    public KiwiBuffer position(int newPosition) {
        if (newPosition < 0 || newPosition > limit) {
            throw new IllegalArgumentException("Invalid position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    /**
     * Logical end of the data: the read boundary, or the number of bytes written so far.
     */
    public int limit() {
        return limit;
    }

    public int remaining() {
        return limit - position;
    }

    public boolean hasRemaining() {
        return position < limit;
    }

    public int capacity() {
        return array.length;
    }

    /**
     * Rewind a written buffer so its contents can be read back.
     */
    public KiwiBuffer flip() {
        limit = position;
        position = 0;
        return this;
    }

    /**
     * Copy of the bytes between the start of the buffer and its logical end.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(array, limit);
    }

    private void ensureCapacity(int additionalBytes) {
        int required = position + additionalBytes;
        if (!growable) {
            if (required > limit) {
                throw new IllegalStateException("Buffer overflow at offset " + position);
            }
            return;
        }
        if (required < 0 || required > MAX_CAPACITY) {
            throw new IllegalStateException("Buffer cannot grow past " + MAX_CAPACITY + " bytes");
        }
        if (required > array.length) {
            array = Arrays.copyOf(array, Math.max(required, grownCapacity(array.length)));
        }
    }

    /**
     * Doubled capacity, clamped so the doubling never overflows.
     */
    static int grownCapacity(int current) {
        return current > MAX_CAPACITY / 2 ? MAX_CAPACITY : current << 1;
    }

    private void advanceWrite(int count) {
        position += count;
        if (growable && position > limit) {
            limit = position;
        }
    }

    private void requireReadable(int count) throws KiwiException {
        if (count < 0 || position + count > limit) {
            throw new KiwiException(ErrorType.BUFFER_UNDERFLOW,
                    "Unexpected end of data: need " + count + " bytes at offset " + position
                            + ", but only " + remaining() + " available");
        }
    }

    // ========== WRITES ==========

    public KiwiBuffer putByte(byte value) {
        ensureCapacity(1);
        array[position] = value;
        advanceWrite(1);
        return this;
    }

    public KiwiBuffer putBool(boolean value) {
        return putByte((byte) (value ? 1 : 0));
    }

    /**
     * Write int32 in little-endian format.
     */
    public KiwiBuffer putInt(int value) {
        ensureCapacity(4);
        array[position] = (byte) value;
        array[position + 1] = (byte) (value >>> 8);
        array[position + 2] = (byte) (value >>> 16);
        array[position + 3] = (byte) (value >>> 24);
        advanceWrite(4);
        return this;
    }

    public KiwiBuffer putBytes(byte[] src) {
        return putBytes(src, 0, src.length);
    }

    public KiwiBuffer putBytes(byte[] src, int srcOffset, int length) {
        if (srcOffset < 0 || length < 0 || srcOffset + length > src.length) {
            throw new IllegalArgumentException("Invalid src parameters");
        }
        ensureCapacity(length);
        System.arraycopy(src, srcOffset, array, position, length);
        advanceWrite(length);
        return this;
    }

    public KiwiBuffer putVarUint(int value) {
        VarInt.encode(value, this);
        return this;
    }

    public KiwiBuffer putVarInt(int value) {
        VarInt.encodeSigned(value, this);
        return this;
    }

    public KiwiBuffer putVarUint64(long value) {
        VarInt.encode64(value, this);
        return this;
    }

    public KiwiBuffer putVarInt64(long value) {
        VarInt.encodeSigned64(value, this);
        return this;
    }

    public KiwiBuffer putVarFloat(float value) {
        VarFloat.encode(value, this);
        return this;
    }

    /**
     * Write bytes with a varuint length prefix.
     */
    public KiwiBuffer putByteArray(byte[] value) {
        putVarUint(value.length);
        return putBytes(value);
    }

    /**
     * Write a NUL-terminated UTF-8 string.
     */
    public KiwiBuffer putString(String value) throws KiwiException {
        if (value.indexOf('\0') >= 0) {
            throw new KiwiException(ErrorType.INVALID_STRING_CONTENT,
                    "Cannot encode a string containing the null character");
        }
        putBytes(value.getBytes(StandardCharsets.UTF_8));
        return putByte((byte) 0);
    }

    // ========== READS ==========

    public byte getByte() throws KiwiException {
        requireReadable(1);
        return array[position++];
    }

    /**
     * Look at the next byte as an unsigned value without consuming it.
     */
    public int peekByte() throws KiwiException {
        requireReadable(1);
        return array[position] & 0xFF;
    }

    public boolean getBool() throws KiwiException {
        return getByte() != 0;
    }

    /**
     * Read int32 in little-endian format.
     */
    public int getInt() throws KiwiException {
        requireReadable(4);
        int value = (array[position] & 0xFF)
                | (array[position + 1] & 0xFF) << 8
                | (array[position + 2] & 0xFF) << 16
                | (array[position + 3] & 0xFF) << 24;
        position += 4;
        return value;
    }

    /**
     * Read {@code length} raw bytes into a new array.
     */
    public byte[] getBytes(int length) throws KiwiException {
        requireReadable(length);
        byte[] result = Arrays.copyOfRange(array, position, position + length);
        position += length;
        return result;
    }

    public KiwiBuffer skip(int length) throws KiwiException {
        requireReadable(length);
        position += length;
        return this;
    }

    public int getVarUint() throws KiwiException {
        return VarInt.decode(this);
    }

    public int getVarInt() throws KiwiException {
        return VarInt.decodeSigned(this);
    }

    public long getVarUint64() throws KiwiException {
        return VarInt.decode64(this);
    }

    public long getVarInt64() throws KiwiException {
        return VarInt.decodeSigned64(this);
    }

    public float getVarFloat() throws KiwiException {
        return VarFloat.decode(this);
    }

    public byte[] getByteArray() throws KiwiException {
        int length = getVarUint();
        if (length < 0) {
            throw new KiwiException(ErrorType.BUFFER_UNDERFLOW,
                    "Byte array length " + Integer.toUnsignedString(length) + " at offset " + position
                            + " exceeds the buffer");
        }
        return getBytes(length);
    }

    /**
     * Read a NUL-terminated UTF-8 string. Decoding stops at the first zero byte.
     */
    public String getString() throws KiwiException {
        int start = position;
        int end = start;
        while (end < limit && array[end] != 0) {
            end++;
        }
        if (end >= limit) {
            throw new KiwiException(ErrorType.BUFFER_UNDERFLOW,
                    "Unterminated string starting at offset " + start);
        }
        position = end + 1;
        return new String(array, start, end - start, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "KiwiBuffer{position=" + position + ", limit=" + limit + ", capacity=" + array.length + "}";
    }
}
