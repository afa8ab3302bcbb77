package com.kiwi.util;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;

/**
 * Utility class for encoding and decoding variable-length integers (VarInt).
 * Supports 32-bit unsigned values, their zigzag-signed form, and the 64-bit analogues
 * used by the {@code int64}/{@code uint64} types.
 */
public final class VarInt {

    private static final int CONTINUATION_BIT = 0x80;
    private static final int SEGMENT_BITS = 0x7f;
    private static final int MAX_VARINT_LEN = 5; // Enough for u32
    private static final int MAX_VARINT64_LEN = 10;

    private VarInt() {} // utility class

    /**
     * Encode a 32-bit unsigned integer as a VarInt into the given buffer.
     * @param value the value to encode (treated as unsigned)
     * @param buffer the buffer to write to
     */
    public static void encode(int value, KiwiBuffer buffer) {
        long val = Integer.toUnsignedLong(value);

        do {
            byte b = (byte) (val & SEGMENT_BITS);
            val >>>= 7;
            if (val != 0) {
                b |= (byte) CONTINUATION_BIT;
            }
            buffer.putByte(b);
        } while (val != 0);
    }

    /**
     * Decode a VarInt from a buffer.
     * <p>
     * At most five bytes are consumed; payload bits past the 32nd are dropped, so values wrap at 2^32.
     * @param buffer the buffer to decode from
     * @return the decoded value, as an unsigned 32-bit pattern
     * @throws KiwiException if the buffer ends before the VarInt does
     */
    public static int decode(KiwiBuffer buffer) throws KiwiException {
        int result = 0;
        int shift = 0;
        int bytesRead = 0;
        int b;

        do {
            b = buffer.getByte() & 0xFF;
            bytesRead++;
            result |= (b & SEGMENT_BITS) << shift;
            shift += 7;
        } while ((b & CONTINUATION_BIT) != 0 && bytesRead < MAX_VARINT_LEN);

        return result;
    }

    public static void encodeSigned(int value, KiwiBuffer buffer) {
        encode(zigzagEncode(value), buffer);
    }

    public static int decodeSigned(KiwiBuffer buffer) throws KiwiException {
        return zigzagDecode(decode(buffer));
    }

    public static void encode64(long value, KiwiBuffer buffer) {
        long val = value;
        do {
            byte b = (byte) (val & SEGMENT_BITS);
            val >>>= 7;
            if (val != 0) {
                b |= (byte) CONTINUATION_BIT;
            }
            buffer.putByte(b);
        } while (val != 0);
    }

    public static long decode64(KiwiBuffer buffer) throws KiwiException {
        long result = 0;
        int shift = 0;
        int start = buffer.position();

        for (int bytesRead = 0; bytesRead < MAX_VARINT64_LEN; bytesRead++) {
            int b = buffer.getByte() & 0xFF;
            result |= (long) (b & SEGMENT_BITS) << shift;
            if ((b & CONTINUATION_BIT) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new KiwiException(ErrorType.MALFORMED_VARINT, "VarInt64 too long at offset " + start);
    }

    public static void encodeSigned64(long value, KiwiBuffer buffer) {
        encode64(zigzagEncode64(value), buffer);
    }

    public static long decodeSigned64(KiwiBuffer buffer) throws KiwiException {
        return zigzagDecode64(decode64(buffer));
    }

    public static int zigzagEncode(int value) {
        return (value << 1) ^ (value >> 31);
    }

    public static int zigzagDecode(int value) {
        return (value & 1) != 0 ? ~(value >>> 1) : value >>> 1;
    }

    public static long zigzagEncode64(long value) {
        return (value << 1) ^ (value >> 63);
    }

    public static long zigzagDecode64(long value) {
        return (value & 1) != 0 ? ~(value >>> 1) : value >>> 1;
    }
}
