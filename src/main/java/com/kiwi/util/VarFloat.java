package com.kiwi.util;

import com.kiwi.error.KiwiException;

/**
 * Packed encoding for 32-bit floats.
 * <p>
 * The IEEE-754 bit pattern is rotated so that sign and exponent land in the low nine bits. A value whose
 * exponent field is zero (zero and every subnormal) is written as a single {@code 0x00} byte and reads back
 * as {@code 0.0f}; everything else takes four little-endian bytes. NaN is always written as the canonical
 * quiet NaN {@code 0x7FC00000}.
 */
public final class VarFloat {

    static final int CANONICAL_NAN_BITS = 0x7FC00000;

    private VarFloat() {} // utility class

    public static void encode(float value, KiwiBuffer buffer) {
        int bits = Float.isNaN(value) ? CANONICAL_NAN_BITS : Float.floatToRawIntBits(value);
        int rotated = (bits >>> 23) | (bits << 9);

        if ((rotated & 0xFF) == 0) {
            buffer.putByte((byte) 0);
            return;
        }
        buffer.putInt(rotated);
    }

    public static float decode(KiwiBuffer buffer) throws KiwiException {
        if (buffer.peekByte() == 0) {
            buffer.getByte();
            return 0.0f;
        }
        int rotated = buffer.getInt();
        return Float.intBitsToFloat((rotated << 23) | (rotated >>> 9));
    }
}
