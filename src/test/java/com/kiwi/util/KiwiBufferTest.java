package com.kiwi.util;

import com.kiwi.error.ErrorType;
import com.kiwi.error.KiwiException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KiwiBufferTest {

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("growable buffers expand past their initial capacity")
        void growableBufferExpands() {
            var buffer = KiwiBuffer.growable(2);
            for (int i = 0; i < 100; i++) {
                buffer.putByte((byte) i);
            }

            assertThat(buffer.limit()).isEqualTo(100);
            assertThat(buffer.capacity()).isGreaterThanOrEqualTo(100);
            assertThat(buffer.toByteArray()).hasSize(100).startsWith((byte) 0, (byte) 1, (byte) 2);
        }

        @Test
        @DisplayName("capacity doubles until the array size cap, then clamps")
        void growthClampsAtMaximumCapacity() {
            assertThat(KiwiBuffer.grownCapacity(16)).isEqualTo(32);
            assertThat(KiwiBuffer.grownCapacity(KiwiBuffer.MAX_CAPACITY / 2)).isEqualTo(KiwiBuffer.MAX_CAPACITY - 1);
            assertThat(KiwiBuffer.grownCapacity((1 << 30) + 1)).isEqualTo(KiwiBuffer.MAX_CAPACITY);
            assertThat(KiwiBuffer.grownCapacity(KiwiBuffer.MAX_CAPACITY)).isEqualTo(KiwiBuffer.MAX_CAPACITY);
        }

        @Test
        @DisplayName("fixed buffers refuse writes past their end")
        void fixedBufferOverflow() {
            var buffer = new KiwiBuffer(new byte[2]);
            buffer.putByte((byte) 1).putByte((byte) 2);

            assertThatThrownBy(() -> buffer.putByte((byte) 3))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("int32 is little-endian")
        void intIsLittleEndian() {
            var buffer = KiwiBuffer.growable();
            buffer.putInt(0x12345678);

            assertThat(buffer.toByteArray()).containsExactly(0x78, 0x56, 0x34, 0x12);
        }

        @Test
        @DisplayName("strings are NUL-terminated UTF-8")
        void stringIsNulTerminated() throws KiwiException {
            var buffer = KiwiBuffer.growable();
            buffer.putString("abc");

            assertThat(buffer.toByteArray()).containsExactly(97, 98, 99, 0);
        }

        @Test
        @DisplayName("strings with an embedded NUL are rejected")
        void embeddedNulRejected() {
            var buffer = KiwiBuffer.growable();

            assertThatThrownBy(() -> buffer.putString("a\0b"))
                    .isInstanceOf(KiwiException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_STRING_CONTENT);
        }

        @Test
        @DisplayName("byte arrays carry a varuint length prefix")
        void byteArrayHasLengthPrefix() {
            var buffer = KiwiBuffer.growable();
            buffer.putByteArray(new byte[]{9, 8, 7});

            assertThat(buffer.toByteArray()).containsExactly(3, 9, 8, 7);
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("written primitives read back in order")
        void primitivesReadBack() throws KiwiException {
            var buffer = KiwiBuffer.growable();
            buffer.putBool(true)
                    .putByte((byte) 0xFE)
                    .putVarInt(-42)
                    .putVarUint(300)
                    .putVarFloat(2.5f)
                    .putVarInt64(-1234567890123L)
                    .putVarUint64(0xFFFFFFFFFFFFFFFFL)
                    .putByteArray(new byte[]{1, 2})
                    .putInt(-7);
            buffer.putString("héllo");
            buffer.flip();

            assertThat(buffer.getBool()).isTrue();
            assertThat(buffer.getByte() & 0xFF).isEqualTo(0xFE);
            assertThat(buffer.getVarInt()).isEqualTo(-42);
            assertThat(buffer.getVarUint()).isEqualTo(300);
            assertThat(buffer.getVarFloat()).isEqualTo(2.5f);
            assertThat(buffer.getVarInt64()).isEqualTo(-1234567890123L);
            assertThat(buffer.getVarUint64()).isEqualTo(-1L);
            assertThat(buffer.getByteArray()).containsExactly(1, 2);
            assertThat(buffer.getInt()).isEqualTo(-7);
            assertThat(buffer.getString()).isEqualTo("héllo");
            assertThat(buffer.hasRemaining()).isFalse();
        }

        @Test
        @DisplayName("any non-zero byte reads as true")
        void nonZeroIsTrue() throws KiwiException {
            var buffer = new KiwiBuffer(new byte[]{0, 1, 2, (byte) 0xFF});

            assertThat(buffer.getBool()).isFalse();
            assertThat(buffer.getBool()).isTrue();
            assertThat(buffer.getBool()).isTrue();
            assertThat(buffer.getBool()).isTrue();
        }

        @Test
        @DisplayName("string decoding stops at the first zero byte")
        void stringStopsAtFirstZero() throws KiwiException {
            var buffer = new KiwiBuffer(new byte[]{'h', 'i', 0, 'x', 0});

            assertThat(buffer.getString()).isEqualTo("hi");
            assertThat(buffer.position()).isEqualTo(3);
            assertThat(buffer.getString()).isEqualTo("x");
        }

        @Test
        @DisplayName("decoded byte arrays are copies")
        void byteArraysAreCopies() throws KiwiException {
            byte[] source = {2, 5, 6};
            var buffer = new KiwiBuffer(source);
            byte[] decoded = buffer.getByteArray();
            decoded[0] = 99;

            assertThat(source[1]).isEqualTo((byte) 5);
        }

        @Test
        @DisplayName("reading past the end reports the offset")
        void underflowReportsOffset() throws KiwiException {
            var buffer = new KiwiBuffer(new byte[]{1, 2, 3});
            buffer.skip(2);

            assertThatThrownBy(buffer::getInt)
                    .isInstanceOf(KiwiException.class)
                    .hasMessageContaining("offset 2")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.BUFFER_UNDERFLOW);
        }

        @Test
        @DisplayName("an unterminated string is an underflow")
        void unterminatedString() {
            var buffer = new KiwiBuffer(new byte[]{'a', 'b'});

            assertThatThrownBy(buffer::getString)
                    .isInstanceOf(KiwiException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.BUFFER_UNDERFLOW);
        }

        @Test
        @DisplayName("a byte array longer than the buffer is an underflow")
        void byteArrayOverrun() {
            var buffer = new KiwiBuffer(new byte[]{10, 1, 2});

            assertThatThrownBy(buffer::getByteArray)
                    .isInstanceOf(KiwiException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.BUFFER_UNDERFLOW);
        }

        @Test
        @DisplayName("peekByte does not consume")
        void peekDoesNotConsume() throws KiwiException {
            var buffer = new KiwiBuffer(new byte[]{(byte) 0x80});

            assertThat(buffer.peekByte()).isEqualTo(0x80);
            assertThat(buffer.position()).isZero();
        }
    }
}
