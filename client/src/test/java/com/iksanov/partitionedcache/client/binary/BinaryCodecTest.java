package com.iksanov.partitionedcache.client.binary;

import com.iksanov.partitionedcache.common.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BinaryWriter / BinaryReader")
class BinaryCodecTest {

    private static Object decode(byte[] bytes, boolean binary) {
        BinaryReader reader = new BinaryReader(bytes, binary);
        Object value = reader.readObject();
        reader.requireFullyRead();
        return value;
    }

    @Test
    @DisplayName("Should decode every supported type back to an equal Java value")
    void shouldDecodeSupportedTypes() {
        UUID uuid = UUID.randomUUID();
        Object[] values = {(byte) 7, (short) -3, 42, 1L << 40, 1.5f, -2.25d, 'z', true, "héllo", uuid};
        for (Object value : values) {
            byte[] bytes = BinaryWriter.encode(new WritableImpl<>(value));
            assertThat(decode(bytes, false)).as("decoded %s", value.getClass().getSimpleName()).isEqualTo(value);
        }
        byte[] raw = BinaryWriter.encode(new WritableImpl<>(new byte[]{1, 2, 3}));
        assertThat((byte[]) decode(raw, false)).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Encoding should be deterministic and distinguish types with the same numeric value")
    void encodingIsDeterministicAndTyped() {
        byte[] a = BinaryWriter.encode(new WritableKeyImpl<>(1));
        byte[] b = BinaryWriter.encode(new WritableKeyImpl<>(1));
        byte[] asLong = BinaryWriter.encode(new WritableKeyImpl<>(1L));

        assertThat(a).isEqualTo(b);
        assertThat(Arrays.equals(a, asLong)).isFalse();
        assertThat(a[0]).isEqualTo(BinaryTypes.INT);
    }

    @Test
    @DisplayName("Binary mode should return tagged bytes and re-encode them verbatim")
    void binaryModeKeepsEncodedForm() {
        byte[] bytes = BinaryWriter.encode(new WritableImpl<>("payload"));

        Object value = decode(bytes, true);

        assertThat(value).isInstanceOf(BinaryObject.class);
        BinaryObject binary = (BinaryObject) value;
        assertThat(binary.typeTag()).isEqualTo(BinaryTypes.STRING);
        assertThat(binary.bytes()).isEqualTo(bytes);
        assertThat(binary.deserialize()).isEqualTo("payload");
        assertThat(BinaryWriter.encode(new WritableImpl<>(binary))).isEqualTo(bytes);
    }

    @Test
    @DisplayName("Null should be encoded as a tag and read back as null in both modes")
    void nullRoundTrip() {
        byte[] bytes = BinaryWriter.encode(new WritableImpl<>(null));
        assertThat(bytes).containsExactly(BinaryTypes.NULL);
        assertThat(decode(bytes, false)).isNull();
        assertThat(decode(bytes, true)).isNull();
    }

    @Test
    @DisplayName("Reader should fail on a buffer shorter than the declared shape")
    void shortBufferFails() {
        byte[] full = BinaryWriter.encode(new WritableImpl<>(123456789L));
        byte[] truncated = Arrays.copyOf(full, full.length - 2);

        assertThatThrownBy(() -> decode(truncated, false))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("long");
        assertThatThrownBy(() -> decode(truncated, true)).isInstanceOf(SerializationException.class);

        byte[] string = BinaryWriter.encode(new WritableImpl<>("abcdef"));
        assertThatThrownBy(() -> decode(Arrays.copyOf(string, 7), false)).isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Reader should fail on an unknown type tag")
    void unknownTagFails() {
        assertThatThrownBy(() -> decode(new byte[]{77, 0, 0}, false))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Unknown type tag: 77");
        assertThatThrownBy(() -> decode(new byte[]{77}, true)).isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Trailing bytes after a value should be rejected")
    void trailingBytesFail() {
        byte[] bytes = {BinaryTypes.BOOL, 1, 0};
        assertThatThrownBy(() -> decode(bytes, false)).isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("Writer should reject unsupported types")
    void unsupportedTypeFails() {
        assertThatThrownBy(() -> BinaryWriter.encode(new WritableImpl<>(new Object())))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("java.lang.Object");
    }

    @Test
    @DisplayName("ReadableValue should tell a miss apart from a stored zero")
    void readableValueDistinguishesMiss() {
        ReadableValue<Integer> untouched = new ReadableValue<>(Integer.class);
        assertThat(untouched.isPresent()).isFalse();
        assertThat(untouched.get()).isNull();

        ReadableValue<Integer> zero = new ReadableValue<>(Integer.class);
        zero.read(new BinaryReader(BinaryWriter.encode(new WritableImpl<>(0)), false));
        assertThat(zero.isPresent()).isTrue();
        assertThat(zero.get()).isZero();
    }

    @Test
    @DisplayName("ReadableValue should reject a decoded value of another type")
    void readableValueChecksType() {
        ReadableValue<Long> holder = new ReadableValue<>(Long.class);

        assertThatThrownBy(() -> holder.read(new BinaryReader(BinaryWriter.encode(new WritableImpl<>(7)), false)))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("java.lang.Integer");
        assertThat(holder.isPresent()).isFalse();

        ReadableValue<Number> widened = new ReadableValue<>(Number.class);
        widened.read(new BinaryReader(BinaryWriter.encode(new WritableImpl<>(7)), false));
        assertThat(widened.get()).isEqualTo(7);
    }

    @Test
    @DisplayName("AffinityKey should transmit the key but route by the affinity value")
    void affinityKeyRoutesByAffinity() {
        AffinityKey<String, Integer> key = new AffinityKey<>("order-1", 77);

        assertThat(BinaryWriter.encode(key)).isEqualTo(BinaryWriter.encode(new WritableImpl<>("order-1")));
        assertThat(BinaryWriter.encode(key.affinityKey())).isEqualTo(BinaryWriter.encode(new WritableImpl<>(77)));
        assertThat(new WritableKeyImpl<>("plain").affinityKey()).isNull();
    }
}
