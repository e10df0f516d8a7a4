package com.securehealth.infrastructure.crypto;

import com.securehealth.domain.model.FieldValue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Typed byte encoding of scalar plaintexts.
 *
 * <p>The value type byte travels in the cipher value header (BSON type numbers), so a decrypt
 * yields the same scalar kind that was encrypted.
 */
public final class ScalarCodec {

    public static final byte TYPE_DOUBLE = 0x01;
    public static final byte TYPE_STRING = 0x02;
    public static final byte TYPE_OBJECT_ID = 0x07;
    public static final byte TYPE_BOOLEAN = 0x08;
    public static final byte TYPE_DATETIME = 0x09;
    public static final byte TYPE_INT64 = 0x12;

    private static final HexFormat HEX = HexFormat.of();

    private ScalarCodec() {
        // utility class
    }

    /**
     * Encoded scalar: type byte plus plaintext bytes.
     */
    public record Encoded(byte type, byte[] bytes) {
    }

    public static Encoded encode(FieldValue.Scalar value) {
        if (value instanceof FieldValue.Text text) {
            return new Encoded(TYPE_STRING, text.value().getBytes(StandardCharsets.UTF_8));
        }
        if (value instanceof FieldValue.Numeric numeric) {
            if (numeric.isIntegral()) {
                return new Encoded(TYPE_INT64, ByteBuffer.allocate(Long.BYTES).putLong(numeric.value().longValue()).array());
            }
            return new Encoded(TYPE_DOUBLE, ByteBuffer.allocate(Double.BYTES).putDouble(numeric.value().doubleValue()).array());
        }
        if (value instanceof FieldValue.Bool bool) {
            return new Encoded(TYPE_BOOLEAN, new byte[] {(byte) (bool.value() ? 1 : 0)});
        }
        if (value instanceof FieldValue.Timestamp timestamp) {
            return new Encoded(TYPE_DATETIME, ByteBuffer.allocate(Long.BYTES).putLong(timestamp.value().toEpochMilli()).array());
        }
        if (value instanceof FieldValue.ObjectRef ref) {
            return new Encoded(TYPE_OBJECT_ID, HEX.parseHex(ref.hex()));
        }
        throw new IllegalArgumentException("Unsupported scalar: " + value.getClass().getSimpleName());
    }

    /**
     * @throws IllegalArgumentException if the type is unknown or the length does not match it
     */
    public static FieldValue.Scalar decode(byte type, byte[] bytes) {
        switch (type) {
            case TYPE_STRING:
                return new FieldValue.Text(new String(bytes, StandardCharsets.UTF_8));
            case TYPE_INT64:
                requireLength(bytes, Long.BYTES, type);
                return new FieldValue.Numeric(ByteBuffer.wrap(bytes).getLong());
            case TYPE_DOUBLE:
                requireLength(bytes, Double.BYTES, type);
                return new FieldValue.Numeric(ByteBuffer.wrap(bytes).getDouble());
            case TYPE_BOOLEAN:
                requireLength(bytes, 1, type);
                return new FieldValue.Bool(bytes[0] != 0);
            case TYPE_DATETIME:
                requireLength(bytes, Long.BYTES, type);
                return new FieldValue.Timestamp(Instant.ofEpochMilli(ByteBuffer.wrap(bytes).getLong()));
            case TYPE_OBJECT_ID:
                requireLength(bytes, 12, type);
                return new FieldValue.ObjectRef(HEX.formatHex(bytes));
            default:
                throw new IllegalArgumentException("Unknown plaintext type: " + type);
        }
    }

    private static void requireLength(byte[] bytes, int expected, byte type) {
        if (bytes.length != expected) {
            throw new IllegalArgumentException("Plaintext of type " + type + " must be " + expected + " bytes");
        }
    }
}
