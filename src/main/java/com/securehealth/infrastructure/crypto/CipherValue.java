package com.securehealth.infrastructure.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.UUID;

/**
 * Self-describing encrypted field value.
 *
 * <p>Layout: {@code [algorithm tag:1][data key id:16][value type:1][AEAD output]}.
 * The 18-byte header is the associated data of the AEAD, so it cannot be altered without
 * failing authentication. Stored as binary subtype 6 (encrypted).
 *
 * <p><strong>Security:</strong> immutable, defensive copies on every accessor,
 * {@link #toString()} never prints more than a prefix of the ciphertext.
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class CipherValue {

    public static final int HEADER_LENGTH = 18;

    private final EncryptionAlgorithm algorithm;
    private final UUID keyId;
    private final byte valueType;
    private final byte[] payload;

    public CipherValue(EncryptionAlgorithm algorithm, UUID keyId, byte valueType, byte[] payload) {
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm must not be null");
        if (!algorithm.encrypts()) {
            throw new IllegalArgumentException("Cipher value requires an encrypting algorithm");
        }
        this.keyId = Objects.requireNonNull(keyId, "Key id must not be null");
        this.valueType = valueType;
        Objects.requireNonNull(payload, "Payload must not be null");
        if (payload.length == 0) {
            throw new IllegalArgumentException("Payload must not be empty");
        }
        this.payload = payload.clone();
    }

    /**
     * Parses stored bytes.
     *
     * @throws IllegalArgumentException if the bytes are not a well-formed cipher value
     */
    public static CipherValue parse(byte[] bytes) {
        if (bytes == null || bytes.length <= HEADER_LENGTH) {
            throw new IllegalArgumentException("Cipher value too short");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        EncryptionAlgorithm algorithm = EncryptionAlgorithm.fromBlobTag(buffer.get());
        UUID keyId = new UUID(buffer.getLong(), buffer.getLong());
        byte valueType = buffer.get();
        byte[] payload = new byte[buffer.remaining()];
        buffer.get(payload);
        return new CipherValue(algorithm, keyId, valueType, payload);
    }

    /**
     * Header bytes, used as AEAD associated data.
     */
    public static byte[] header(EncryptionAlgorithm algorithm, UUID keyId, byte valueType) {
        return ByteBuffer.allocate(HEADER_LENGTH)
            .put(algorithm.blobTag())
            .putLong(keyId.getMostSignificantBits())
            .putLong(keyId.getLeastSignificantBits())
            .put(valueType)
            .array();
    }

    public byte[] header() {
        return header(algorithm, keyId, valueType);
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(HEADER_LENGTH + payload.length)
            .put(header())
            .put(payload)
            .array();
    }

    public EncryptionAlgorithm getAlgorithm() {
        return algorithm;
    }

    public UUID getKeyId() {
        return keyId;
    }

    public byte getValueType() {
        return valueType;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CipherValue other)) {
            return false;
        }
        return algorithm == other.algorithm
            && keyId.equals(other.keyId)
            && valueType == other.valueType
            && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(algorithm, keyId, valueType) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        String encoded = Base64.getEncoder().encodeToString(payload);
        String truncated = encoded.length() > 16 ? encoded.substring(0, 16) + "..." : encoded;
        String key = keyId.toString();
        return String.format("CipherValue[algorithm=%s, keyId=****%s, ciphertext=%s]",
            algorithm, key.substring(key.length() - 4), truncated);
    }
}
