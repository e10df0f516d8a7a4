package com.securehealth.infrastructure.crypto;

import java.util.Locale;

/**
 * Field encryption algorithms.
 *
 * <p>{@link #DETERMINISTIC} is a pure function of (plaintext, key) and supports exact-match
 * search at the cost of revealing equality between values. {@link #RANDOM} uses a fresh IV per
 * call and reveals nothing about equality. {@link #NONE} means the field is stored as-is.
 */
public enum EncryptionAlgorithm {

    NONE(null, (byte) 0),
    DETERMINISTIC("AEAD_AES_256_CBC_HMAC_SHA_512-Deterministic", (byte) 1),
    RANDOM("AEAD_AES_256_CBC_HMAC_SHA_512-Random", (byte) 2);

    private final String algorithmName;
    private final byte blobTag;

    EncryptionAlgorithm(String algorithmName, byte blobTag) {
        this.algorithmName = algorithmName;
        this.blobTag = blobTag;
    }

    public String algorithmName() {
        return algorithmName;
    }

    /** Leading byte of a cipher value produced under this algorithm. */
    public byte blobTag() {
        return blobTag;
    }

    public boolean encrypts() {
        return this != NONE;
    }

    public static EncryptionAlgorithm fromBlobTag(byte tag) {
        for (EncryptionAlgorithm algorithm : values()) {
            if (algorithm.encrypts() && algorithm.blobTag == tag) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown cipher value algorithm tag: " + tag);
    }

    /**
     * Parses a configured algorithm: {@code deterministic}, {@code random}, {@code none} or the
     * full AEAD algorithm name. Range encryption is rejected.
     */
    public static EncryptionAlgorithm fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Encryption algorithm must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "deterministic", "equality":
                return DETERMINISTIC;
            case "random":
                return RANDOM;
            case "none":
                return NONE;
            case "range":
                throw new IllegalArgumentException("Range encryption is not supported");
            default:
                for (EncryptionAlgorithm algorithm : values()) {
                    if (algorithm.algorithmName != null && algorithm.algorithmName.equalsIgnoreCase(value.trim())) {
                        return algorithm;
                    }
                }
                throw new IllegalArgumentException("Unknown encryption algorithm: " + value);
        }
    }
}
