package com.securehealth.infrastructure.crypto;

import com.securehealth.domain.model.FieldValue;

import java.util.Objects;

/**
 * Outcome of encrypting one field value.
 *
 * <p>A failure is carried as a value so the caller decides what to do with it; the only
 * conversion to a storable value is {@link #orElseThrow()}, which aborts on failure.
 */
public sealed interface EncryptionResult
        permits EncryptionResult.Passthrough, EncryptionResult.Encrypted, EncryptionResult.Failed {

    /**
     * Storable value, or {@code null} for a passthrough of {@code null}.
     *
     * @throws CryptoException if encryption failed
     */
    StorageValue orElseThrow();

    default boolean isFailure() {
        return this instanceof Failed;
    }

    static EncryptionResult passthrough(FieldValue value) {
        return new Passthrough(value);
    }

    static EncryptionResult encrypted(CipherValue value) {
        return new Encrypted(value);
    }

    static EncryptionResult failed(CryptoException error) {
        return new Failed(error);
    }

    /** Field has no encrypting policy (or documentation mode); value stored as-is. */
    record Passthrough(FieldValue value) implements EncryptionResult {
        @Override
        public StorageValue orElseThrow() {
            return value == null ? null : new StorageValue.Plain(value);
        }
    }

    record Encrypted(CipherValue value) implements EncryptionResult {
        public Encrypted {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public StorageValue orElseThrow() {
            return new StorageValue.Cipher(value);
        }
    }

    record Failed(CryptoException error) implements EncryptionResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public StorageValue orElseThrow() {
            throw error;
        }
    }
}
