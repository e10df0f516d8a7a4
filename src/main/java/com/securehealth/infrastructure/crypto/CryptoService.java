package com.securehealth.infrastructure.crypto;

import com.securehealth.domain.model.FieldValue;

/**
 * Field-level encryption engine.
 *
 * <p>Encryption is driven by the field policy: values of fields without an encrypting policy pass
 * through unchanged. Composite values are canonicalized before encryption; decryption returns
 * their canonical text, which the caller decanonicalizes against the declared field shape.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypts one field value, reporting failure as a result instead of throwing.
     *
     * @param entityKind entity kind, e.g. {@code patient}
     * @param fieldName field name within that kind
     * @param value value to encrypt, may be {@code null}
     */
    EncryptionResult tryEncrypt(String entityKind, String fieldName, FieldValue value);

    /**
     * Encrypts one field value or aborts.
     *
     * @return {@code null} for a {@code null} value, a plain value for a passthrough, otherwise a cipher value
     * @throws KeyUnavailableException if the data key cannot be resolved
     * @throws EncryptionFailureException if the cipher operation fails
     */
    default StorageValue encrypt(String entityKind, String fieldName, FieldValue value) {
        if (value == null) {
            return null;
        }
        return tryEncrypt(entityKind, fieldName, value).orElseThrow();
    }

    /**
     * Decrypts a stored value. Plain and legacy values are returned unchanged.
     *
     * @throws DecryptionFailureException if a cipher value cannot be decrypted
     */
    FieldValue decrypt(StorageValue value);

    EncryptionAlgorithm algorithmFor(String entityKind, String fieldName);
}
