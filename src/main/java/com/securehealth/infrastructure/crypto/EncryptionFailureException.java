package com.securehealth.infrastructure.crypto;

/**
 * A cipher operation failed although a data key was resolved.
 * Aborts the enclosing write; the value is never stored in plaintext instead.
 */
public class EncryptionFailureException extends CryptoException {

    public EncryptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
