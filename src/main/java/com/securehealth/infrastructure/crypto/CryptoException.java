package com.securehealth.infrastructure.crypto;

/**
 * Base class of field encryption errors.
 *
 * <p>Messages never carry plaintext or key material.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
