package com.securehealth.infrastructure.crypto;

/**
 * The key vault store is unreachable, or the master key is missing or unusable.
 * Aborts any write that needed the key.
 */
public class KeyUnavailableException extends CryptoException {

    public KeyUnavailableException(String message) {
        super(message);
    }

    public KeyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
