package com.securehealth.infrastructure.crypto;

/**
 * A cipher value could not be read: wrong or unknown key, corruption, or algorithm mismatch.
 * Recovered per field by the document codec.
 */
public class DecryptionFailureException extends CryptoException {

    public DecryptionFailureException(String message) {
        super(message);
    }

    public DecryptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
