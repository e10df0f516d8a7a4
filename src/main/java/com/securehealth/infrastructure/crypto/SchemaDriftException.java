package com.securehealth.infrastructure.crypto;

/**
 * A composite field matched none of the tolerated storage shapes
 * (native composite, canonical encoding). Recovered per field by the document codec.
 */
public class SchemaDriftException extends CryptoException {

    public SchemaDriftException(String message) {
        super(message);
    }

    public SchemaDriftException(String message, Throwable cause) {
        super(message, cause);
    }
}
