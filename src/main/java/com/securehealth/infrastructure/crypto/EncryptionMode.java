package com.securehealth.infrastructure.crypto;

/**
 * Boot-time encryption mode.
 *
 * <p>{@link #DOCUMENTATION} stores every field unencrypted and exists only for offline demos and
 * documentation builds. It is selected by configuration, never entered because of a failure.
 */
public enum EncryptionMode {
    ENFORCED,
    DOCUMENTATION
}
