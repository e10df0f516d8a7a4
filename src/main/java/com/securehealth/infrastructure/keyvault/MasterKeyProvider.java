package com.securehealth.infrastructure.keyvault;

/**
 * Source of the master key that wraps data keys.
 */
public interface MasterKeyProvider {

    /**
     * @return a copy of the 96-byte master key
     * @throws com.securehealth.infrastructure.crypto.KeyUnavailableException if no usable key is available
     */
    byte[] masterKey();

    /** Provider name recorded on each data key, e.g. {@code local}. */
    String providerName();
}
