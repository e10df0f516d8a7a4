package com.securehealth.infrastructure.keyvault;

import java.util.Optional;
import java.util.UUID;

/**
 * Named data encryption keys protected by a master key.
 */
public interface KeyVault {

    /**
     * Returns the key registered under {@code altName}, creating it on first use.
     * Concurrent callers racing on the same name all receive the single surviving key.
     *
     * @throws com.securehealth.infrastructure.crypto.KeyUnavailableException if the store or master key is unusable
     */
    DataKey getOrCreateDataKey(String altName);

    /**
     * @throws com.securehealth.infrastructure.crypto.KeyUnavailableException if the store is unreachable
     */
    Optional<DataKey> findDataKey(UUID id);

    /**
     * Unwraps the key material. Callers must not retain the returned array.
     *
     * @throws com.securehealth.infrastructure.crypto.KeyUnavailableException if the key cannot be unwrapped
     */
    byte[] keyMaterial(DataKey dataKey);
}
