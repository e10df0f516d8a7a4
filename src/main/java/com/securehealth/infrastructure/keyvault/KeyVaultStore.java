package com.securehealth.infrastructure.keyvault;

import java.util.Optional;
import java.util.UUID;

/**
 * Backing store of the key vault. Must enforce uniqueness of alt names.
 */
public interface KeyVaultStore {

    enum InsertOutcome {
        INSERTED,
        /** A key with the same alt name (or id) already exists. */
        CONFLICT
    }

    Optional<DataKey> findByAltName(String altName);

    Optional<DataKey> findById(UUID id);

    InsertOutcome insert(DataKey dataKey);
}
