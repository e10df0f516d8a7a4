package com.securehealth.infrastructure.keyvault;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local key vault store for offline use and tests.
 */
public class InMemoryKeyVaultStore implements KeyVaultStore {

    private final Map<String, DataKey> byAltName = new ConcurrentHashMap<>();
    private final Map<UUID, DataKey> byId = new ConcurrentHashMap<>();

    @Override
    public Optional<DataKey> findByAltName(String altName) {
        return Optional.ofNullable(byAltName.get(altName));
    }

    @Override
    public Optional<DataKey> findById(UUID id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public InsertOutcome insert(DataKey dataKey) {
        if (byAltName.putIfAbsent(dataKey.getAltName(), dataKey) != null) {
            return InsertOutcome.CONFLICT;
        }
        byId.put(dataKey.getId(), dataKey);
        return InsertOutcome.INSERTED;
    }

    public int size() {
        return byAltName.size();
    }
}
