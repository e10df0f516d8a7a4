package com.securehealth.infrastructure.keyvault;

import com.github.benmanes.caffeine.cache.Cache;
import com.securehealth.config.PerformanceConfiguration.PhiMetrics;
import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.crypto.AeadAes256CbcHmacSha512;
import com.securehealth.infrastructure.crypto.KeyUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Key vault with lazy, race-safe data key creation.
 *
 * <p>Creation relies solely on the store's alt name uniqueness: a caller that loses the insert
 * race re-reads and adopts the winner's key. Wrapped keys are cached; plaintext key material is
 * only ever held for the duration of one call.
 *
 * <p>Each data key is wrapped with AEAD (random mode) under the master key, bound to its id as
 * associated data.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class DefaultKeyVault implements KeyVault {

    static final int MAX_CREATE_ATTEMPTS = 3;
    private static final String ACTOR = "key-vault";

    private final KeyVaultStore store;
    private final MasterKeyProvider masterKeyProvider;
    private final AeadAes256CbcHmacSha512 cipher;
    private final Cache<String, DataKey> keysByAltName;
    private final Cache<UUID, DataKey> keysById;
    private final AuditService auditService;
    private final PhiMetrics metrics;

    public DefaultKeyVault(KeyVaultStore store,
                           MasterKeyProvider masterKeyProvider,
                           AeadAes256CbcHmacSha512 cipher,
                           Cache<String, DataKey> keysByAltName,
                           Cache<UUID, DataKey> keysById,
                           AuditService auditService,
                           PhiMetrics metrics) {
        this.store = store;
        this.masterKeyProvider = masterKeyProvider;
        this.cipher = cipher;
        this.keysByAltName = keysByAltName;
        this.keysById = keysById;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    @Override
    public DataKey getOrCreateDataKey(String altName) {
        if (altName == null || altName.isBlank()) {
            throw new IllegalArgumentException("Key alt name must not be blank");
        }
        DataKey cached = keysByAltName.getIfPresent(altName);
        if (cached != null) {
            return cached;
        }

        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            Optional<DataKey> existing = store.findByAltName(altName);
            if (existing.isPresent()) {
                return remember(existing.get());
            }

            DataKey candidate = newDataKey(altName);
            if (store.insert(candidate) == KeyVaultStore.InsertOutcome.INSERTED) {
                log.info("Created data key {} for alt name '{}'", candidate.getId(), altName);
                metrics.recordKeyCreated();
                auditService.record(AuditEventKind.DATA_KEY_CREATED, ACTOR, Map.of(
                    "altName", altName,
                    "keyId", candidate.getId().toString(),
                    "masterKeyProvider", candidate.getMasterKeyProvider()));
                return remember(candidate);
            }
            log.debug("Lost race creating data key '{}' (attempt {}), re-reading", altName, attempt);
        }
        throw new KeyUnavailableException("Data key '" + altName + "' could not be resolved after "
            + MAX_CREATE_ATTEMPTS + " attempts");
    }

    @Override
    public Optional<DataKey> findDataKey(UUID id) {
        DataKey cached = keysById.getIfPresent(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        return store.findById(id).map(this::remember);
    }

    @Override
    public byte[] keyMaterial(DataKey dataKey) {
        byte[] masterKey = masterKeyProvider.masterKey();
        try {
            return cipher.decrypt(masterKey, dataKey.getKeyMaterial(), idBytes(dataKey.getId()));
        } catch (GeneralSecurityException e) {
            throw new KeyUnavailableException("Data key " + dataKey.getId()
                + " cannot be unwrapped with the configured master key", e);
        } finally {
            Arrays.fill(masterKey, (byte) 0);
        }
    }

    private DataKey newDataKey(String altName) {
        UUID id = UUID.randomUUID();
        byte[] masterKey = masterKeyProvider.masterKey();
        byte[] material = cipher.generateKey();
        try {
            byte[] wrapped = cipher.encrypt(masterKey, material, idBytes(id), false);
            return DataKey.builder()
                .id(id)
                .altName(altName)
                .keyMaterial(wrapped)
                .createdAt(Instant.now())
                .masterKeyProvider(masterKeyProvider.providerName())
                .build();
        } catch (GeneralSecurityException e) {
            throw new KeyUnavailableException("Data key could not be wrapped under the master key", e);
        } finally {
            Arrays.fill(material, (byte) 0);
            Arrays.fill(masterKey, (byte) 0);
        }
    }

    private DataKey remember(DataKey dataKey) {
        keysByAltName.put(dataKey.getAltName(), dataKey);
        keysById.put(dataKey.getId(), dataKey);
        return dataKey;
    }

    private static byte[] idBytes(UUID id) {
        return ByteBuffer.allocate(16)
            .putLong(id.getMostSignificantBits())
            .putLong(id.getLeastSignificantBits())
            .array();
    }
}
