package com.securehealth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.securehealth.config.PerformanceConfiguration.PhiMetrics;
import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.crypto.AeadAes256CbcHmacSha512;
import com.securehealth.infrastructure.crypto.CryptoService;
import com.securehealth.infrastructure.crypto.EncryptionMode;
import com.securehealth.infrastructure.crypto.FieldEncryptionService;
import com.securehealth.infrastructure.crypto.FieldPolicy;
import com.securehealth.infrastructure.crypto.FieldValueCanonicalizer;
import com.securehealth.infrastructure.keyvault.DataKey;
import com.securehealth.infrastructure.keyvault.DefaultKeyVault;
import com.securehealth.infrastructure.keyvault.InMemoryKeyVaultStore;
import com.securehealth.infrastructure.keyvault.KeyVault;
import com.securehealth.infrastructure.keyvault.KeyVaultStore;
import com.securehealth.infrastructure.keyvault.LocalMasterKeyProvider;
import com.securehealth.infrastructure.keyvault.MasterKeyProvider;
import com.securehealth.infrastructure.keyvault.MongoKeyVaultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * Wiring of the field policy, key vault and encryption engine.
 *
 * <p>Documentation mode is announced at boot (warning log and audit event); it is the only
 * configuration under which values are stored unencrypted.
 */
@Configuration
@Slf4j
public class EncryptionConfiguration {

    @Bean
    public AeadAes256CbcHmacSha512 aeadCipher() {
        return new AeadAes256CbcHmacSha512();
    }

    @Bean
    public FieldPolicy fieldPolicy(FieldPolicyProperties properties) {
        if (properties.getEntities().isEmpty()) {
            log.info("Using built-in field policy");
            return FieldPolicy.defaults();
        }
        FieldPolicy policy = FieldPolicy.fromConfig(properties.getEntities());
        log.info("Loaded field policy for entity kinds {}", policy.definitions().keySet());
        return policy;
    }

    @Bean
    public FieldValueCanonicalizer fieldValueCanonicalizer(ObjectProvider<ObjectMapper> objectMapper) {
        return new FieldValueCanonicalizer(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public MasterKeyProvider masterKeyProvider(PhiEncryptionProperties properties, AeadAes256CbcHmacSha512 cipher) {
        Path keyPath = properties.getMasterKeyPath() == null ? null : Path.of(properties.getMasterKeyPath());
        return new LocalMasterKeyProvider(properties.getMasterKeyBase64(), keyPath,
            properties.isGenerateMasterKeyIfMissing(), cipher);
    }

    @Bean
    public KeyVaultStore keyVaultStore(PhiEncryptionProperties properties, ObjectProvider<MongoTemplate> mongoTemplate) {
        if (properties.getKeyVaultStore() == PhiEncryptionProperties.KeyVaultStoreType.IN_MEMORY) {
            log.warn("Key vault store is IN_MEMORY: data keys do not survive a restart");
            return new InMemoryKeyVaultStore();
        }
        MongoKeyVaultStore store = new MongoKeyVaultStore(mongoTemplate.getObject(), properties.getKeyVaultCollection());
        store.ensureIndexes();
        return store;
    }

    @Bean
    public KeyVault keyVault(KeyVaultStore store,
                             MasterKeyProvider masterKeyProvider,
                             AeadAes256CbcHmacSha512 cipher,
                             Cache<String, DataKey> dataKeysByAltName,
                             Cache<UUID, DataKey> dataKeysById,
                             AuditService auditService,
                             PhiMetrics metrics) {
        return new DefaultKeyVault(store, masterKeyProvider, cipher, dataKeysByAltName, dataKeysById,
            auditService, metrics);
    }

    @Bean
    public CryptoService cryptoService(PhiEncryptionProperties properties,
                                       FieldPolicy fieldPolicy,
                                       KeyVault keyVault,
                                       FieldValueCanonicalizer canonicalizer,
                                       AeadAes256CbcHmacSha512 cipher,
                                       AuditService auditService,
                                       PhiMetrics metrics) {
        if (properties.getMode() == EncryptionMode.DOCUMENTATION) {
            log.warn("PHI ENCRYPTION DISABLED: documentation mode stores every field unencrypted. "
                + "Never use this mode with real patient data.");
            auditService.record(AuditEventKind.DOCUMENTATION_MODE_ENABLED, "configuration",
                Map.of("property", "securehealth.encryption.mode"));
        } else {
            log.info("Field encryption enforced with data key '{}'", properties.getKeyAltName());
        }
        return new FieldEncryptionService(fieldPolicy, keyVault, canonicalizer, cipher, properties.getMode(),
            properties.getKeyAltName(), auditService, metrics);
    }
}
