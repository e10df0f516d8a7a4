package com.securehealth.infrastructure.crypto;

import com.securehealth.config.PerformanceConfiguration.PhiMetrics;
import com.securehealth.domain.model.FieldValue;
import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.keyvault.DataKey;
import com.securehealth.infrastructure.keyvault.KeyVault;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;

/**
 * Policy-driven field encryption with AEAD_AES_256_CBC_HMAC_SHA_512.
 *
 * <p>Security properties:
 * <ul>
 *   <li>Deterministic fields: same plaintext and key always give byte-identical cipher values,
 *       so exact-match queries work over ciphertext</li>
 *   <li>Random fields: fresh IV per call, equal plaintexts are indistinguishable</li>
 *   <li>The cipher value header (algorithm, key id, value type) is authenticated</li>
 *   <li>Failures never fall back to plaintext; only {@link EncryptionMode#DOCUMENTATION},
 *       chosen at boot, stores values unencrypted</li>
 * </ul>
 *
 * <p>Thread-safe and stateless apart from its collaborators.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class FieldEncryptionService implements CryptoService {

    private static final String ACTOR = "field-encryption";

    private final FieldPolicy policy;
    private final KeyVault keyVault;
    private final FieldValueCanonicalizer canonicalizer;
    private final AeadAes256CbcHmacSha512 cipher;
    private final EncryptionMode mode;
    private final String keyAltName;
    private final AuditService auditService;
    private final PhiMetrics metrics;

    public FieldEncryptionService(FieldPolicy policy,
                                  KeyVault keyVault,
                                  FieldValueCanonicalizer canonicalizer,
                                  AeadAes256CbcHmacSha512 cipher,
                                  EncryptionMode mode,
                                  String keyAltName,
                                  AuditService auditService,
                                  PhiMetrics metrics) {
        this.policy = policy;
        this.keyVault = keyVault;
        this.canonicalizer = canonicalizer;
        this.cipher = cipher;
        this.mode = mode;
        this.keyAltName = keyAltName;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    @Override
    public EncryptionResult tryEncrypt(String entityKind, String fieldName, FieldValue value) {
        if (value == null) {
            return EncryptionResult.passthrough(null);
        }
        EncryptionAlgorithm algorithm = policy.algorithmFor(entityKind, fieldName);
        if (!algorithm.encrypts() || mode == EncryptionMode.DOCUMENTATION) {
            return EncryptionResult.passthrough(value);
        }

        try {
            ScalarCodec.Encoded plaintext = ScalarCodec.encode(canonicalizer.canonicalize(value));
            DataKey dataKey = keyVault.getOrCreateDataKey(keyAltName);
            byte[] key = keyVault.keyMaterial(dataKey);
            try {
                byte[] header = CipherValue.header(algorithm, dataKey.getId(), plaintext.type());
                byte[] payload = cipher.encrypt(key, plaintext.bytes(), header,
                    algorithm == EncryptionAlgorithm.DETERMINISTIC);
                metrics.recordFieldEncrypted(entityKind, algorithm);
                return EncryptionResult.encrypted(
                    new CipherValue(algorithm, dataKey.getId(), plaintext.type(), payload));
            } finally {
                Arrays.fill(key, (byte) 0);
            }
        } catch (KeyUnavailableException | EncryptionFailureException e) {
            return failed(entityKind, fieldName, e);
        } catch (GeneralSecurityException | RuntimeException e) {
            return failed(entityKind, fieldName, new EncryptionFailureException(
                "Encryption of " + entityKind + "." + fieldName + " failed", e));
        }
    }

    @Override
    public FieldValue decrypt(StorageValue value) {
        if (value == null) {
            return null;
        }
        if (value instanceof StorageValue.Plain plain) {
            return plain.value();
        }
        if (value instanceof StorageValue.LegacyComposite legacy) {
            return legacy.value();
        }
        return decryptCipher(((StorageValue.Cipher) value).value());
    }

    @Override
    public EncryptionAlgorithm algorithmFor(String entityKind, String fieldName) {
        return policy.algorithmFor(entityKind, fieldName);
    }

    private FieldValue decryptCipher(CipherValue cipherValue) {
        UUID keyId = cipherValue.getKeyId();
        byte[] key;
        try {
            DataKey dataKey = keyVault.findDataKey(keyId)
                .orElseThrow(() -> new DecryptionFailureException("Unknown data key " + keyId));
            key = keyVault.keyMaterial(dataKey);
        } catch (KeyUnavailableException e) {
            throw new DecryptionFailureException("Data key " + keyId + " unavailable", e);
        }

        try {
            byte[] plaintext = cipher.decrypt(key, cipherValue.getPayload(), cipherValue.header());
            return ScalarCodec.decode(cipherValue.getValueType(), plaintext);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new DecryptionFailureException("Cipher value under key " + keyId + " could not be decrypted", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private EncryptionResult failed(String entityKind, String fieldName, CryptoException error) {
        log.error("Encryption failed for {}.{}: {}", entityKind, fieldName, error.getMessage());
        auditService.record(AuditEventKind.ENCRYPTION_FAILURE, ACTOR, Map.of(
            "entityKind", entityKind,
            "field", fieldName,
            "error", error.getClass().getSimpleName()));
        return EncryptionResult.failed(error);
    }
}
