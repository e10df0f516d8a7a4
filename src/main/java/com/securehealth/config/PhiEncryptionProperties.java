package com.securehealth.config;

import com.securehealth.infrastructure.crypto.EncryptionMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Encryption settings bound from {@code securehealth.encryption.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "securehealth.encryption")
public class PhiEncryptionProperties {

    public enum KeyVaultStoreType {
        MONGO,
        /** Process-local; keys are lost on restart. Offline use only. */
        IN_MEMORY
    }

    @NotNull
    private EncryptionMode mode = EncryptionMode.ENFORCED;

    @NotBlank
    private String keyAltName = "hipaa_encryption_key";

    private String masterKeyPath = "config/encryption.key";

    /** Base64 master key; takes precedence over {@link #masterKeyPath}. */
    private String masterKeyBase64;

    private boolean generateMasterKeyIfMissing = false;

    @NotNull
    private KeyVaultStoreType keyVaultStore = KeyVaultStoreType.MONGO;

    @NotBlank
    private String keyVaultCollection = "__keyVault";

    @NotNull
    private Duration keyCacheTtl = Duration.ofMinutes(10);

    @Min(1)
    private long keyCacheMaxSize = 100;
}
