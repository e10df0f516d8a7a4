package com.securehealth.infrastructure.keyvault;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Data encryption key as held by the key vault.
 *
 * <p>{@code keyMaterial} is the 96-byte key wrapped under the master key; it is never the
 * plaintext key and is excluded from {@link #toString()}. Instances are shared through the key
 * caches, so the material is copied on the way in and on every read.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
public class DataKey {
    UUID id;
    String altName;
    @ToString.Exclude
    byte[] keyMaterial;
    Instant createdAt;
    String masterKeyProvider;

    @Builder
    public DataKey(UUID id, String altName, byte[] keyMaterial, Instant createdAt, String masterKeyProvider) {
        this.id = id;
        this.altName = altName;
        this.keyMaterial = keyMaterial == null ? null : keyMaterial.clone();
        this.createdAt = createdAt;
        this.masterKeyProvider = masterKeyProvider;
    }

    public byte[] getKeyMaterial() {
        return keyMaterial == null ? null : keyMaterial.clone();
    }
}
