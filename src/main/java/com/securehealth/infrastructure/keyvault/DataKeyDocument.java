package com.securehealth.infrastructure.keyvault;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Key vault entry as stored in MongoDB, in the client-side field level encryption key vault layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "__keyVault")
public class DataKeyDocument {

    static final int STATUS_ACTIVE = 0;

    @Id
    private UUID id;

    @Indexed(unique = true, sparse = true)
    private List<String> keyAltNames;

    @ToString.Exclude
    private byte[] keyMaterial;

    private Instant creationDate;

    private Instant updateDate;

    private int status;

    private Map<String, String> masterKey;

    static DataKeyDocument from(DataKey dataKey) {
        return DataKeyDocument.builder()
            .id(dataKey.getId())
            .keyAltNames(List.of(dataKey.getAltName()))
            .keyMaterial(dataKey.getKeyMaterial())
            .creationDate(dataKey.getCreatedAt())
            .updateDate(dataKey.getCreatedAt())
            .status(STATUS_ACTIVE)
            .masterKey(Map.of("provider", dataKey.getMasterKeyProvider()))
            .build();
    }

    DataKey toDataKey() {
        String altName = keyAltNames == null || keyAltNames.isEmpty() ? null : keyAltNames.get(0);
        return DataKey.builder()
            .id(id)
            .altName(altName)
            .keyMaterial(keyMaterial)
            .createdAt(creationDate)
            .masterKeyProvider(masterKey == null ? null : masterKey.get("provider"))
            .build();
    }
}
