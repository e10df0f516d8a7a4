package com.securehealth.infrastructure.codec;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.infrastructure.crypto.CryptoService;
import com.securehealth.infrastructure.crypto.EncryptionAlgorithm;
import lombok.RequiredArgsConstructor;
import org.bson.Document;

import java.util.Map;

/**
 * Builds exact-match filters over encrypted fields.
 *
 * <p>Probe values are encrypted under the field's deterministic policy, so they match the stored
 * cipher values byte for byte. The probe must have the same scalar kind as the stored value
 * (an id reference, not its hex text). Randomly encrypted fields cannot be queried.
 */
@RequiredArgsConstructor
public class EncryptedEqualityFilter {

    private final CryptoService cryptoService;

    /**
     * @throws IllegalArgumentException if a criterion is null or targets a randomly encrypted field
     */
    public Document build(String entityKind, Map<String, FieldValue> criteria) {
        Document filter = new Document();
        criteria.forEach((field, value) -> {
            if (value == null) {
                throw new IllegalArgumentException("Criterion for " + entityKind + "." + field + " must not be null");
            }
            if (cryptoService.algorithmFor(entityKind, field) == EncryptionAlgorithm.RANDOM) {
                throw new IllegalArgumentException(entityKind + "." + field
                    + " is randomly encrypted and cannot be queried");
            }
            filter.put(field, BsonValues.toBson(cryptoService.encrypt(entityKind, field, value)));
        });
        return filter;
    }
}
