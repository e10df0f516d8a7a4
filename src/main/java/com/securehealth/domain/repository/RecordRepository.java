package com.securehealth.domain.repository;

import com.securehealth.domain.model.FieldValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository of records whose PHI fields are encrypted at rest.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Encrypt every governed field before storage and abort the write if that fails</li>
 *   <li>Return complete records on read, defaulting fields that cannot be decrypted</li>
 *   <li>Support exact-match lookups only on unencrypted or deterministically encrypted fields</li>
 * </ul>
 *
 * @param <T> record type
 * @author Security Team
 * @since 1.0.0
 */
public interface RecordRepository<T> {

    /**
     * Stores the record, assigning an identifier if it has none.
     *
     * @return the stored record with its identifier
     */
    T save(T record);

    Optional<T> findById(String id);

    /**
     * Exact-match lookup; all criteria must match.
     *
     * @throws IllegalArgumentException if a criterion targets a randomly encrypted field
     */
    List<T> findByEquality(Map<String, FieldValue> criteria);
}
