package com.securehealth.domain.schema;

import com.securehealth.domain.model.FieldValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declares how a domain record kind maps to and from its field values.
 *
 * <p>Implementations own the record's defaulting rules: {@link #fromFields} must accept a map
 * with any subset of the declared fields (absent, or substituted with the shape's empty value)
 * and never throw for a missing field, so documents written by older schema versions still load.
 *
 * @param <T> domain record type
 */
public interface RecordSchema<T> {

    /** Entity kind used for field policy and view policy lookups (e.g. "patient"). */
    String entityKind();

    /** Collection the records are stored in. */
    String collection();

    /** Declared fields, excluding the identifier. */
    List<FieldDescriptor> fields();

    /** Identifier of the record as a 24-character hex string, if assigned. */
    Optional<String> idOf(T record);

    /**
     * Field values of the record keyed by declared field name.
     * Fields with no value are absent from the map.
     */
    Map<String, FieldValue> toFields(T record);

    /**
     * Assembles a record from decrypted, decanonicalized field values.
     *
     * @param id identifier, may be {@code null}
     * @param fields values keyed by declared field name; absent keys take the record's defaults
     */
    T fromFields(String id, Map<String, FieldValue> fields);

    default Optional<FieldDescriptor> field(String name) {
        return fields().stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
