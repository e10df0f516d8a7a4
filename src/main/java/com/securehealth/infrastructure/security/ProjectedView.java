package com.securehealth.infrastructure.security;

import com.securehealth.domain.model.FieldValue;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Role-scoped view of a record: only the fields the caller's roles allow.
 */
@Value
public class ProjectedView {
    String entityKind;
    Map<String, FieldValue> fields;

    public ProjectedView(String entityKind, Map<String, FieldValue> fields) {
        this.entityKind = entityKind;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public FieldValue get(String field) {
        return fields.get(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /** Plain Java values, for serialization to the caller. */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((name, value) -> plain.put(name, value == null ? null : value.toPlain()));
        return plain;
    }
}
