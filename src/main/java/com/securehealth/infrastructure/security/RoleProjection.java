package com.securehealth.infrastructure.security;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.schema.RecordSchema;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Projects decrypted records down to the fields a caller's roles may see.
 *
 * <p>The view is built by walking the allow-list and copying each allowed field that the record
 * holds. Fields of the record that no held role allows are never read, so a field added to a record
 * type stays hidden until a view policy names it.
 *
 * <p>Pure and thread-safe.
 *
 * @author Security Team
 * @since 1.0.0
 */
public class RoleProjection {

    public static final String ID_FIELD = "id";

    private final Map<String, ViewPolicy> policies;

    public RoleProjection(Map<String, ViewPolicy> policies) {
        this.policies = Map.copyOf(policies);
    }

    /**
     * @param record field values of the record, including {@value #ID_FIELD} when known
     * @throws IllegalArgumentException if no view policy exists for the entity kind
     */
    public ProjectedView project(String entityKind, Map<String, FieldValue> record, Collection<String> callerRoles) {
        ViewPolicy policy = policies.get(entityKind);
        if (policy == null) {
            throw new IllegalArgumentException("No view policy for entity kind '" + entityKind + "'");
        }
        Map<String, FieldValue> view = new LinkedHashMap<>();
        for (String field : policy.visibleFields(callerRoles)) {
            FieldValue value = record.get(field);
            if (value != null) {
                view.put(field, value);
            }
        }
        return new ProjectedView(entityKind, view);
    }

    public <T> ProjectedView project(RecordSchema<T> schema, T record, Collection<String> callerRoles) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        schema.idOf(record).ifPresent(id -> fields.put(ID_FIELD, new FieldValue.Text(id)));
        fields.putAll(schema.toFields(record));
        return project(schema.entityKind(), fields, callerRoles);
    }

    public <T> ProjectedView project(RecordSchema<T> schema, T record, CallerContext caller) {
        return project(schema, record, caller.getRoles());
    }

    public <T> ProjectedView project(RecordSchema<T> schema, T record, Authentication authentication) {
        return project(schema, record, rolesOf(authentication));
    }

    static List<String> rolesOf(Authentication authentication) {
        if (authentication == null) {
            return List.of();
        }
        return authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .collect(Collectors.toList());
    }

    public Map<String, ViewPolicy> policies() {
        return policies;
    }
}
