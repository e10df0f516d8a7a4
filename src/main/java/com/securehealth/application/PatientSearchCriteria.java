package com.securehealth.application;

import com.securehealth.domain.model.FieldValue;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exact-match patient search. Every field is deterministically encrypted, so matching happens
 * over ciphertext. Values must match the stored value exactly (no trimming or case folding).
 */
@Value
@Builder
public class PatientSearchCriteria {
    String lastName;
    String firstName;
    String email;
    String phoneNumber;

    Map<String, FieldValue> toFieldCriteria() {
        Map<String, FieldValue> criteria = new LinkedHashMap<>();
        put(criteria, "lastName", lastName);
        put(criteria, "firstName", firstName);
        put(criteria, "email", email);
        put(criteria, "phoneNumber", phoneNumber);
        return criteria;
    }

    private static void put(Map<String, FieldValue> criteria, String field, String value) {
        if (value != null && !value.isBlank()) {
            criteria.put(field, new FieldValue.Text(value));
        }
    }
}
