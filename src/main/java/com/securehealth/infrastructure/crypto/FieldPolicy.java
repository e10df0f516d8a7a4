package com.securehealth.infrastructure.crypto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable (entity kind, field name) to {@link EncryptionAlgorithm} table.
 *
 * <p>Lookups are total: a field missing from the table resolves to {@link EncryptionAlgorithm#NONE}.
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class FieldPolicy {

    private final Map<String, Map<String, EncryptionAlgorithm>> definitions;

    private FieldPolicy(Map<String, Map<String, EncryptionAlgorithm>> definitions) {
        Map<String, Map<String, EncryptionAlgorithm>> copy = new LinkedHashMap<>();
        definitions.forEach((kind, fields) ->
            copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.definitions = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a policy from configuration values such as {@code deterministic} or {@code random}.
     *
     * @throws IllegalArgumentException on an unknown or unsupported algorithm name
     */
    public static FieldPolicy fromConfig(Map<String, Map<String, String>> config) {
        Map<String, Map<String, EncryptionAlgorithm>> parsed = new LinkedHashMap<>();
        config.forEach((kind, fields) -> {
            Map<String, EncryptionAlgorithm> algorithms = new LinkedHashMap<>();
            fields.forEach((field, algorithm) -> {
                try {
                    algorithms.put(field, EncryptionAlgorithm.fromConfig(algorithm));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(
                        "Invalid field policy for " + kind + "." + field + ": " + e.getMessage(), e);
                }
            });
            parsed.put(kind, algorithms);
        });
        return new FieldPolicy(parsed);
    }

    /**
     * Built-in policy for patients, messages and conversations.
     */
    public static FieldPolicy defaults() {
        Map<String, Map<String, EncryptionAlgorithm>> table = new LinkedHashMap<>();
        table.put("patient", fields(
            List.of("firstName", "lastName", "email", "phoneNumber", "birthDate", "patientId"),
            List.of("ssn", "diagnosis", "medications", "insuranceDetails", "notes", "notesHistory")));
        table.put("message", fields(
            List.of("patientId", "senderUserId", "senderName", "senderRoles", "recipientRoles", "direction",
                "conversationId", "parentMessageId", "subject"),
            List.of("body")));
        table.put("conversation", fields(
            List.of("patientId", "subject", "participants", "status"),
            List.of("lastMessagePreview")));
        return new FieldPolicy(table);
    }

    private static Map<String, EncryptionAlgorithm> fields(List<String> deterministic, List<String> random) {
        Map<String, EncryptionAlgorithm> fields = new LinkedHashMap<>();
        deterministic.forEach(field -> fields.put(field, EncryptionAlgorithm.DETERMINISTIC));
        random.forEach(field -> fields.put(field, EncryptionAlgorithm.RANDOM));
        return fields;
    }

    public EncryptionAlgorithm algorithmFor(String entityKind, String fieldName) {
        Map<String, EncryptionAlgorithm> fields = definitions.get(entityKind);
        if (fields == null) {
            return EncryptionAlgorithm.NONE;
        }
        return fields.getOrDefault(fieldName, EncryptionAlgorithm.NONE);
    }

    public boolean isEncrypted(String entityKind, String fieldName) {
        return algorithmFor(entityKind, fieldName).encrypts();
    }

    /** Only deterministic fields support exact-match queries over ciphertext. */
    public boolean isQueryable(String entityKind, String fieldName) {
        return algorithmFor(entityKind, fieldName) == EncryptionAlgorithm.DETERMINISTIC;
    }

    public Map<String, Map<String, EncryptionAlgorithm>> definitions() {
        return definitions;
    }
}
