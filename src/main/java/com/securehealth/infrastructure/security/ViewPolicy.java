package com.securehealth.infrastructure.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Field visibility rules of one entity kind: a base field set visible to every caller plus an
 * allow-list per role. Role names are normalized to the {@code ROLE_} upper-case form.
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class ViewPolicy {

    public static final String ROLE_PREFIX = "ROLE_";

    private final String entityKind;
    private final Set<String> baseFields;
    private final Map<String, Set<String>> roleFields;

    public ViewPolicy(String entityKind, Collection<String> baseFields, Map<String, ? extends Collection<String>> roleFields) {
        this.entityKind = entityKind;
        this.baseFields = Collections.unmodifiableSet(new LinkedHashSet<>(baseFields));
        Map<String, Set<String>> roles = new LinkedHashMap<>();
        roleFields.forEach((role, fields) ->
            roles.merge(normalizeRole(role), new LinkedHashSet<>(fields), (a, b) -> {
                a.addAll(b);
                return a;
            }));
        roles.replaceAll((role, fields) -> Collections.unmodifiableSet(fields));
        this.roleFields = Collections.unmodifiableMap(roles);
    }

    /**
     * {@code doctor}, {@code Doctor} and {@code ROLE_DOCTOR} all normalize to {@code ROLE_DOCTOR}.
     */
    public static String normalizeRole(String role) {
        if (role == null) {
            return "";
        }
        String upper = role.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith(ROLE_PREFIX) ? upper : ROLE_PREFIX + upper;
    }

    /**
     * Base fields plus the allow-list of every held role, in declaration order.
     * Unknown roles contribute nothing.
     */
    public Set<String> visibleFields(Collection<String> roles) {
        Set<String> visible = new LinkedHashSet<>(baseFields);
        for (String role : roles) {
            visible.addAll(roleFields.getOrDefault(normalizeRole(role), Set.of()));
        }
        return visible;
    }

    public String entityKind() {
        return entityKind;
    }

    public Set<String> baseFields() {
        return baseFields;
    }

    public Map<String, Set<String>> roleFields() {
        return roleFields;
    }

    /** Built-in view policies for patients, messages and conversations. */
    public static Map<String, ViewPolicy> defaults() {
        Map<String, ViewPolicy> policies = new LinkedHashMap<>();

        Map<String, List<String>> patientRoles = new LinkedHashMap<>();
        patientRoles.put("ROLE_DOCTOR", List.of("ssn", "diagnosis", "medications", "insuranceDetails", "notes",
            "notesHistory", "primaryDoctorId"));
        patientRoles.put("ROLE_NURSE", List.of("diagnosis", "medications", "notes", "notesHistory"));
        patientRoles.put("ROLE_RECEPTIONIST", List.of("insuranceDetails"));
        patientRoles.put("ROLE_PATIENT", List.of("medications", "insuranceDetails"));
        patientRoles.put("ROLE_ADMIN", List.of());
        policies.put("patient", new ViewPolicy("patient",
            List.of("id", "firstName", "lastName", "email", "phoneNumber", "birthDate", "createdAt"),
            patientRoles));

        List<String> messageContent = List.of("body", "senderRoles", "recipientRoles");
        Map<String, List<String>> messageRoles = new LinkedHashMap<>();
        messageRoles.put("ROLE_DOCTOR", messageContent);
        messageRoles.put("ROLE_NURSE", messageContent);
        messageRoles.put("ROLE_PATIENT", messageContent);
        messageRoles.put("ROLE_ADMIN", List.of());
        policies.put("message", new ViewPolicy("message",
            List.of("id", "conversationId", "parentMessageId", "threadLevel", "direction", "senderName", "subject",
                "createdAt", "readByPatient", "readByStaff"),
            messageRoles));

        List<String> conversationContent = List.of("participants", "lastMessagePreview", "patientId");
        Map<String, List<String>> conversationRoles = new LinkedHashMap<>();
        conversationRoles.put("ROLE_DOCTOR", conversationContent);
        conversationRoles.put("ROLE_NURSE", conversationContent);
        conversationRoles.put("ROLE_PATIENT", conversationContent);
        conversationRoles.put("ROLE_ADMIN", List.of());
        policies.put("conversation", new ViewPolicy("conversation",
            List.of("id", "subject", "status", "createdAt", "lastMessageAt", "messageCount", "hasUnreadForPatient",
                "hasUnreadForStaff"),
            conversationRoles));

        return policies;
    }
}
