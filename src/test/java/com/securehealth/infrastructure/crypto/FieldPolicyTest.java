package com.securehealth.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldPolicyTest {

    private final FieldPolicy policy = FieldPolicy.defaults();

    @Test
    void defaultPolicyMatchesProductionTable() {
        assertEquals(EncryptionAlgorithm.DETERMINISTIC, policy.algorithmFor("patient", "email"));
        assertEquals(EncryptionAlgorithm.DETERMINISTIC, policy.algorithmFor("patient", "birthDate"));
        assertEquals(EncryptionAlgorithm.RANDOM, policy.algorithmFor("patient", "ssn"));
        assertEquals(EncryptionAlgorithm.RANDOM, policy.algorithmFor("patient", "notesHistory"));
        assertEquals(EncryptionAlgorithm.DETERMINISTIC, policy.algorithmFor("message", "conversationId"));
        assertEquals(EncryptionAlgorithm.RANDOM, policy.algorithmFor("message", "body"));
        assertEquals(EncryptionAlgorithm.DETERMINISTIC, policy.algorithmFor("conversation", "participants"));
        assertEquals(EncryptionAlgorithm.RANDOM, policy.algorithmFor("conversation", "lastMessagePreview"));
    }

    @Test
    void missingEntriesResolveToNone() {
        assertEquals(EncryptionAlgorithm.NONE, policy.algorithmFor("patient", "createdAt"));
        assertEquals(EncryptionAlgorithm.NONE, policy.algorithmFor("patient", "primaryDoctorId"));
        assertEquals(EncryptionAlgorithm.NONE, policy.algorithmFor("invoice", "amount"));
        assertFalse(policy.isEncrypted("message", "threadLevel"));
    }

    @Test
    void onlyDeterministicFieldsAreQueryable() {
        assertTrue(policy.isQueryable("patient", "lastName"));
        assertFalse(policy.isQueryable("patient", "diagnosis"));
        assertFalse(policy.isQueryable("patient", "createdAt"));
    }

    @Test
    void parsesConfiguredTable() {
        FieldPolicy configured = FieldPolicy.fromConfig(Map.of(
            "patient", Map.of("email", "equality", "notes", "AEAD_AES_256_CBC_HMAC_SHA_512-Random", "nickname", "none")));

        assertEquals(EncryptionAlgorithm.DETERMINISTIC, configured.algorithmFor("patient", "email"));
        assertEquals(EncryptionAlgorithm.RANDOM, configured.algorithmFor("patient", "notes"));
        assertEquals(EncryptionAlgorithm.NONE, configured.algorithmFor("patient", "nickname"));
        assertEquals(EncryptionAlgorithm.NONE, configured.algorithmFor("patient", "ssn"));
    }

    @Test
    void rejectsRangeAndUnknownAlgorithms() {
        IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
            () -> FieldPolicy.fromConfig(Map.of("patient", Map.of("birthDate", "range"))));
        assertTrue(range.getMessage().contains("patient.birthDate"));

        assertThrows(IllegalArgumentException.class,
            () -> FieldPolicy.fromConfig(Map.of("patient", Map.of("email", "rot13"))));
    }

    @Test
    void definitionsAreImmutable() {
        assertThrows(UnsupportedOperationException.class,
            () -> policy.definitions().get("patient").put("createdAt", EncryptionAlgorithm.RANDOM));
    }
}
