package com.securehealth.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Patient record (plaintext, in-memory form).
 *
 * <p>Never persisted directly: the document codec produces the encrypted storage form.
 * Searchable fields (names, email, phone, birth date) are stored under deterministic
 * encryption; clinical fields, SSN and insurance under randomized encryption.
 *
 * <p>Instances are immutable; mutators return a modified copy.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Patient {

    public static final String ENTITY_KIND = "patient";

    String id;
    String firstName;
    String lastName;
    String email;
    String phoneNumber;
    Instant birthDate;
    String ssn;
    @Singular("addDiagnosis")
    List<String> diagnosis;
    @Singular
    List<String> medications;
    Map<String, String> insuranceDetails;
    String notes;
    @Singular("addNote")
    List<PatientNote> notesHistory;
    Instant createdAt;
    Instant updatedAt;
    String primaryDoctorId;

    public Patient withDiagnosis(String entry) {
        if (diagnosis.contains(entry)) {
            return this;
        }
        return toBuilder().addDiagnosis(entry).build();
    }

    public Patient withoutDiagnosis(String entry) {
        List<String> remaining = new ArrayList<>(diagnosis);
        remaining.remove(entry);
        return toBuilder().clearDiagnosis().diagnosis(remaining).build();
    }

    public Patient withMedication(String medication) {
        if (medications.contains(medication)) {
            return this;
        }
        return toBuilder().medication(medication).build();
    }

    public Patient withoutMedication(String medication) {
        List<String> remaining = new ArrayList<>(medications);
        remaining.remove(medication);
        return toBuilder().clearMedications().medications(remaining).build();
    }

    /**
     * Appends a clinical note authored by the given doctor and bumps {@code updatedAt}.
     */
    public Patient withNote(String content, String doctorId, String doctorName, Instant at) {
        PatientNote note = PatientNote.builder()
            .id(UUID.randomUUID().toString())
            .content(content)
            .doctorId(doctorId)
            .doctorName(doctorName)
            .createdAt(at)
            .updatedAt(at)
            .build();
        return toBuilder().addNote(note).updatedAt(at).build();
    }
}
