package com.securehealth.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a patient's clinical notes history.
 */
@Value
@Builder(toBuilder = true)
public class PatientNote {

    String id;
    String content;
    String doctorId;
    String doctorName;
    Instant createdAt;
    Instant updatedAt;

    public FieldValue.MapValue toFieldValue() {
        Map<String, FieldValue> entries = new LinkedHashMap<>();
        FieldValues.putIfPresent(entries, "id", FieldValue.text(id));
        FieldValues.putIfPresent(entries, "content", FieldValue.text(content));
        FieldValues.putIfPresent(entries, "doctorId", FieldValue.text(doctorId));
        FieldValues.putIfPresent(entries, "doctorName", FieldValue.text(doctorName));
        FieldValues.putIfPresent(entries, "createdAt", FieldValue.timestamp(createdAt));
        FieldValues.putIfPresent(entries, "updatedAt", FieldValue.timestamp(updatedAt));
        return new FieldValue.MapValue(entries);
    }

    public static PatientNote fromFieldValue(FieldValue.MapValue value) {
        Map<String, FieldValue> entries = value.entries();
        return PatientNote.builder()
            .id(FieldValues.text(entries, "id"))
            .content(FieldValues.text(entries, "content"))
            .doctorId(FieldValues.text(entries, "doctorId"))
            .doctorName(FieldValues.text(entries, "doctorName"))
            .createdAt(FieldValues.instant(entries, "createdAt"))
            .updatedAt(FieldValues.instant(entries, "updatedAt"))
            .build();
    }
}
