package com.securehealth.domain.schema;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Patient;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatientSchemaTest {

    private final PatientSchema schema = new PatientSchema();

    @Test
    void emptyCollectionsAreNotWritten() {
        Map<String, FieldValue> fields = schema.toFields(Patient.builder().lastName("Doe").build());

        assertEquals(Map.of("lastName", new FieldValue.Text("Doe")), fields);
    }

    @Test
    void missingFieldsReadAsDefaults() {
        Patient patient = schema.fromFields("p1", Map.of());

        assertEquals("p1", patient.getId());
        assertTrue(patient.getDiagnosis().isEmpty());
        assertTrue(patient.getMedications().isEmpty());
        assertTrue(patient.getNotesHistory().isEmpty());
        assertNull(patient.getInsuranceDetails());
    }

    @Test
    void readsLegacyTextForms() {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("birthDate", new FieldValue.Text("1980-05-01T00:00:00Z"));
        fields.put("primaryDoctorId", new FieldValue.Text("65A1B2C3D4E5F6A7B8C9D0E1"));
        fields.put("diagnosis", new FieldValue.ListValue(List.of(new FieldValue.Text("a"), new FieldValue.Numeric(2))));

        Patient patient = schema.fromFields(null, fields);

        assertEquals(Instant.parse("1980-05-01T00:00:00Z"), patient.getBirthDate());
        assertEquals("65a1b2c3d4e5f6a7b8c9d0e1", patient.getPrimaryDoctorId());
        assertEquals(List.of("a", "2"), patient.getDiagnosis());
    }

    @Test
    void notesRoundTripThroughFieldValues() {
        Patient patient = Patient.builder().lastName("Doe").build()
            .withNote("Stable", "dr-house", "Dr. House", Instant.parse("2024-01-02T00:00:00Z"));

        Patient restored = schema.fromFields(null, schema.toFields(patient));

        assertEquals(patient.getNotesHistory(), restored.getNotesHistory());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), restored.getUpdatedAt());
    }

    @Test
    void everyDeclaredCompositeHasAnEmptyDefault() {
        for (FieldDescriptor descriptor : schema.fields()) {
            if (descriptor.shape().isComposite()) {
                assertTrue(descriptor.shape().accepts(descriptor.shape().emptyValue()), descriptor.name());
            }
        }
    }
}
