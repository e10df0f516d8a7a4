package com.securehealth.domain.schema;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.FieldValues;
import com.securehealth.domain.model.Patient;
import com.securehealth.domain.model.PatientNote;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field declarations and defaulting rules for {@link Patient}.
 *
 * <p>Defaults for absent fields: null scalars, empty diagnosis/medication/notes lists,
 * null insurance details.
 */
public final class PatientSchema implements RecordSchema<Patient> {

    public static final String COLLECTION = "patients";

    private static final List<FieldDescriptor> FIELDS = List.of(
        FieldDescriptor.scalar("firstName"),
        FieldDescriptor.scalar("lastName"),
        FieldDescriptor.scalar("email"),
        FieldDescriptor.scalar("phoneNumber"),
        FieldDescriptor.scalar("birthDate"),
        FieldDescriptor.scalar("ssn"),
        FieldDescriptor.list("diagnosis"),
        FieldDescriptor.list("medications"),
        FieldDescriptor.map("insuranceDetails"),
        FieldDescriptor.scalar("notes"),
        FieldDescriptor.list("notesHistory"),
        FieldDescriptor.scalar("createdAt"),
        FieldDescriptor.scalar("updatedAt"),
        FieldDescriptor.scalar("primaryDoctorId")
    );

    @Override
    public String entityKind() {
        return Patient.ENTITY_KIND;
    }

    @Override
    public String collection() {
        return COLLECTION;
    }

    @Override
    public List<FieldDescriptor> fields() {
        return FIELDS;
    }

    @Override
    public Optional<String> idOf(Patient record) {
        return Optional.ofNullable(record.getId());
    }

    @Override
    public Map<String, FieldValue> toFields(Patient patient) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        FieldValues.putIfPresent(fields, "firstName", FieldValue.text(patient.getFirstName()));
        FieldValues.putIfPresent(fields, "lastName", FieldValue.text(patient.getLastName()));
        FieldValues.putIfPresent(fields, "email", FieldValue.text(patient.getEmail()));
        FieldValues.putIfPresent(fields, "phoneNumber", FieldValue.text(patient.getPhoneNumber()));
        FieldValues.putIfPresent(fields, "birthDate", FieldValue.timestamp(patient.getBirthDate()));
        FieldValues.putIfPresent(fields, "ssn", FieldValue.text(patient.getSsn()));
        if (!patient.getDiagnosis().isEmpty()) {
            fields.put("diagnosis", FieldValue.ListValue.ofTexts(patient.getDiagnosis()));
        }
        if (!patient.getMedications().isEmpty()) {
            fields.put("medications", FieldValue.ListValue.ofTexts(patient.getMedications()));
        }
        if (patient.getInsuranceDetails() != null && !patient.getInsuranceDetails().isEmpty()) {
            fields.put("insuranceDetails", FieldValue.MapValue.ofTexts(patient.getInsuranceDetails()));
        }
        FieldValues.putIfPresent(fields, "notes", FieldValue.text(patient.getNotes()));
        if (!patient.getNotesHistory().isEmpty()) {
            List<FieldValue> notes = new ArrayList<>();
            for (PatientNote note : patient.getNotesHistory()) {
                notes.add(note.toFieldValue());
            }
            fields.put("notesHistory", new FieldValue.ListValue(notes));
        }
        FieldValues.putIfPresent(fields, "createdAt", FieldValue.timestamp(patient.getCreatedAt()));
        FieldValues.putIfPresent(fields, "updatedAt", FieldValue.timestamp(patient.getUpdatedAt()));
        FieldValues.putIfPresent(fields, "primaryDoctorId", FieldValue.objectRef(patient.getPrimaryDoctorId()));
        return fields;
    }

    @Override
    public Patient fromFields(String id, Map<String, FieldValue> fields) {
        List<PatientNote> notes = new ArrayList<>();
        for (FieldValue.MapValue note : FieldValues.mapList(fields, "notesHistory")) {
            notes.add(PatientNote.fromFieldValue(note));
        }
        return Patient.builder()
            .id(id)
            .firstName(FieldValues.text(fields, "firstName"))
            .lastName(FieldValues.text(fields, "lastName"))
            .email(FieldValues.text(fields, "email"))
            .phoneNumber(FieldValues.text(fields, "phoneNumber"))
            .birthDate(FieldValues.instant(fields, "birthDate"))
            .ssn(FieldValues.text(fields, "ssn"))
            .diagnosis(FieldValues.textList(fields, "diagnosis"))
            .medications(FieldValues.textList(fields, "medications"))
            .insuranceDetails(FieldValues.textMap(fields, "insuranceDetails"))
            .notes(FieldValues.text(fields, "notes"))
            .notesHistory(notes)
            .createdAt(FieldValues.instant(fields, "createdAt"))
            .updatedAt(FieldValues.instant(fields, "updatedAt"))
            .primaryDoctorId(FieldValues.objectRef(fields, "primaryDoctorId"))
            .build();
    }
}
