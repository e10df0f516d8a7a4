package com.securehealth.domain.repository;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Patient;

import java.util.List;
import java.util.Map;

public interface PatientRepository extends RecordRepository<Patient> {

    default List<Patient> findByEmail(String email) {
        return findByEquality(Map.of("email", new FieldValue.Text(email)));
    }
}
