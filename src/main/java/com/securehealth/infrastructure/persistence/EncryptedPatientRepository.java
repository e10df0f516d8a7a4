package com.securehealth.infrastructure.persistence;

import com.securehealth.domain.model.Patient;
import com.securehealth.domain.repository.PatientRepository;
import com.securehealth.domain.schema.PatientSchema;
import com.securehealth.infrastructure.codec.DocumentCodec;
import com.securehealth.infrastructure.codec.EncryptedEqualityFilter;

public class EncryptedPatientRepository extends EncryptedRecordRepository<Patient> implements PatientRepository {

    public EncryptedPatientRepository(PatientSchema schema, DocumentCodec codec,
                                  EncryptedEqualityFilter filters, DocumentStore store) {
        super(schema, codec, filters, store);
    }
}
