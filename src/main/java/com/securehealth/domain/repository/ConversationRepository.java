package com.securehealth.domain.repository;

import com.securehealth.domain.model.Conversation;
import com.securehealth.domain.model.FieldValue;

import java.util.List;
import java.util.Map;

public interface ConversationRepository extends RecordRepository<Conversation> {

    default List<Conversation> findByPatientId(String patientId) {
        return findByEquality(Map.of("patientId", new FieldValue.ObjectRef(patientId)));
    }
}
