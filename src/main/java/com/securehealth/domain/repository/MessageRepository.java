package com.securehealth.domain.repository;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Message;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public interface MessageRepository extends RecordRepository<Message> {

    /**
     * Messages of a conversation, oldest first.
     */
    default List<Message> findByConversationId(String conversationId) {
        return findByEquality(Map.of("conversationId", new FieldValue.ObjectRef(conversationId))).stream()
            .sorted(Comparator.comparing(Message::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .collect(Collectors.toList());
    }

    default List<Message> findByPatientId(String patientId) {
        return findByEquality(Map.of("patientId", new FieldValue.ObjectRef(patientId)));
    }
}
