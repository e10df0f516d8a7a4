package com.securehealth.domain.schema;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.FieldValues;
import com.securehealth.domain.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field declarations and defaulting rules for {@link Message}.
 */
public final class MessageSchema implements RecordSchema<Message> {

    public static final String COLLECTION = "messages";

    private static final List<FieldDescriptor> FIELDS = List.of(
        FieldDescriptor.scalar("patientId"),
        FieldDescriptor.scalar("senderUserId"),
        FieldDescriptor.scalar("senderName"),
        FieldDescriptor.list("senderRoles"),
        FieldDescriptor.scalar("direction"),
        FieldDescriptor.list("recipientRoles"),
        FieldDescriptor.scalar("subject"),
        FieldDescriptor.scalar("body"),
        FieldDescriptor.scalar("createdAt"),
        FieldDescriptor.scalar("readByPatient"),
        FieldDescriptor.scalar("readByStaff"),
        FieldDescriptor.scalar("conversationId"),
        FieldDescriptor.scalar("parentMessageId"),
        FieldDescriptor.scalar("threadLevel"),
        FieldDescriptor.scalar("updatedAt")
    );

    @Override
    public String entityKind() {
        return Message.ENTITY_KIND;
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
    public Optional<String> idOf(Message record) {
        return Optional.ofNullable(record.getId());
    }

    @Override
    public Map<String, FieldValue> toFields(Message message) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        FieldValues.putIfPresent(fields, "patientId", FieldValue.objectRef(message.getPatientId()));
        FieldValues.putIfPresent(fields, "senderUserId", FieldValue.text(message.getSenderUserId()));
        FieldValues.putIfPresent(fields, "senderName", FieldValue.text(message.getSenderName()));
        fields.put("senderRoles", FieldValue.ListValue.ofTexts(message.getSenderRoles()));
        FieldValues.putIfPresent(fields, "direction", FieldValue.text(message.getDirection()));
        if (!message.getRecipientRoles().isEmpty()) {
            fields.put("recipientRoles", FieldValue.ListValue.ofTexts(message.getRecipientRoles()));
        }
        FieldValues.putIfPresent(fields, "subject", FieldValue.text(message.getSubject()));
        FieldValues.putIfPresent(fields, "body", FieldValue.text(message.getBody()));
        FieldValues.putIfPresent(fields, "createdAt", FieldValue.timestamp(message.getCreatedAt()));
        fields.put("readByPatient", new FieldValue.Bool(message.isReadByPatient()));
        fields.put("readByStaff", new FieldValue.Bool(message.isReadByStaff()));
        FieldValues.putIfPresent(fields, "conversationId", FieldValue.objectRef(message.getConversationId()));
        FieldValues.putIfPresent(fields, "parentMessageId", FieldValue.objectRef(message.getParentMessageId()));
        fields.put("threadLevel", new FieldValue.Numeric(message.getThreadLevel()));
        FieldValues.putIfPresent(fields, "updatedAt", FieldValue.timestamp(message.getUpdatedAt()));
        return fields;
    }

    @Override
    public Message fromFields(String id, Map<String, FieldValue> fields) {
        return Message.builder()
            .id(id)
            .patientId(FieldValues.objectRef(fields, "patientId"))
            .senderUserId(FieldValues.text(fields, "senderUserId"))
            .senderName(FieldValues.text(fields, "senderName"))
            .senderRoles(FieldValues.textList(fields, "senderRoles"))
            .direction(FieldValues.text(fields, "direction"))
            .recipientRoles(FieldValues.textList(fields, "recipientRoles"))
            .subject(FieldValues.text(fields, "subject"))
            .body(FieldValues.text(fields, "body"))
            .createdAt(FieldValues.instant(fields, "createdAt"))
            .readByPatient(FieldValues.bool(fields, "readByPatient", false))
            .readByStaff(FieldValues.bool(fields, "readByStaff", false))
            .conversationId(FieldValues.objectRef(fields, "conversationId"))
            .parentMessageId(FieldValues.objectRef(fields, "parentMessageId"))
            .threadLevel((int) FieldValues.longValue(fields, "threadLevel", 0))
            .updatedAt(FieldValues.instant(fields, "updatedAt"))
            .build();
    }
}
