package com.securehealth.domain.schema;

import com.securehealth.domain.model.Conversation;
import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.FieldValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field declarations and defaulting rules for {@link Conversation}.
 *
 * <p>A missing status reads as {@code active}; counters and unread flags default to zero/false.
 */
public final class ConversationSchema implements RecordSchema<Conversation> {

    public static final String COLLECTION = "conversations";

    private static final List<FieldDescriptor> FIELDS = List.of(
        FieldDescriptor.scalar("patientId"),
        FieldDescriptor.scalar("subject"),
        FieldDescriptor.list("participants"),
        FieldDescriptor.scalar("status"),
        FieldDescriptor.scalar("createdAt"),
        FieldDescriptor.scalar("lastMessageAt"),
        FieldDescriptor.scalar("messageCount"),
        FieldDescriptor.scalar("lastMessagePreview"),
        FieldDescriptor.scalar("hasUnreadForPatient"),
        FieldDescriptor.scalar("hasUnreadForStaff")
    );

    @Override
    public String entityKind() {
        return Conversation.ENTITY_KIND;
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
    public Optional<String> idOf(Conversation record) {
        return Optional.ofNullable(record.getId());
    }

    @Override
    public Map<String, FieldValue> toFields(Conversation conversation) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        FieldValues.putIfPresent(fields, "patientId", FieldValue.objectRef(conversation.getPatientId()));
        FieldValues.putIfPresent(fields, "subject", FieldValue.text(conversation.getSubject()));
        fields.put("participants", FieldValue.ListValue.ofTexts(conversation.getParticipants()));
        FieldValues.putIfPresent(fields, "status", FieldValue.text(conversation.getStatus()));
        FieldValues.putIfPresent(fields, "createdAt", FieldValue.timestamp(conversation.getCreatedAt()));
        FieldValues.putIfPresent(fields, "lastMessageAt", FieldValue.timestamp(conversation.getLastMessageAt()));
        fields.put("messageCount", new FieldValue.Numeric(conversation.getMessageCount()));
        FieldValues.putIfPresent(fields, "lastMessagePreview", FieldValue.text(conversation.getLastMessagePreview()));
        fields.put("hasUnreadForPatient", new FieldValue.Bool(conversation.isHasUnreadForPatient()));
        fields.put("hasUnreadForStaff", new FieldValue.Bool(conversation.isHasUnreadForStaff()));
        return fields;
    }

    @Override
    public Conversation fromFields(String id, Map<String, FieldValue> fields) {
        String status = FieldValues.text(fields, "status");
        return Conversation.builder()
            .id(id)
            .patientId(FieldValues.objectRef(fields, "patientId"))
            .subject(FieldValues.text(fields, "subject"))
            .participants(FieldValues.textList(fields, "participants"))
            .status(status != null ? status : Conversation.STATUS_ACTIVE)
            .createdAt(FieldValues.instant(fields, "createdAt"))
            .lastMessageAt(FieldValues.instant(fields, "lastMessageAt"))
            .messageCount((int) FieldValues.longValue(fields, "messageCount", 0))
            .lastMessagePreview(FieldValues.text(fields, "lastMessagePreview"))
            .hasUnreadForPatient(FieldValues.bool(fields, "hasUnreadForPatient", false))
            .hasUnreadForStaff(FieldValues.bool(fields, "hasUnreadForStaff", false))
            .build();
    }
}
