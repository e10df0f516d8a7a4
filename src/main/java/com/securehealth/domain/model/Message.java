package com.securehealth.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Secure message between a patient and staff, optionally threaded in a conversation.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public static final String ENTITY_KIND = "message";

    public static final String TO_PATIENT = "to_patient";
    public static final String TO_STAFF = "to_staff";

    String id;
    String patientId;
    String senderUserId;
    String senderName;
    @Singular
    List<String> senderRoles;
    String direction;
    @Singular
    List<String> recipientRoles;
    String subject;
    String body;
    Instant createdAt;
    boolean readByPatient;
    boolean readByStaff;
    String conversationId;
    String parentMessageId;
    int threadLevel;
    Instant updatedAt;

    public boolean isReply() {
        return threadLevel > 0;
    }
}
