package com.securehealth.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation thread grouping messages about one patient.
 */
@Value
@Builder(toBuilder = true)
public class Conversation {

    public static final String ENTITY_KIND = "conversation";

    public static final String STATUS_ACTIVE = "active";

    String id;
    String patientId;
    String subject;
    @Singular
    List<String> participants;
    @Builder.Default
    String status = STATUS_ACTIVE;
    Instant createdAt;
    Instant lastMessageAt;
    int messageCount;
    String lastMessagePreview;
    boolean hasUnreadForPatient;
    boolean hasUnreadForStaff;

    public Conversation withParticipant(String userId) {
        if (participants.contains(userId)) {
            return this;
        }
        return toBuilder().participant(userId).build();
    }

    public Conversation withoutParticipant(String userId) {
        List<String> remaining = new ArrayList<>(participants);
        remaining.remove(userId);
        return toBuilder().clearParticipants().participants(remaining).build();
    }

    /**
     * Records a new message in the thread.
     */
    public Conversation withMessage(String preview, Instant at) {
        return toBuilder()
            .messageCount(messageCount + 1)
            .lastMessagePreview(preview)
            .lastMessageAt(at)
            .build();
    }
}
