package com.securehealth.infrastructure.persistence;

import com.securehealth.domain.model.Conversation;
import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Message;
import com.securehealth.domain.model.Patient;
import com.securehealth.domain.schema.ConversationSchema;
import com.securehealth.domain.schema.MessageSchema;
import com.securehealth.domain.schema.PatientSchema;
import com.securehealth.support.PhiTestFixtures;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EncryptedRecordRepositoryTest {

    private final PhiTestFixtures fixtures = new PhiTestFixtures();
    private final InMemoryDocumentStore store = fixtures.documentStore;

    private final EncryptedPatientRepository patients = new EncryptedPatientRepository(
        new PatientSchema(), fixtures.codec, fixtures.filters, store);
    private final EncryptedMessageRepository messages = new EncryptedMessageRepository(
        new MessageSchema(), fixtures.codec, fixtures.filters, store);
    private final EncryptedConversationRepository conversations = new EncryptedConversationRepository(
        new ConversationSchema(), fixtures.codec, fixtures.filters, store);

    @Test
    void saveAssignsIdAndStoresCiphertext() {
        Patient saved = patients.save(Patient.builder()
            .firstName("Jane")
            .lastName("Doe")
            .email("jane@example.com")
            .ssn("123-45-6789")
            .addDiagnosis("Hypertension")
            .build());

        assertNotNull(saved.getId());
        assertTrue(ObjectId.isValid(saved.getId()));
        Document raw = store.raw(PatientSchema.COLLECTION, saved.getId());
        assertInstanceOf(Binary.class, raw.get("ssn"));
        assertInstanceOf(Binary.class, raw.get("email"));
        assertFalse(raw.toJson().contains("Jane"));

        Optional<Patient> loaded = patients.findById(saved.getId());
        assertTrue(loaded.isPresent());
        assertEquals(saved, loaded.get());
    }

    @Test
    void findByIdOfUnknownRecordIsEmpty() {
        assertTrue(patients.findById(new ObjectId().toHexString()).isEmpty());
    }

    @Test
    void findsPatientsByEncryptedEmail() {
        patients.save(Patient.builder().lastName("Doe").email("jane@example.com").build());
        patients.save(Patient.builder().lastName("Roe").email("rick@example.com").build());

        List<Patient> found = patients.findByEmail("jane@example.com");

        assertEquals(1, found.size());
        assertEquals("Doe", found.get(0).getLastName());
        assertTrue(patients.findByEmail("nobody@example.com").isEmpty());
    }

    @Test
    void combinedCriteriaMustAllMatch() {
        patients.save(Patient.builder().firstName("Jane").lastName("Doe").build());
        patients.save(Patient.builder().firstName("John").lastName("Doe").build());

        List<Patient> found = patients.findByEquality(Map.of(
            "firstName", new FieldValue.Text("Jane"),
            "lastName", new FieldValue.Text("Doe")));

        assertEquals(1, found.size());
        assertEquals(2, patients.findByEquality(Map.of("lastName", new FieldValue.Text("Doe"))).size());
    }

    @Test
    void emptyOrRandomCriteriaAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> patients.findByEquality(Map.of()));
        assertThrows(IllegalArgumentException.class,
            () -> patients.findByEquality(Map.of("diagnosis", FieldValue.ListValue.ofTexts(List.of("x")))));
    }

    @Test
    void conversationMessagesAreReturnedOldestFirst() {
        String patientId = new ObjectId().toHexString();
        Conversation conversation = conversations.save(Conversation.builder()
            .patientId(patientId)
            .subject("Lab results")
            .participant("ROLE_DOCTOR")
            .createdAt(Instant.parse("2024-03-01T09:00:00Z"))
            .build());
        String otherConversation = new ObjectId().toHexString();

        messages.save(message(patientId, conversation.getId(), "second", "2024-03-01T10:05:00Z"));
        messages.save(message(patientId, conversation.getId(), "first", "2024-03-01T10:00:00Z"));
        messages.save(message(patientId, otherConversation, "elsewhere", "2024-03-01T10:01:00Z"));

        List<Message> thread = messages.findByConversationId(conversation.getId());

        assertEquals(List.of("first", "second"), thread.stream().map(Message::getBody).toList());
        assertEquals(3, messages.findByPatientId(patientId).size());
        assertEquals(1, conversations.findByPatientId(patientId).size());
        assertEquals(Conversation.STATUS_ACTIVE, conversations.findByPatientId(patientId).get(0).getStatus());
    }

    private static Message message(String patientId, String conversationId, String body, String createdAt) {
        return Message.builder()
            .patientId(patientId)
            .conversationId(conversationId)
            .senderName("Dr. House")
            .senderRole("ROLE_DOCTOR")
            .direction(Message.TO_PATIENT)
            .body(body)
            .createdAt(Instant.parse(createdAt))
            .build();
    }
}
