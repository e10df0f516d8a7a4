package com.securehealth.config;

import com.securehealth.config.PerformanceConfiguration.PhiMetrics;
import com.securehealth.domain.repository.ConversationRepository;
import com.securehealth.domain.repository.MessageRepository;
import com.securehealth.domain.repository.PatientRepository;
import com.securehealth.domain.schema.ConversationSchema;
import com.securehealth.domain.schema.MessageSchema;
import com.securehealth.domain.schema.PatientSchema;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.codec.DocumentCodec;
import com.securehealth.infrastructure.codec.EncryptedEqualityFilter;
import com.securehealth.infrastructure.crypto.CryptoService;
import com.securehealth.infrastructure.crypto.FieldValueCanonicalizer;
import com.securehealth.infrastructure.persistence.DocumentStore;
import com.securehealth.infrastructure.persistence.EncryptedConversationRepository;
import com.securehealth.infrastructure.persistence.EncryptedMessageRepository;
import com.securehealth.infrastructure.persistence.EncryptedPatientRepository;
import com.securehealth.infrastructure.persistence.MongoDocumentStore;
import com.securehealth.infrastructure.security.RoleProjection;
import com.securehealth.infrastructure.security.ViewPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wiring of schemas, the document codec, encrypted repositories and role projection.
 */
@Configuration
@Slf4j
public class PersistenceConfiguration {

    @Bean
    public PatientSchema patientSchema() {
        return new PatientSchema();
    }

    @Bean
    public MessageSchema messageSchema() {
        return new MessageSchema();
    }

    @Bean
    public ConversationSchema conversationSchema() {
        return new ConversationSchema();
    }

    @Bean
    public DocumentCodec documentCodec(CryptoService cryptoService, FieldValueCanonicalizer canonicalizer,
                                       AuditService auditService, PhiMetrics metrics) {
        return new DocumentCodec(cryptoService, canonicalizer, auditService, metrics);
    }

    @Bean
    public EncryptedEqualityFilter encryptedEqualityFilter(CryptoService cryptoService) {
        return new EncryptedEqualityFilter(cryptoService);
    }

    @Bean
    public DocumentStore documentStore(MongoTemplate mongoTemplate) {
        return new MongoDocumentStore(mongoTemplate);
    }

    @Bean
    public PatientRepository patientRepository(PatientSchema schema, DocumentCodec codec,
                                               EncryptedEqualityFilter filters, DocumentStore store) {
        return new EncryptedPatientRepository(schema, codec, filters, store);
    }

    @Bean
    public MessageRepository messageRepository(MessageSchema schema, DocumentCodec codec,
                                               EncryptedEqualityFilter filters, DocumentStore store) {
        return new EncryptedMessageRepository(schema, codec, filters, store);
    }

    @Bean
    public ConversationRepository conversationRepository(ConversationSchema schema, DocumentCodec codec,
                                                         EncryptedEqualityFilter filters, DocumentStore store) {
        return new EncryptedConversationRepository(schema, codec, filters, store);
    }

    @Bean
    public RoleProjection roleProjection(ViewPolicyProperties properties) {
        Map<String, ViewPolicy> policies = new LinkedHashMap<>(ViewPolicy.defaults());
        properties.getViews().forEach((kind, view) -> {
            log.info("Overriding view policy for '{}' with roles {}", kind, view.getRoles().keySet());
            policies.put(kind, new ViewPolicy(kind, view.getBaseFields(), view.getRoles()));
        });
        return new RoleProjection(policies);
    }
}
