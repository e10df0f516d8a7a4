package com.securehealth.infrastructure.codec;

import com.securehealth.config.PerformanceConfiguration.PhiMetrics;
import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.schema.FieldDescriptor;
import com.securehealth.domain.schema.RecordSchema;
import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.crypto.CryptoException;
import com.securehealth.infrastructure.crypto.CryptoService;
import com.securehealth.infrastructure.crypto.DecryptionFailureException;
import com.securehealth.infrastructure.crypto.FieldValueCanonicalizer;
import com.securehealth.infrastructure.crypto.SchemaDriftException;
import com.securehealth.infrastructure.crypto.StorageValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain records to storage documents and back.
 *
 * <p>Writes encrypt every governed field and abort on any encryption failure. Reads never fail on
 * a single field: an undecryptable or undecodable field is replaced by its typed default, audited,
 * and the rest of the record is still assembled.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
@RequiredArgsConstructor
public class DocumentCodec {

    public static final String ID_FIELD = "_id";
    private static final String ACTOR = "phi-codec";

    private final CryptoService cryptoService;
    private final FieldValueCanonicalizer canonicalizer;
    private final AuditService auditService;
    private final PhiMetrics metrics;

    /**
     * @throws com.securehealth.infrastructure.crypto.KeyUnavailableException if the data key cannot be resolved
     * @throws com.securehealth.infrastructure.crypto.EncryptionFailureException if a field cannot be encrypted
     */
    public <T> Document toStorage(RecordSchema<T> schema, T record) {
        Document document = new Document();
        schema.idOf(record).ifPresent(id -> document.put(ID_FIELD, BsonValues.toId(id)));

        Map<String, FieldValue> fields = schema.toFields(record);
        for (FieldDescriptor descriptor : schema.fields()) {
            FieldValue value = fields.get(descriptor.name());
            if (value == null) {
                continue;
            }
            StorageValue stored = cryptoService.encrypt(schema.entityKind(), descriptor.name(), value);
            document.put(descriptor.name(), BsonValues.toBson(stored));
        }
        return document;
    }

    public <T> T fromStorage(RecordSchema<T> schema, Document document) {
        String id = BsonValues.idToString(document.get(ID_FIELD));
        return schema.fromFields(id, decryptFields(schema, document));
    }

    /**
     * Decrypted, decanonicalized values of the declared fields present in the document.
     * Unreadable fields carry their shape's empty value ({@code null} scalars are omitted).
     */
    public Map<String, FieldValue> decryptFields(RecordSchema<?> schema, Document document) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : schema.fields()) {
            if (!document.containsKey(descriptor.name())) {
                continue;
            }
            FieldValue value;
            try {
                FieldValue decrypted = cryptoService.decrypt(BsonValues.decode(document.get(descriptor.name())));
                value = canonicalizer.decanonicalize(decrypted, descriptor.shape());
            } catch (DecryptionFailureException e) {
                metrics.recordDecryptionFailure(schema.entityKind());
                value = recover(AuditEventKind.DECRYPTION_FAILURE, schema, descriptor, document, e);
            } catch (SchemaDriftException e) {
                metrics.recordSchemaDrift(schema.entityKind());
                value = recover(AuditEventKind.SCHEMA_DRIFT, schema, descriptor, document, e);
            }
            if (value != null) {
                fields.put(descriptor.name(), value);
            }
        }
        return fields;
    }

    private FieldValue recover(AuditEventKind kind, RecordSchema<?> schema, FieldDescriptor descriptor,
                               Document document, CryptoException error) {
        String recordId = BsonValues.idToString(document.get(ID_FIELD));
        log.warn("{} on {}.{} of record {}, substituting default: {}",
            kind, schema.entityKind(), descriptor.name(), recordId, error.getMessage());
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("entityKind", schema.entityKind());
        metadata.put("field", descriptor.name());
        metadata.put("recordId", String.valueOf(recordId));
        metadata.put("error", error.getClass().getSimpleName());
        auditService.record(kind, ACTOR, metadata);
        return descriptor.shape().emptyValue();
    }
}
