package com.securehealth.infrastructure.persistence;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.repository.RecordRepository;
import com.securehealth.domain.schema.RecordSchema;
import com.securehealth.infrastructure.codec.DocumentCodec;
import com.securehealth.infrastructure.codec.EncryptedEqualityFilter;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository that runs every write and read through the {@link DocumentCodec}.
 *
 * @param <T> record type
 */
@Slf4j
public class EncryptedRecordRepository<T> implements RecordRepository<T> {

    private final RecordSchema<T> schema;
    private final DocumentCodec codec;
    private final EncryptedEqualityFilter filters;
    private final DocumentStore store;

    public EncryptedRecordRepository(RecordSchema<T> schema, DocumentCodec codec,
                                     EncryptedEqualityFilter filters, DocumentStore store) {
        this.schema = schema;
        this.codec = codec;
        this.filters = filters;
        this.store = store;
    }

    @Override
    public T save(T record) {
        Document document = codec.toStorage(schema, record);
        String id = store.put(schema.collection(), document);
        log.debug("Saved {} {}", schema.entityKind(), id);
        return schema.fromFields(id, schema.toFields(record));
    }

    @Override
    public Optional<T> findById(String id) {
        return store.get(schema.collection(), id).map(document -> codec.fromStorage(schema, document));
    }

    @Override
    public List<T> findByEquality(Map<String, FieldValue> criteria) {
        if (criteria.isEmpty()) {
            throw new IllegalArgumentException("At least one criterion is required");
        }
        Document filter = filters.build(schema.entityKind(), criteria);
        List<T> records = new ArrayList<>();
        for (Document document : store.find(schema.collection(), filter)) {
            records.add(codec.fromStorage(schema, document));
        }
        return records;
    }
}
