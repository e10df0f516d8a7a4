package com.securehealth.infrastructure.persistence;

import com.securehealth.infrastructure.codec.BsonValues;
import com.securehealth.infrastructure.codec.DocumentCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;

import java.util.List;
import java.util.Optional;

/**
 * {@link DocumentStore} over {@link MongoTemplate}. Store errors propagate as Spring
 * {@code DataAccessException}s.
 */
@RequiredArgsConstructor
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Document> get(String collection, String id) {
        return Optional.ofNullable(mongoTemplate.findById(BsonValues.toId(id), Document.class, collection));
    }

    @Override
    public List<Document> find(String collection, Document filter) {
        List<Document> documents = mongoTemplate.find(new BasicQuery(filter), Document.class, collection);
        log.debug("Found {} documents in {} matching {} criteria", documents.size(), collection, filter.size());
        return documents;
    }

    @Override
    public String put(String collection, Document document) {
        if (document.get(DocumentCodec.ID_FIELD) == null) {
            document.put(DocumentCodec.ID_FIELD, new ObjectId());
        }
        mongoTemplate.save(document, collection);
        return BsonValues.idToString(document.get(DocumentCodec.ID_FIELD));
    }
}
