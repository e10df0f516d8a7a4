package com.securehealth.infrastructure.keyvault;

import com.securehealth.infrastructure.crypto.KeyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Optional;
import java.util.UUID;

/**
 * Key vault store backed by a MongoDB collection with a unique, partial index on
 * {@code keyAltNames}. Any store error other than a duplicate key surfaces as
 * {@link KeyUnavailableException}.
 */
@Slf4j
public class MongoKeyVaultStore implements KeyVaultStore {

    static final String ALT_NAMES_FIELD = "keyAltNames";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoKeyVaultStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
    }

    /**
     * Creates the alt name uniqueness index if it does not exist yet.
     */
    public void ensureIndexes() {
        try {
            mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on(ALT_NAMES_FIELD, Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(Criteria.where(ALT_NAMES_FIELD).exists(true))));
            log.info("Key vault index on {}.{} verified", collection, ALT_NAMES_FIELD);
        } catch (DataAccessException e) {
            throw new KeyUnavailableException("Key vault index could not be created on " + collection, e);
        }
    }

    @Override
    public Optional<DataKey> findByAltName(String altName) {
        try {
            DataKeyDocument document = mongoTemplate.findOne(
                Query.query(Criteria.where(ALT_NAMES_FIELD).is(altName)), DataKeyDocument.class, collection);
            return Optional.ofNullable(document).map(DataKeyDocument::toDataKey);
        } catch (DataAccessException e) {
            throw new KeyUnavailableException("Key vault unreachable while looking up '" + altName + "'", e);
        }
    }

    @Override
    public Optional<DataKey> findById(UUID id) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, DataKeyDocument.class, collection))
                .map(DataKeyDocument::toDataKey);
        } catch (DataAccessException e) {
            throw new KeyUnavailableException("Key vault unreachable while looking up key " + id, e);
        }
    }

    @Override
    public InsertOutcome insert(DataKey dataKey) {
        try {
            mongoTemplate.insert(DataKeyDocument.from(dataKey), collection);
            return InsertOutcome.INSERTED;
        } catch (DuplicateKeyException e) {
            log.debug("Data key '{}' already exists in {}", dataKey.getAltName(), collection);
            return InsertOutcome.CONFLICT;
        } catch (DataAccessException e) {
            throw new KeyUnavailableException("Key vault unreachable while inserting '" + dataKey.getAltName() + "'", e);
        }
    }
}
