package com.securehealth.infrastructure.persistence;

import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * Minimal document store port. Documents passed in are already in their at-rest form.
 */
public interface DocumentStore {

    Optional<Document> get(String collection, String id);

    List<Document> find(String collection, Document filter);

    /**
     * Inserts or replaces the document by its {@code _id}, assigning one if absent.
     *
     * @return the document's identifier
     */
    String put(String collection, Document document);
}
