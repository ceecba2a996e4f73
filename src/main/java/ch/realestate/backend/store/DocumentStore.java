package ch.realestate.backend.store;

import ch.realestate.backend.query.Predicate;
import org.bson.Document;

import java.util.List;

/**
 * Access to named collections of the document store. Operations never throw for store failures; they report them
 * through {@link StoreResult}.
 */
public interface DocumentStore {

    /**
     * All documents of {@code collection} selected by {@code predicate}.
     */
    StoreResult<List<Document>> find(String collection, Predicate predicate);

    /**
     * The document with the given identity; {@link StoreError#INVALID_IDENTIFIER} for a malformed token and
     * {@link StoreError#NOT_FOUND} when nothing matches.
     */
    StoreResult<Document> findById(String collection, String id);

    /**
     * Inserts a document that has no identity yet and returns the identity the store assigned.
     */
    StoreResult<String> insert(String collection, Document document);

    StoreResult<Long> count(String collection);
}
