package ch.realestate.backend.query;

import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * A single condition of a {@link Predicate}. A constraint renders itself as a MongoDB filter and can also be
 * evaluated against a document already in memory; both forms must select the same documents.
 */
public interface Constraint {

    Bson toBson();

    boolean matches(Document document);
}
