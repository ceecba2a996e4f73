package ch.realestate.backend.store;

import ch.realestate.backend.query.Predicate;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DocumentStore double keeping collections in memory and evaluating predicates with {@link Predicate#matches}.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, List<Document>> collections = new HashMap<>();
    private final Set<String> rejectedTitles = new HashSet<>();
    private int insertCalls;

    /** Inserts of documents with this title fail with a write error. */
    public InMemoryDocumentStore rejectTitle(String title) {
        rejectedTitles.add(title);
        return this;
    }

    public int getInsertCalls() {
        return insertCalls;
    }

    public List<Document> contents(String collection) {
        return collections.getOrDefault(collection, List.of());
    }

    @Override
    public StoreResult<List<Document>> find(String collection, Predicate predicate) {
        return StoreResult.ok(contents(collection).stream()
                .filter(predicate::matches)
                .map(Document::new)
                .collect(Collectors.toList()));
    }

    @Override
    public StoreResult<Document> findById(String collection, String id) {
        if (id == null || !ObjectId.isValid(id)) {
            return StoreResult.failure(StoreError.INVALID_IDENTIFIER, "Invalid id: " + id);
        }
        ObjectId oid = new ObjectId(id);
        return contents(collection).stream()
                .filter(doc -> oid.equals(doc.getObjectId("_id")))
                .findFirst()
                .map(doc -> StoreResult.ok(new Document(doc)))
                .orElseGet(() -> StoreResult.failure(StoreError.NOT_FOUND, "No document " + id));
    }

    @Override
    public StoreResult<String> insert(String collection, Document document) {
        insertCalls++;
        if (rejectedTitles.contains(document.getString("title"))) {
            return StoreResult.failure(StoreError.WRITE_ERROR, "rejected");
        }
        ObjectId id = new ObjectId();
        Document stored = new Document(document).append("_id", id);
        collections.computeIfAbsent(collection, name -> new ArrayList<>()).add(stored);
        return StoreResult.ok(id.toHexString());
    }

    @Override
    public StoreResult<Long> count(String collection) {
        return StoreResult.ok((long) contents(collection).size());
    }
}
