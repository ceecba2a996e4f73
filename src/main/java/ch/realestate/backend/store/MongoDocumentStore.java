package ch.realestate.backend.store;

import ch.realestate.backend.query.Predicate;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoServerUnavailableException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private static final String ID = "_id";
    private static final String NOT_CONFIGURED = "Database not available";

    private final StoreContext storeContext;

    @Override
    public StoreResult<List<Document>> find(String collection, Predicate predicate) {
        Optional<MongoCollection<Document>> target = collection(collection);
        if (target.isEmpty()) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, NOT_CONFIGURED);
        }
        try {
            log.debug("find in {} with {}", collection, predicate);
            List<Document> docs = target.get().find(predicate.toBson()).into(new ArrayList<>());
            return StoreResult.ok(docs);
        } catch (RuntimeException ex) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, describe(ex));
        }
    }

    @Override
    public StoreResult<Document> findById(String collection, String id) {
        // an unconfigured store wins over a malformed id
        if (!storeContext.isAvailable()) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, NOT_CONFIGURED);
        }
        if (id == null || !ObjectId.isValid(id)) {
            return StoreResult.failure(StoreError.INVALID_IDENTIFIER, "Invalid id: " + id);
        }
        Document doc;
        try {
            doc = storeContext.database().get().getCollection(collection)
                    .find(new Document(ID, new ObjectId(id))).first();
        } catch (RuntimeException ex) {
            // driver failures and documents the codecs cannot decode
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, describe(ex));
        }
        if (doc == null) {
            return StoreResult.failure(StoreError.NOT_FOUND, "No document " + id + " in " + collection);
        }
        return StoreResult.ok(doc);
    }

    @Override
    public StoreResult<String> insert(String collection, Document document) {
        if (document.containsKey(ID)) {
            return StoreResult.failure(StoreError.WRITE_ERROR, "Document already carries an identity");
        }
        Optional<MongoCollection<Document>> target = collection(collection);
        if (target.isEmpty()) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, NOT_CONFIGURED);
        }
        // the driver writes the generated _id into the inserted instance, keep the caller's copy untouched
        Document toInsert = new Document(document);
        try {
            target.get().insertOne(toInsert);
        } catch (MongoException ex) {
            StoreError kind = isUnreachable(ex) ? StoreError.STORE_UNAVAILABLE : StoreError.WRITE_ERROR;
            return StoreResult.failure(kind, describe(ex));
        } catch (RuntimeException ex) {
            // codec failures for values the driver cannot encode
            return StoreResult.failure(StoreError.WRITE_ERROR, describe(ex));
        }
        String id = toInsert.getObjectId(ID).toString();
        log.debug("inserted {} into {}", id, collection);
        return StoreResult.ok(id);
    }

    @Override
    public StoreResult<Long> count(String collection) {
        Optional<MongoCollection<Document>> target = collection(collection);
        if (target.isEmpty()) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, NOT_CONFIGURED);
        }
        try {
            return StoreResult.ok(target.get().countDocuments());
        } catch (RuntimeException ex) {
            return StoreResult.failure(StoreError.STORE_UNAVAILABLE, describe(ex));
        }
    }

    private Optional<MongoCollection<Document>> collection(String name) {
        return storeContext.database().map(db -> db.getCollection(name));
    }

    static boolean isUnreachable(MongoException ex) {
        return ex instanceof MongoTimeoutException
                || ex instanceof MongoSocketException
                || ex instanceof MongoServerUnavailableException
                || ex instanceof MongoExecutionTimeoutException;
    }

    private static String describe(RuntimeException ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return message.length() > 200 ? message.substring(0, 200) : message;
    }
}
