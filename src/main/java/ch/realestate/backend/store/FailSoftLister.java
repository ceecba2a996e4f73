package ch.realestate.backend.store;

import ch.realestate.backend.query.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read policy for listing endpoints: any failure of the underlying {@link DocumentStore#find} call, reported or
 * thrown, becomes an empty result. An outage therefore looks like "no matching documents" to callers; the failure
 * is only visible in the log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailSoftLister {

    private final DocumentStore documentStore;

    public List<Document> list(String collection, Predicate predicate) {
        StoreResult<List<Document>> result;
        try {
            result = documentStore.find(collection, predicate);
        } catch (RuntimeException ex) {
            log.warn("Listing {} failed, returning no results", collection, ex);
            return List.of();
        }
        if (!result.isOk()) {
            log.warn("Listing {} failed with {} ({}), returning no results",
                    collection, result.getError(), result.getMessage());
        }
        return result.orElse(List.of());
    }
}
