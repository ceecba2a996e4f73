package ch.realestate.backend.serialization;

import org.bson.Document;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps stored documents to their external representation: the store identity {@code _id} becomes a string
 * {@code id}, top-level timestamps become ISO-8601 strings, everything else is passed through as is.
 */
@Component
public class DocumentSerializer {

    static final String STORE_ID = "_id";
    static final String ID = "id";

    public Map<String, Object> serialize(Document document) {
        if (document == null || document.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (STORE_ID.equals(entry.getKey())) {
                continue;
            }
            out.put(entry.getKey(), toExternal(entry.getValue()));
        }
        if (document.containsKey(STORE_ID)) {
            Object id = document.get(STORE_ID);
            out.put(ID, id != null ? id.toString() : null);
        }
        return out;
    }

    public List<Map<String, Object>> serializeAll(List<Document> documents) {
        return documents.stream().map(this::serialize).collect(Collectors.toList());
    }

    static Object toExternal(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atOffset(ZoneOffset.UTC).toInstant().toString();
        }
        if (value instanceof Temporal) {
            // OffsetDateTime, ZonedDateTime, LocalDate: their toString is already ISO-8601
            return value.toString();
        }
        return value;
    }
}
