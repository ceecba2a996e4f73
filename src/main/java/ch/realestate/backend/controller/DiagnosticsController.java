package ch.realestate.backend.controller;

import ch.realestate.backend.store.StoreContext;
import com.mongodb.MongoException;
import com.mongodb.client.MongoDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports whether the document store is configured and reachable. Never fails; problems are described in the body.
 */
@RestController
public class DiagnosticsController {

    private static final int MAX_COLLECTIONS = 10;

    private final StoreContext storeContext;
    private final boolean uriConfigured;

    public DiagnosticsController(StoreContext storeContext,
                                 @Value("${realestate.mongo.uri:}") String mongoUri) {
        this.storeContext = storeContext;
        this.uriConfigured = StringUtils.hasText(mongoUri);
    }

    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> testDatabase() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("backend", "Running");
        response.put("database", "Not Available");
        response.put("database_url", uriConfigured ? "Set" : "Not Set");
        response.put("database_name", null);
        response.put("connection_status", "Not Connected");
        response.put("collections", List.of());

        if (storeContext.database().isEmpty()) {
            return ResponseEntity.ok(response);
        }
        MongoDatabase database = storeContext.database().get();
        response.put("database", "Available");
        response.put("database_name", database.getName());
        response.put("connection_status", "Connected");
        try {
            List<String> names = database.listCollectionNames().into(new ArrayList<>());
            response.put("collections", names.subList(0, Math.min(MAX_COLLECTIONS, names.size())));
            response.put("database", "Connected & Working");
        } catch (MongoException ex) {
            response.put("database", "Connected but Error: " + abbreviate(ex.getMessage()));
        }
        return ResponseEntity.ok(response);
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "unknown";
        }
        return message.length() > 80 ? message.substring(0, 80) : message;
    }
}
