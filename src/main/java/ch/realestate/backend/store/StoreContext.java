package ch.realestate.backend.store;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.io.Closeable;
import java.util.Optional;

/**
 * Process-wide handle on the document store, created once at start-up and shared read-only. A context without a
 * database models a deployment where no store is configured.
 */
public final class StoreContext implements Closeable {

    private final MongoClient client;
    private final MongoDatabase database;

    private StoreContext(MongoClient client, MongoDatabase database) {
        this.client = client;
        this.database = database;
    }

    public static StoreContext connected(MongoClient client, String databaseName) {
        return new StoreContext(client, client.getDatabase(databaseName));
    }

    public static StoreContext of(MongoDatabase database) {
        return new StoreContext(null, database);
    }

    public static StoreContext unavailable() {
        return new StoreContext(null, null);
    }

    public Optional<MongoDatabase> database() {
        return Optional.ofNullable(database);
    }

    public boolean isAvailable() {
        return database != null;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }
}
