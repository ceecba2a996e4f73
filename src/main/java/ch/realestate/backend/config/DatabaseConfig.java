package ch.realestate.backend.config;

import ch.realestate.backend.store.StoreContext;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ServerApi;
import com.mongodb.ServerApiVersion;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class DatabaseConfig {

    @Bean(destroyMethod = "close")
    public StoreContext storeContext(
            @Value("${realestate.mongo.uri:}") String mongoUri,
            @Value("${realestate.mongo.database:realestate}") String databaseName,
            @Value("${realestate.mongo.server-selection-timeout-ms:5000}") long serverSelectionTimeoutMs
    ) {
        if (!StringUtils.hasText(mongoUri)) {
            log.warn("realestate.mongo.uri is not set, document store unavailable");
            return StoreContext.unavailable();
        }

        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings.Builder settingsBuilder = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS));

        // MongoDB Atlas requires Stable API versioning for newer clusters
        settingsBuilder.serverApi(ServerApi.builder()
                .version(ServerApiVersion.V1)
                .build());

        log.info("Using MongoDB database '{}'", databaseName);
        return StoreContext.connected(MongoClients.create(settingsBuilder.build()), databaseName);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
