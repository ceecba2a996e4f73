package ch.realestate.backend.seed;

import ch.realestate.backend.models.Property;
import ch.realestate.backend.models.PropertyFields;
import ch.realestate.backend.store.DocumentStore;
import ch.realestate.backend.store.StoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fills an empty property collection with a fixed set of sample listings. Once the collection holds any document,
 * seeding does nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PropertySeeder {

    private final DocumentStore documentStore;
    private final Clock clock;

    /**
     * Inserts the sample listings one by one if the collection is empty. A failed insert is logged and skipped.
     *
     * @return the number of listings inserted, 0 when the collection was already populated
     */
    public StoreResult<Integer> seed() {
        StoreResult<Long> existing = documentStore.count(PropertyFields.COLLECTION);
        if (!existing.isOk()) {
            return StoreResult.failure(existing.getError(), existing.getMessage());
        }
        if (existing.getValue() > 0) {
            log.debug("Collection {} already holds {} documents, skipping seed",
                    PropertyFields.COLLECTION, existing.getValue());
            return StoreResult.ok(0);
        }

        int inserted = 0;
        for (Property sample : sampleProperties(Instant.now(clock))) {
            StoreResult<String> result = documentStore.insert(PropertyFields.COLLECTION, sample.toDocument());
            if (result.isOk()) {
                inserted++;
            } else {
                log.warn("Skipping sample '{}': {} ({})", sample.getTitle(), result.getError(), result.getMessage());
            }
        }
        log.info("Seeded {} sample properties", inserted);
        return StoreResult.ok(inserted);
    }

    static List<Property> sampleProperties(Instant listedAt) {
        return List.of(
                Property.builder()
                        .title("Modern Family House")
                        .description("Spacious 4-bedroom home with open floor plan and large backyard.")
                        .price(549000)
                        .address("123 Maple Street")
                        .city("Springfield")
                        .state("IL")
                        .zipCode("62704")
                        .bedrooms(4)
                        .bathrooms(2.5)
                        .areaSqft(2400)
                        .propertyType("House")
                        .images(List.of(
                                "https://images.unsplash.com/photo-1572120360610-d971b9d7767c",
                                "https://images.unsplash.com/photo-1560518883-ce09059eeffa"))
                        .amenities(List.of("Garage", "Garden", "Central Air"))
                        .featured(true)
                        .status("For Sale")
                        .listedAt(listedAt)
                        .build(),
                Property.builder()
                        .title("Downtown City Apartment")
                        .description("Stylish 2-bed apartment close to shops, cafes, and public transit.")
                        .price(329000)
                        .address("456 Oak Avenue, Apt 12B")
                        .city("Metro City")
                        .state("NY")
                        .zipCode("10001")
                        .bedrooms(2)
                        .bathrooms(1.0)
                        .areaSqft(900)
                        .propertyType("Apartment")
                        .images(List.of(
                                "https://images.unsplash.com/photo-1505693416388-ac5ce068fe85",
                                "https://images.unsplash.com/photo-1501183638710-841dd1904471"))
                        .amenities(List.of("Elevator", "Doorman", "Gym"))
                        .featured(true)
                        .status("For Sale")
                        .listedAt(listedAt)
                        .build(),
                Property.builder()
                        .title("Cozy Suburban Condo")
                        .description("Bright 1-bedroom condo with balcony and community pool.")
                        .price(189000)
                        .address("789 Pine Lane, Unit 305")
                        .city("Lakeside")
                        .state("CA")
                        .zipCode("92040")
                        .bedrooms(1)
                        .bathrooms(1.0)
                        .areaSqft(650)
                        .propertyType("Condo")
                        .images(List.of(
                                "https://images.unsplash.com/photo-1493809842364-78817add7ffb",
                                "https://images.unsplash.com/photo-1512917774080-9991f1c4c750"))
                        .amenities(List.of("Pool", "Clubhouse"))
                        .featured(false)
                        .status("For Sale")
                        .listedAt(listedAt)
                        .build()
        );
    }
}
