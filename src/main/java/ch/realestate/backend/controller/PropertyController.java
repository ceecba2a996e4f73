package ch.realestate.backend.controller;

import ch.realestate.backend.models.PropertyFields;
import ch.realestate.backend.query.PropertyFilter;
import ch.realestate.backend.query.PropertyFilterBuilder;
import ch.realestate.backend.serialization.DocumentSerializer;
import ch.realestate.backend.store.DocumentStore;
import ch.realestate.backend.store.FailSoftLister;
import jakarta.validation.constraints.PositiveOrZero;
import org.bson.Document;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/properties")
public class PropertyController extends AbstractController {

    private final PropertyFilterBuilder filterBuilder;
    private final FailSoftLister lister;
    private final DocumentStore documentStore;

    public PropertyController(DocumentSerializer documentSerializer,
                              PropertyFilterBuilder filterBuilder,
                              FailSoftLister lister,
                              DocumentStore documentStore) {
        super(documentSerializer);
        this.filterBuilder = filterBuilder;
        this.lister = lister;
        this.documentStore = documentStore;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listProperties(
            @RequestParam(required = false) String city,
            @RequestParam(name = "property_type", required = false) String propertyType,
            @RequestParam(name = "min_price", required = false) @PositiveOrZero Double minPrice,
            @RequestParam(name = "max_price", required = false) @PositiveOrZero Double maxPrice,
            @RequestParam(required = false) @PositiveOrZero Integer bedrooms,
            @RequestParam(required = false) @PositiveOrZero Double bathrooms,
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) Boolean featured) {
        PropertyFilter filter = PropertyFilter.builder()
                .city(city)
                .propertyType(propertyType)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .bedrooms(bedrooms)
                .bathrooms(bathrooms)
                .query(query)
                .featured(featured)
                .build();
        return ResponseEntity.ok(search(filter));
    }

    @GetMapping("/featured")
    public ResponseEntity<List<Map<String, Object>>> featuredProperties() {
        return ResponseEntity.ok(search(PropertyFilter.featuredOnly()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getProperty(@PathVariable String id) {
        Document doc = unwrap(documentStore.findById(PropertyFields.COLLECTION, id));
        return ResponseEntity.ok(documentSerializer.serialize(doc));
    }

    private List<Map<String, Object>> search(PropertyFilter filter) {
        List<Document> docs = lister.list(PropertyFields.COLLECTION, filterBuilder.build(filter));
        return documentSerializer.serializeAll(docs);
    }
}
