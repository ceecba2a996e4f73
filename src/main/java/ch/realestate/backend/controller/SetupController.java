package ch.realestate.backend.controller;

import ch.realestate.backend.models.SeedResult;
import ch.realestate.backend.seed.PropertySeeder;
import ch.realestate.backend.serialization.DocumentSerializer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/setup")
public class SetupController extends AbstractController {

    private final PropertySeeder propertySeeder;

    public SetupController(DocumentSerializer documentSerializer, PropertySeeder propertySeeder) {
        super(documentSerializer);
        this.propertySeeder = propertySeeder;
    }

    @PostMapping("/seed")
    public ResponseEntity<SeedResult> seedProperties() {
        int inserted = unwrap(propertySeeder.seed());
        return ResponseEntity.ok(new SeedResult(inserted));
    }
}
