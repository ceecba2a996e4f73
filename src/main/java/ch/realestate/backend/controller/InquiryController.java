package ch.realestate.backend.controller;

import ch.realestate.backend.models.Inquiry;
import ch.realestate.backend.models.InquiryResult;
import ch.realestate.backend.serialization.DocumentSerializer;
import ch.realestate.backend.store.DocumentStore;
import ch.realestate.backend.store.StoreResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/inquiries")
public class InquiryController extends AbstractController {

    private final DocumentStore documentStore;

    public InquiryController(DocumentSerializer documentSerializer, DocumentStore documentStore) {
        super(documentSerializer);
        this.documentStore = documentStore;
    }

    @PostMapping
    public ResponseEntity<InquiryResult> createInquiry(@Valid @RequestBody Inquiry inquiry) {
        StoreResult<String> result = documentStore.insert(Inquiry.COLLECTION, inquiry.toDocument());
        if (!result.isOk()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Could not save inquiry: " + result.getMessage());
        }
        return ResponseEntity.ok(new InquiryResult(true));
    }
}
