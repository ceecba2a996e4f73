package ch.realestate.backend.controller;

import ch.realestate.backend.serialization.DocumentSerializer;
import ch.realestate.backend.store.StoreError;
import ch.realestate.backend.store.StoreResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public abstract class AbstractController {
    protected final DocumentSerializer documentSerializer;

    protected AbstractController(DocumentSerializer documentSerializer) {
        this.documentSerializer = documentSerializer;
    }

    /** Value of a successful store result, otherwise the matching HTTP error */
    protected <T> T unwrap(StoreResult<T> result) {
        if (result.isOk()) {
            return result.getValue();
        }
        throw new ResponseStatusException(statusFor(result.getError()), result.getMessage());
    }

    static HttpStatus statusFor(StoreError error) {
        switch (error) {
            case INVALID_IDENTIFIER:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STORE_UNAVAILABLE:
            case WRITE_ERROR:
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
