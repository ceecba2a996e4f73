package ch.realestate.backend.store;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of a store operation: either a value or a {@link StoreError} with a message.
 *
 * @param <T> value type on success
 */
@ToString
@EqualsAndHashCode
public final class StoreResult<T> {

    private final T value;
    private final StoreError error;
    private final String message;

    private StoreResult(T value, StoreError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StoreResult<T> failure(StoreError error, String message) {
        return new StoreResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value, store operation failed with " + error + ": " + message);
        }
        return value;
    }

    public StoreError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }
}
