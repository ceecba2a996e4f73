package ch.realestate.backend.store;

/**
 * Failure kinds reported by {@link DocumentStore} operations.
 */
public enum StoreError {
    /** The identity token is not well-formed for the store. */
    INVALID_IDENTIFIER,
    /** No document carries the requested identity. */
    NOT_FOUND,
    /** The store is not configured or cannot be reached. */
    STORE_UNAVAILABLE,
    /** The store was reached but rejected or failed the write. */
    WRITE_ERROR
}
