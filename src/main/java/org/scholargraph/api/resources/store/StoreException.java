package org.scholargraph.api.resources.store;

/**
 * Base class of all failures raised by the columnar store.
 * <p>
 * Store exceptions are fatal to the operation that triggered them and are never retried
 * automatically. Predicate-level problems (unknown field names, empty results) are not
 * store exceptions; they surface as empty results.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
