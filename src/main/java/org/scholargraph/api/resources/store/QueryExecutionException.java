package org.scholargraph.api.resources.store;

/**
 * Thrown when the engine rejects or fails a composed query.
 * <p>
 * The offending query text is kept for diagnosis; the message carries the engine's own
 * error message.
 */
public class QueryExecutionException extends StoreException {

    private final String query;

    public QueryExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * @return The SQL text that failed.
     */
    public String getQuery() {
        return query;
    }
}
