package org.scholargraph.api.resources.store;

/**
 * Thrown when an expected column is absent from a result, which means the backing
 * corpus violates its data contract.
 */
public class SchemaException extends StoreException {

    private final String column;

    public SchemaException(String message, String column) {
        super(message);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
