package org.scholargraph.api.resources.store;

import java.nio.file.Path;

/**
 * Thrown when a backing Parquet file is missing or unreadable.
 */
public class StoreUnavailableException extends StoreException {

    private final transient Path path;

    public StoreUnavailableException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public StoreUnavailableException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * @return The file that could not be opened, or {@code null} if not file-specific.
     */
    public Path getPath() {
        return path;
    }
}
