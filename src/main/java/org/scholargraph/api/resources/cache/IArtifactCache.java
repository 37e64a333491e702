package org.scholargraph.api.resources.cache;

import org.scholargraph.api.resources.IMonitorable;
import org.scholargraph.api.resources.store.QueryResult;

import java.nio.file.Path;

/**
 * Disk cache for derived artifacts (filtered id sets, paper tables, citation edge lists).
 * <p>
 * Entries are addressed by {@link CacheKey}; an entry written under one filter signature is
 * never returned for another. Implementations must not throw from {@link #read} or
 * {@link #write}: unreadable entries surface as {@link CacheReadResult.Status#CORRUPT} and
 * failed writes as {@code false}, so a broken cache only costs recomputation.
 */
public interface IArtifactCache extends IMonitorable {

    /**
     * Looks up an entry.
     *
     * @param key The entry key.
     * @return A hit with the cached rows, a miss, or a corrupt result with the reason.
     */
    CacheReadResult read(CacheKey key);

    /**
     * Persists an entry, replacing any previous entry for the same key.
     *
     * @param key      The entry key.
     * @param rows     The rows to persist.
     * @param criteria Description of the filter criteria, stored in the manifest.
     * @return true if the entry was written.
     */
    boolean write(CacheKey key, QueryResult rows, String criteria);

    /**
     * Deletes the untagged file that older deployments wrote for the key's window, if any.
     * Its content is never read.
     *
     * @param key The key whose legacy file should be removed.
     * @return true if a file was deleted.
     */
    boolean deleteLegacy(CacheKey key);

    /**
     * @return The directory holding the cache files.
     */
    Path directory();
}
