package org.scholargraph.api.resources.cache;

import org.scholargraph.api.resources.store.QueryResult;

import java.util.Objects;

/**
 * Outcome of a cache lookup.
 * <p>
 * {@link Status#MISS} and {@link Status#CORRUPT} both mean "recompute"; callers branch on
 * {@link #isHit()} only and use the status for logging and metrics.
 */
public final class CacheReadResult {

    public enum Status { HIT, MISS, CORRUPT }

    private static final CacheReadResult MISS = new CacheReadResult(Status.MISS, null, null);

    private final Status status;
    private final QueryResult rows;
    private final String reason;

    private CacheReadResult(Status status, QueryResult rows, String reason) {
        this.status = status;
        this.rows = rows;
        this.reason = reason;
    }

    public static CacheReadResult hit(QueryResult rows) {
        return new CacheReadResult(Status.HIT, Objects.requireNonNull(rows, "rows"), null);
    }

    public static CacheReadResult miss() {
        return MISS;
    }

    public static CacheReadResult corrupt(String reason) {
        return new CacheReadResult(Status.CORRUPT, null, reason);
    }

    public Status status() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    /**
     * @return The cached rows.
     * @throws IllegalStateException if this is not a hit.
     */
    public QueryResult rows() {
        if (!isHit()) {
            throw new IllegalStateException("No rows on a cache " + status);
        }
        return rows;
    }

    /**
     * @return Why the entry was rejected, or {@code null} unless {@link Status#CORRUPT}.
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return reason == null ? status.name() : status + "(" + reason + ")";
    }
}
