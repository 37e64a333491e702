package org.scholargraph.api.resources.cache;

/**
 * Sidecar metadata written next to every cached Parquet file. An entry is only served when
 * its manifest names the requested key and row count.
 *
 * @param kind          The artifact kind name.
 * @param lookbackYears The lookback window.
 * @param signature     The filter signature.
 * @param criteria      Human-readable description of the filter criteria.
 * @param rowCount      Number of rows in the data file.
 * @param createdAt     ISO-8601 timestamp of the write.
 */
public record CacheManifest(
    String kind,
    int lookbackYears,
    String signature,
    String criteria,
    long rowCount,
    String createdAt
) {

    /**
     * @param key The requested key.
     * @return true if this manifest was written for exactly that key.
     */
    public boolean describes(CacheKey key) {
        return key.kind().name().equals(kind)
            && key.lookbackYears() == lookbackYears
            && key.signature().equals(signature);
    }
}
