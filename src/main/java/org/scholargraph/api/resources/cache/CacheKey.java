package org.scholargraph.api.resources.cache;

import java.util.Objects;

/**
 * Identifies one cached artifact: what it is, which lookback window produced it and which
 * filter signature it is valid for.
 *
 * @param kind          The artifact kind.
 * @param lookbackYears The lookback window in years.
 * @param signature     The filter signature the artifact was computed under.
 */
public record CacheKey(ArtifactKind kind, int lookbackYears, String signature) {

    public CacheKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(signature, "signature");
        if (lookbackYears < 0) {
            throw new IllegalArgumentException("lookbackYears must not be negative: " + lookbackYears);
        }
        if (!signature.matches("[0-9a-f]+")) {
            throw new IllegalArgumentException("signature must be lowercase hex: " + signature);
        }
    }

    /**
     * @return The data file name, e.g. {@code filtered_papers_5yr_3fa1c0d2e4b59a77.parquet}.
     */
    public String fileName() {
        return baseName() + ".parquet";
    }

    /**
     * @return The manifest file name that accompanies {@link #fileName()}.
     */
    public String manifestFileName() {
        return baseName() + ".json";
    }

    /**
     * @return The untagged file name older deployments wrote for the same window.
     */
    public String legacyFileName() {
        return kind.filePrefix() + "_" + lookbackYears + "yr.parquet";
    }

    private String baseName() {
        return kind.filePrefix() + "_" + lookbackYears + "yr_" + signature;
    }
}
