package org.scholargraph.api.model;

import com.typesafe.config.Config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * The fixed conjunction of inclusion predicates that defines the filtered corpus.
 * <p>
 * The {@link #signature()} covers every predicate except the lookback window, which is part
 * of the cache key on its own. Changing any predicate therefore changes the signature and
 * orphans every artifact computed under the old one.
 *
 * @param institutionId    Institution the first author must be affiliated with.
 * @param fieldId          Field the paper must be assigned to.
 * @param doctype          Required document type.
 * @param excludeRetracted Whether retracted papers are dropped.
 * @param authorPosition   Byline position of the institution's author.
 */
public record FilterCriteria(
    String institutionId,
    String fieldId,
    String doctype,
    boolean excludeRetracted,
    AuthorPosition authorPosition
) {

    /** Bumped whenever the meaning of the predicate tuple changes. */
    static final String SIGNATURE_VERSION = "v1";

    public static final String DEFAULT_INSTITUTION_ID = "I78577930";
    public static final String DEFAULT_FIELD_ID = "C41008148";

    public FilterCriteria {
        Objects.requireNonNull(institutionId, "institutionId");
        Objects.requireNonNull(fieldId, "fieldId");
        Objects.requireNonNull(doctype, "doctype");
        Objects.requireNonNull(authorPosition, "authorPosition");
    }

    /**
     * Reads the criteria from a {@code filter} config block, falling back to the defaults
     * for absent keys.
     */
    public static FilterCriteria fromConfig(Config options) {
        return new FilterCriteria(
            options.hasPath("institutionId") ? options.getString("institutionId") : DEFAULT_INSTITUTION_ID,
            options.hasPath("fieldId") ? options.getString("fieldId") : DEFAULT_FIELD_ID,
            options.hasPath("doctype") ? options.getString("doctype") : "article",
            !options.hasPath("excludeRetracted") || options.getBoolean("excludeRetracted"),
            options.hasPath("authorPosition")
                ? AuthorPosition.parse(options.getString("authorPosition"))
                : AuthorPosition.FIRST);
    }

    /**
     * @return 16 lowercase hex characters derived from the SHA-256 of the predicate tuple.
     */
    public String signature() {
        String canonical = String.join("|",
            institutionId, fieldId, doctype, Boolean.toString(excludeRetracted),
            authorPosition.columnValue(), SIGNATURE_VERSION);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String describe() {
        return "institution=" + institutionId
            + ", field=" + fieldId
            + ", doctype=" + doctype
            + ", excludeRetracted=" + excludeRetracted
            + ", authorPosition=" + authorPosition.columnValue();
    }
}
