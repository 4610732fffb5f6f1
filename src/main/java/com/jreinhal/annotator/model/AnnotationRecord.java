package com.jreinhal.annotator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of annotatable data.
 *
 * <p>{@code owner} is never {@code null}; an empty string means the record is unclaimed.
 * {@code fields} holds JSON-compatible business values keyed by schema field name and
 * {@code flags} holds the per-field "needs review" markers.</p>
 */
public record AnnotationRecord(
    String id,
    String owner,
    boolean completed,
    int qualityScore,
    Map<String, Object> fields,
    Map<String, Boolean> flags,
    Instant createdAt,
    Instant updatedAt
) {
    public static final int SCORE_FLAGGED = 0;
    public static final int SCORE_CLEAN = 1;

    public AnnotationRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record id is required");
        }
        owner = owner == null ? "" : owner.trim();
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static AnnotationRecord unclaimed(String id, Map<String, Object> fields, Instant now) {
        return new AnnotationRecord(id, "", false, SCORE_CLEAN, fields, Map.of(), now, now);
    }

    public boolean isClaimed() {
        return !owner.isEmpty();
    }

    public boolean isOwnedBy(String user) {
        return user != null && owner.equals(user);
    }

    public boolean isVisibleTo(String user) {
        return owner.isEmpty() || isOwnedBy(user);
    }

    public boolean hasFlaggedField() {
        return flags.values().stream().anyMatch(Boolean.TRUE::equals);
    }

    public AnnotationRecord withOwner(String newOwner, Instant now) {
        return new AnnotationRecord(id, newOwner, completed, qualityScore, fields, flags, createdAt, now);
    }

    public static int scoreFor(Map<String, Boolean> flags) {
        if (flags == null) {
            return SCORE_CLEAN;
        }
        return flags.values().stream().anyMatch(Boolean.TRUE::equals) ? SCORE_FLAGGED : SCORE_CLEAN;
    }
}
