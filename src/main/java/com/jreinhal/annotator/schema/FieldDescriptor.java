package com.jreinhal.annotator.schema;

/**
 * One editable (or computed) business field of a task.
 *
 * @param name          key in the record's field map
 * @param transform     persisted-to-display conversion
 * @param hasReviewFlag whether annotators can mark the field as needing review
 * @param ownerComputed read-only value supplied by the import, never compared or saved
 * @param scaleOf       when set, this field is a numeric multiplier applied to the named base field
 */
public record FieldDescriptor(
    String name,
    DisplayTransform transform,
    boolean hasReviewFlag,
    boolean ownerComputed,
    String scaleOf
) {
    public static final String FLAG_KEY_PREFIX = "chk_";
    public static final double DEFAULT_SCALE = 1.0;

    public FieldDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name is required");
        }
        name = name.trim();
        transform = transform == null ? DisplayTransform.IDENTITY : transform;
        scaleOf = scaleOf == null || scaleOf.isBlank() ? null : scaleOf.trim();
    }

    public static FieldDescriptor text(String name) {
        return new FieldDescriptor(name, DisplayTransform.IDENTITY, false, false, null);
    }

    public static FieldDescriptor reviewable(String name, DisplayTransform transform) {
        return new FieldDescriptor(name, transform, true, false, null);
    }

    public static FieldDescriptor readOnly(String name) {
        return new FieldDescriptor(name, DisplayTransform.IDENTITY, false, true, null);
    }

    public static FieldDescriptor scale(String name, String baseField) {
        return new FieldDescriptor(name, DisplayTransform.IDENTITY, false, false, baseField);
    }

    public boolean isScale() {
        return scaleOf != null;
    }

    public String flagKey() {
        return FLAG_KEY_PREFIX + name;
    }

    public static boolean isFlagKey(String key) {
        return key != null && key.startsWith(FLAG_KEY_PREFIX) && key.length() > FLAG_KEY_PREFIX.length();
    }

    public static String fieldForFlagKey(String key) {
        return key.substring(FLAG_KEY_PREFIX.length());
    }
}
