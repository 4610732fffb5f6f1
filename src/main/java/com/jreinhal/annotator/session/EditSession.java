package com.jreinhal.annotator.session;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.schema.FieldDescriptor;
import com.jreinhal.annotator.schema.TaskSchema;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pristine and working copies of one record's editable values.
 *
 * <p>Values are held in display form (after {@link com.jreinhal.annotator.schema.DisplayTransform#load}).
 * A scaled base field always holds the base text; the scaled rendering comes from
 * {@link #displayValue} and never takes part in dirty detection. Not thread-safe: a session
 * belongs to exactly one interaction.</p>
 */
public final class EditSession {
    private final AnnotationRecord source;
    private final TaskSchema schema;
    private final Map<String, Object> pristine;
    private final Map<String, Boolean> pristineFlags;
    private final Map<String, Object> working;
    private final Map<String, Boolean> workingFlags;

    private EditSession(AnnotationRecord source, TaskSchema schema, Map<String, Object> pristine, Map<String, Boolean> pristineFlags) {
        this.source = source;
        this.schema = schema;
        this.pristine = Collections.unmodifiableMap(pristine);
        this.pristineFlags = Collections.unmodifiableMap(pristineFlags);
        this.working = new LinkedHashMap<>(pristine);
        this.workingFlags = new LinkedHashMap<>(pristineFlags);
    }

    public static EditSession snapshot(AnnotationRecord record, TaskSchema schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : schema.fields()) {
            values.put(descriptor.name(), descriptor.transform().load(record.fields().get(descriptor.name())));
            if (descriptor.hasReviewFlag()) {
                flags.put(descriptor.name(), Boolean.TRUE.equals(record.flags().get(descriptor.name())));
            }
        }
        return new EditSession(record, schema, values, flags);
    }

    public AnnotationRecord source() {
        return source;
    }

    public String recordId() {
        return source.id();
    }

    public void setValue(String field, Object value) {
        FieldDescriptor descriptor = schema.require(field);
        if (descriptor.ownerComputed()) {
            throw new IllegalArgumentException("Field " + field + " is read-only");
        }
        working.put(descriptor.name(), value);
    }

    public void setFlag(String field, boolean flagged) {
        FieldDescriptor descriptor = schema.require(field);
        if (!descriptor.hasReviewFlag()) {
            throw new IllegalArgumentException("Field " + field + " has no review flag");
        }
        workingFlags.put(descriptor.name(), flagged);
    }

    public Map<String, Object> workingValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(working));
    }

    public Map<String, Boolean> workingFlags() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(workingFlags));
    }

    public boolean isDirty() {
        return isDirty(working, workingFlags);
    }

    /**
     * Compares the given values against the pristine snapshot. Fields absent from
     * {@code values} count as unchanged; flags absent from {@code flags} count as unflagged.
     */
    public boolean isDirty(Map<String, Object> values, Map<String, Boolean> flags) {
        for (FieldDescriptor descriptor : schema.fields()) {
            if (descriptor.ownerComputed()) {
                continue;
            }
            String name = descriptor.name();
            Object current = values.containsKey(name) ? values.get(name) : pristine.get(name);
            if (!valuesEqual(descriptor, pristine.get(name), current)) {
                return true;
            }
            if (descriptor.hasReviewFlag()
                && Boolean.TRUE.equals(pristineFlags.get(name)) != Boolean.TRUE.equals(flags.get(name))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Text shown for {@code field}: the base value scaled by its multiplier when the task
     * declares one, the working value otherwise.
     */
    public String displayValue(String field) {
        FieldDescriptor descriptor = schema.require(field);
        Object value = working.get(descriptor.name());
        return schema.scaleFor(descriptor.name())
            .map(scale -> ScaleFormatter.apply(value, working.get(scale.name())))
            .orElseGet(() -> asText(value));
    }

    public Map<String, String> displayValues() {
        Map<String, String> rendered = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : schema.fields()) {
            rendered.put(descriptor.name(), displayValue(descriptor.name()));
        }
        return rendered;
    }

    public PersistedValues toPersisted() {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : schema.fields()) {
            if (descriptor.ownerComputed()) {
                continue;
            }
            Object value = working.get(descriptor.name());
            if (descriptor.isScale()) {
                fields.put(descriptor.name(), ScaleFormatter.parseScale(value));
            } else {
                fields.put(descriptor.name(), descriptor.transform().save(value));
            }
            if (descriptor.hasReviewFlag()) {
                flags.put(descriptor.name(), Boolean.TRUE.equals(workingFlags.get(descriptor.name())));
            }
        }
        return new PersistedValues(fields, flags, AnnotationRecord.scoreFor(flags));
    }

    static boolean valuesEqual(FieldDescriptor descriptor, Object left, Object right) {
        if (descriptor.isScale()) {
            return Double.compare(ScaleFormatter.parseScale(left), ScaleFormatter.parseScale(right)) == 0;
        }
        if (left instanceof Collection<?> leftItems && right instanceof Collection<?> rightItems) {
            return asSet(leftItems).equals(asSet(rightItems));
        }
        String a = asText(left).trim();
        String b = asText(right).trim();
        if (a.contains("*") || b.contains("*")) {
            return a.replaceAll("\\s+", "").equals(b.replaceAll("\\s+", ""));
        }
        return a.equals(b);
    }

    private static Set<String> asSet(Collection<?> items) {
        return items.stream()
            .filter(Objects::nonNull)
            .map(item -> String.valueOf(item).trim())
            .collect(Collectors.toSet());
    }

    private static String asText(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
