package com.jreinhal.annotator.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved field list of the active annotation task. Order is the display order.
 */
public final class TaskSchema {
    private final String taskName;
    private final Map<String, FieldDescriptor> fields;

    public TaskSchema(String taskName, List<FieldDescriptor> descriptors) {
        this.taskName = taskName == null || taskName.isBlank() ? "annotation" : taskName.trim();
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate field in task schema: " + descriptor.name());
            }
        }
        for (FieldDescriptor descriptor : byName.values()) {
            if (descriptor.isScale()) {
                FieldDescriptor base = byName.get(descriptor.scaleOf());
                if (base == null) {
                    throw new IllegalArgumentException("Scale field " + descriptor.name() + " targets unknown field " + descriptor.scaleOf());
                }
                if (base.isScale()) {
                    throw new IllegalArgumentException("Scale field " + descriptor.name() + " cannot target another scale field");
                }
            }
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public String taskName() {
        return taskName;
    }

    public List<FieldDescriptor> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldDescriptor> field(String name) {
        return Optional.ofNullable(name == null ? null : fields.get(name));
    }

    public FieldDescriptor require(String name) {
        return field(name).orElseThrow(() -> new IllegalArgumentException("Unknown field: " + name));
    }

    /**
     * Multiplier field that scales {@code baseField}, if the task declares one.
     */
    public Optional<FieldDescriptor> scaleFor(String baseField) {
        return fields.values().stream()
            .filter(f -> f.isScale() && f.scaleOf().equals(baseField))
            .findFirst();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
