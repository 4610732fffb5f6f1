package com.jreinhal.annotator.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Working values converted back to their stored form, ready for {@code RecordStore.save}.
 */
public record PersistedValues(Map<String, Object> fields, Map<String, Boolean> flags, int score) {
    public PersistedValues {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }
}
