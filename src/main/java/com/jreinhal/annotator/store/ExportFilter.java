package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;

/**
 * Optional owner and completion restriction for {@link RecordStore#export}.
 */
public record ExportFilter(String owner, boolean onlyCompleted) {
    public ExportFilter {
        owner = owner == null || owner.isBlank() ? null : owner.trim();
    }

    public static ExportFilter all() {
        return new ExportFilter(null, false);
    }

    public boolean matches(AnnotationRecord record) {
        if (owner != null && !owner.equals(record.owner())) {
            return false;
        }
        return !onlyCompleted || record.completed();
    }
}
