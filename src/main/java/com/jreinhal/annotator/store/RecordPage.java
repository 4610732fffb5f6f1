package com.jreinhal.annotator.store;

import com.jreinhal.annotator.model.AnnotationRecord;
import java.util.List;

public record RecordPage(List<AnnotationRecord> records, int page, int size, long total, boolean hasMore) {
}
