package com.jreinhal.annotator.model;

public record RecordStatistics(long total, long annotated, long pending) {
    public static RecordStatistics of(long total, long annotated) {
        return new RecordStatistics(total, annotated, Math.max(0L, total - annotated));
    }
}
