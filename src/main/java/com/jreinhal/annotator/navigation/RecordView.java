package com.jreinhal.annotator.navigation;

import java.util.Map;

/**
 * What the UI renders for the current state. {@code position} is 1-based, 0 when empty.
 */
public record RecordView(
    String state,
    String recordId,
    int position,
    int total,
    String owner,
    boolean completed,
    boolean dirty,
    String pendingDirection,
    Map<String, Object> values,
    Map<String, String> displayValues,
    Map<String, Boolean> flags,
    String error
) {
}
