package com.jreinhal.annotator.visibility;

/**
 * A slot in the visible id list. {@link #EMPTY} stands for "nothing to show".
 */
public record Position(int index, String recordId) {
    public static final Position EMPTY = new Position(0, null);

    public boolean isEmpty() {
        return recordId == null;
    }
}
