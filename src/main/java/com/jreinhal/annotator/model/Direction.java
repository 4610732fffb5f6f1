package com.jreinhal.annotator.model;

public enum Direction {
    PREV(-1),
    NEXT(1);

    private final int delta;

    Direction(int delta) {
        this.delta = delta;
    }

    public int delta() {
        return delta;
    }

    public static Direction fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Direction is required");
        }
        switch (value.trim().toLowerCase()) {
            case "prev":
            case "previous":
                return PREV;
            case "next":
                return NEXT;
            default:
                throw new IllegalArgumentException("Unknown direction: " + value);
        }
    }
}
