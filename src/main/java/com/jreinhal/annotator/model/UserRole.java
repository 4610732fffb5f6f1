package com.jreinhal.annotator.model;

public enum UserRole {
    ANNOTATOR,
    ADMIN;

    public static UserRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return ANNOTATOR;
        }
        try {
            return UserRole.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ANNOTATOR;
        }
    }
}
