package com.jreinhal.annotator.model;

/**
 * Authenticated annotator. The {@code username} is what gets written to a record's owner.
 */
public record UserIdentity(String username, String displayName, UserRole role) {
    public UserIdentity {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        username = username.trim();
        displayName = displayName == null || displayName.isBlank() ? username : displayName.trim();
        role = role == null ? UserRole.ANNOTATOR : role;
    }

    public static UserIdentity annotator(String username) {
        return new UserIdentity(username, username, UserRole.ANNOTATOR);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
