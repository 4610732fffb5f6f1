package com.jreinhal.annotator.auth;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "annotator.auth")
public class AnnotatorUsersProperties {
    /**
     * Accounts allowed to annotate.
     *
     * Example:
     * annotator.auth.users[0].username=alice
     * annotator.auth.users[0].password-hash=$2a$10$...
     * annotator.auth.users[0].role=ADMIN
     */
    private List<User> users = new ArrayList<>();

    public List<User> getUsers() {
        return users;
    }

    public void setUsers(List<User> users) {
        this.users = users;
    }

    public static class User {
        private String username;
        private String displayName;
        private String role = "ANNOTATOR";
        /** BCrypt hash; preferred. */
        private String passwordHash;
        /** Plain text, development only; hashed at startup. */
        private String password;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }

        public String getPasswordHash() {
            return passwordHash;
        }

        public void setPasswordHash(String passwordHash) {
            this.passwordHash = passwordHash;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
