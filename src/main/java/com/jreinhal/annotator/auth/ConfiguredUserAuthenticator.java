package com.jreinhal.annotator.auth;

import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.model.UserRole;
import com.jreinhal.annotator.util.LogSanitizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Checks credentials against the accounts listed under {@code annotator.auth.users}.
 */
@Service
public class ConfiguredUserAuthenticator implements Authenticator {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredUserAuthenticator.class);
    // Burned on unknown usernames so both failure paths cost one bcrypt check.
    private static final String DUMMY_HASH = "$2a$10$N9qo8uLOickgx2ZMRZoMyeIjZAgcfl7p92ldGxad68LJZdL17lhWy";

    private final PasswordEncoder passwordEncoder;
    private final Map<String, Account> accounts;

    public ConfiguredUserAuthenticator(AnnotatorUsersProperties properties, PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        Map<String, Account> byName = new LinkedHashMap<>();
        for (AnnotatorUsersProperties.User user : properties.getUsers()) {
            if (user.getUsername() == null || user.getUsername().isBlank()) {
                throw new IllegalStateException("annotator.auth.users entry without username");
            }
            String username = user.getUsername().trim();
            String hash = user.getPasswordHash();
            if (hash == null || hash.isBlank()) {
                if (user.getPassword() == null || user.getPassword().isBlank()) {
                    throw new IllegalStateException("User " + username + " has neither password-hash nor password");
                }
                log.warn("User '{}' is configured with a plain text password; use password-hash outside development", username);
                hash = passwordEncoder.encode(user.getPassword());
            }
            UserIdentity identity = new UserIdentity(username, user.getDisplayName(), UserRole.fromString(user.getRole()));
            if (byName.put(username, new Account(identity, hash)) != null) {
                throw new IllegalStateException("Duplicate user " + username + " in annotator.auth.users");
            }
        }
        this.accounts = Collections.unmodifiableMap(byName);
        if (accounts.isEmpty()) {
            log.warn("No annotator accounts configured; every login will fail");
        } else {
            log.info("Loaded {} annotator accounts", accounts.size());
        }
    }

    @Override
    public UserIdentity authenticate(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new AuthenticationFailedException("Missing credentials");
        }
        String name = username.trim();
        Account account = accounts.get(name);
        if (account == null) {
            passwordEncoder.matches(password, DUMMY_HASH);
            throw new AuthenticationFailedException("Unknown user '" + LogSanitizer.sanitize(name) + "'");
        }
        if (!passwordEncoder.matches(password, account.passwordHash())) {
            throw new AuthenticationFailedException("Invalid password for user '" + LogSanitizer.sanitize(name) + "'");
        }
        log.info("User '{}' authenticated", LogSanitizer.sanitize(name));
        return account.identity();
    }

    private record Account(UserIdentity identity, String passwordHash) {
    }
}
