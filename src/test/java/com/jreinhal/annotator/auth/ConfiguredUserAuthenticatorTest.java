package com.jreinhal.annotator.auth;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.model.UserRole;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

class ConfiguredUserAuthenticatorTest {
    private static final PasswordEncoder ENCODER = new BCryptPasswordEncoder(4);
    private static ConfiguredUserAuthenticator authenticator;

    @BeforeAll
    static void setUp() {
        AnnotatorUsersProperties properties = new AnnotatorUsersProperties();
        properties.setUsers(List.of(
            user("alice", null, ENCODER.encode("s3cret"), "ADMIN"),
            user("bob", "hunter2", null, null)));
        authenticator = new ConfiguredUserAuthenticator(properties, ENCODER);
    }

    @Test
    void hashedPasswordAuthenticates() {
        UserIdentity alice = authenticator.authenticate(" alice ", "s3cret");

        assertEquals("alice", alice.username());
        assertEquals(UserRole.ADMIN, alice.role());
        assertTrue(alice.isAdmin());
    }

    @Test
    void plainPasswordIsHashedAtStartup() {
        UserIdentity bob = authenticator.authenticate("bob", "hunter2");

        assertEquals(UserRole.ANNOTATOR, bob.role());
        assertEquals("bob", bob.displayName());
    }

    @Test
    void wrongPasswordAndUnknownUserFail() {
        assertThatThrownBy(() -> authenticator.authenticate("alice", "wrong"))
            .isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> authenticator.authenticate("mallory", "s3cret"))
            .isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> authenticator.authenticate("alice", ""))
            .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void accountWithoutPasswordIsAConfigurationError() {
        AnnotatorUsersProperties properties = new AnnotatorUsersProperties();
        properties.setUsers(List.of(user("carol", null, null, null)));

        assertThatThrownBy(() -> new ConfiguredUserAuthenticator(properties, ENCODER))
            .isInstanceOf(IllegalStateException.class);
    }

    private static AnnotatorUsersProperties.User user(String name, String password, String hash, String role) {
        AnnotatorUsersProperties.User user = new AnnotatorUsersProperties.User();
        user.setUsername(name);
        user.setPassword(password);
        user.setPasswordHash(hash);
        if (role != null) {
            user.setRole(role);
        }
        return user;
    }
}
