package com.jreinhal.annotator.controller;

import com.jreinhal.annotator.auth.Authenticator;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.navigation.AnnotationSessionRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private final Authenticator authenticator;
    private final AnnotationSessionRegistry sessionRegistry;

    public AuthController(Authenticator authenticator, AnnotationSessionRegistry sessionRegistry) {
        this.authenticator = authenticator;
        this.sessionRegistry = sessionRegistry;
    }

    public record LoginRequest(@NotBlank String username, @NotBlank String password) {
    }

    public record LoginResponse(String token, String username, String displayName, String role) {
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        UserIdentity user = authenticator.authenticate(request.username(), request.password());
        String token = sessionRegistry.open(user);
        return ResponseEntity.ok(new LoginResponse(token, user.username(), user.displayName(), user.role().name()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestHeader(value = AnnotationController.SESSION_HEADER, required = false) String token) {
        sessionRegistry.close(token);
        return ResponseEntity.noContent().build();
    }
}
