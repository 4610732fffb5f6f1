package com.jreinhal.annotator.navigation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.util.LogSanitizer;
import com.jreinhal.annotator.visibility.RecordSetCache;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Live annotation sessions keyed by an opaque bearer token. Idle sessions expire after
 * {@code annotator.session.idle-timeout}; unsaved edits in them are lost.
 */
@Component
public class AnnotationSessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(AnnotationSessionRegistry.class);
    private static final int TOKEN_BYTES = 32;

    private final NavigationStateMachineFactory factory;
    private final RecordSetCache recordSetCache;
    private final Cache<String, NavigationStateMachine> sessions;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public AnnotationSessionRegistry(NavigationStateMachineFactory factory, RecordSetCache recordSetCache,
                                     @Value("${annotator.session.idle-timeout:8h}") Duration idleTimeout) {
        this(factory, recordSetCache, idleTimeout, Ticker.systemTicker());
    }

    AnnotationSessionRegistry(NavigationStateMachineFactory factory, RecordSetCache recordSetCache,
                              Duration idleTimeout, Ticker ticker) {
        this.factory = factory;
        this.recordSetCache = recordSetCache;
        this.sessions = Caffeine.newBuilder()
            .expireAfterAccess(idleTimeout)
            .ticker(ticker)
            .build();
    }

    /**
     * Starts a session for {@code user}. The record cache is dropped since visibility depends
     * on who is asking.
     */
    public String open(UserIdentity user) {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        recordSetCache.invalidate();
        sessions.put(token, factory.create(user));
        if (log.isInfoEnabled()) {
            log.info("Opened annotation session {} for {}", LogSanitizer.tokenRef(token), LogSanitizer.sanitize(user.username()));
        }
        return token;
    }

    public NavigationStateMachine get(String token) {
        NavigationStateMachine machine = token == null ? null : sessions.getIfPresent(token);
        if (machine == null) {
            throw new UnknownSessionException("No annotation session for " + LogSanitizer.tokenRef(token));
        }
        return machine;
    }

    /**
     * User behind {@code token}, without failing on unknown or expired tokens.
     */
    public Optional<UserIdentity> lookup(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.getIfPresent(token)).map(NavigationStateMachine::user);
    }

    /**
     * Runs {@code action} with exclusive access to the session's state machine.
     */
    public <T> T withSession(String token, Function<NavigationStateMachine, T> action) {
        NavigationStateMachine machine = get(token);
        synchronized (machine) {
            return action.apply(machine);
        }
    }

    public boolean close(String token) {
        if (token == null || sessions.getIfPresent(token) == null) {
            return false;
        }
        sessions.invalidate(token);
        log.info("Closed annotation session {}", LogSanitizer.tokenRef(token));
        return true;
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
