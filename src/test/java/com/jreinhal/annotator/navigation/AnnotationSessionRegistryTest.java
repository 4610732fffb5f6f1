package com.jreinhal.annotator.navigation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.visibility.RecordSetCache;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnnotationSessionRegistryTest {
    private final AtomicLong nanos = new AtomicLong();
    private NavigationStateMachineFactory factory;
    private RecordSetCache recordSetCache;
    private AnnotationSessionRegistry registry;

    @BeforeEach
    void setUp() {
        factory = mock(NavigationStateMachineFactory.class);
        recordSetCache = mock(RecordSetCache.class);
        when(factory.create(any(UserIdentity.class))).thenAnswer(inv -> mock(NavigationStateMachine.class));
        Ticker ticker = nanos::get;
        registry = new AnnotationSessionRegistry(factory, recordSetCache, Duration.ofHours(8), ticker);
    }

    @Test
    void openIssuesDistinctTokensAndDropsRecordCache() {
        String first = registry.open(UserIdentity.annotator("alice"));
        String second = registry.open(UserIdentity.annotator("alice"));

        assertThat(first).isNotBlank().isNotEqualTo(second);
        assertThat(registry.get(first)).isNotSameAs(registry.get(second));
        verify(recordSetCache, org.mockito.Mockito.times(2)).invalidate();
    }

    @Test
    void unknownTokenIsRejected() {
        assertThatThrownBy(() -> registry.get("nope")).isInstanceOf(UnknownSessionException.class);
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(UnknownSessionException.class);
    }

    @Test
    void idleSessionsExpire() {
        String token = registry.open(UserIdentity.annotator("alice"));
        nanos.addAndGet(Duration.ofHours(7).toNanos());
        registry.get(token);
        nanos.addAndGet(Duration.ofHours(7).toNanos());

        assertSame(registry.get(token), registry.get(token));
        nanos.addAndGet(Duration.ofHours(9).toNanos());
        assertThatThrownBy(() -> registry.get(token)).isInstanceOf(UnknownSessionException.class);
    }

    @Test
    void closeEndsSession() {
        String token = registry.open(UserIdentity.annotator("alice"));

        assertTrue(registry.close(token));
        assertFalse(registry.close(token));
        assertEquals(0, registry.activeSessions());
    }

    @Test
    void withSessionPassesTheMachine() {
        String token = registry.open(UserIdentity.annotator("alice"));
        NavigationStateMachine machine = registry.get(token);

        assertSame(machine, registry.withSession(token, m -> m));
    }
}
