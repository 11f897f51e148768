package me.golemcore.toolexec.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.adapter.outbound.memory.InMemorySessionStore;
import me.golemcore.toolexec.adapter.outbound.redis.RedisSessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionStoreFactoryTest {

    private ToolExecProperties properties;
    private BackendProbe backendProbe;
    private ScheduledExecutorService scheduler;
    private SessionStoreFactory factory;

    @BeforeEach
    void setUp() {
        properties = new ToolExecProperties();
        backendProbe = mock(BackendProbe.class);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        factory = new SessionStoreFactory(properties, backendProbe, mock(StringRedisTemplate.class),
                new ObjectMapper(), Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC), scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldUseRedisWhenBackendAnswers() {
        when(backendProbe.isReachable(Duration.ofSeconds(1))).thenReturn(true);

        SessionStoreSelection selection = factory.create();

        assertTrue(selection.durable());
        assertInstanceOf(RedisSessionStore.class, selection.store());
        assertTrue(selection.store().isDurable());
    }

    @Test
    void shouldFallBackToMemoryWhenBackendIsUnreachable() {
        when(backendProbe.isReachable(any())).thenReturn(false);

        SessionStoreSelection selection = factory.create();

        assertFalse(selection.durable());
        assertInstanceOf(InMemorySessionStore.class, selection.store());
        selection.store().close();
    }

    @Test
    void shouldSkipProbeWhenMemoryIsForced() {
        properties.getSession().setForceMemory(true);

        SessionStoreSelection selection = factory.create();

        assertFalse(selection.durable());
        verify(backendProbe, never()).isReachable(any());
        selection.store().close();
    }

    @Test
    void shouldUseConfiguredProbeTimeout() {
        properties.getBackend().setConnectTimeout(Duration.ofMillis(250));

        factory.create();

        verify(backendProbe).isReachable(Duration.ofMillis(250));
    }
}
