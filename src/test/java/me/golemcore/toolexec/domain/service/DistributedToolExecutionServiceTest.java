package me.golemcore.toolexec.domain.service;

import me.golemcore.toolexec.adapter.outbound.memory.InMemorySessionLock;
import me.golemcore.toolexec.adapter.outbound.memory.InMemorySessionStore;
import me.golemcore.toolexec.domain.component.ToolFunction;
import me.golemcore.toolexec.domain.exception.BackendUnavailableException;
import me.golemcore.toolexec.domain.exception.SessionBusyException;
import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.SessionLock;
import me.golemcore.toolexec.domain.model.ToolExecutionState;
import me.golemcore.toolexec.domain.model.ToolOutcome;
import me.golemcore.toolexec.domain.model.ToolResponse;
import me.golemcore.toolexec.domain.statemachine.ToolStateMachine;
import me.golemcore.toolexec.port.outbound.SessionLockPort;
import me.golemcore.toolexec.port.outbound.SessionStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Two service instances sharing one store and one lock stand in for two
 * processes sharing a Redis backend.
 */
class DistributedToolExecutionServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String SESSION = "s1";
    private static final String TOOL = "search-code";
    private static final Duration LOCK_TTL = Duration.ofSeconds(30);

    private ExecutorService workers;
    private ExecutorService toolCalls;
    private ScheduledExecutorService scheduler;
    private Clock clock;
    private InMemorySessionStore store;
    private InMemorySessionLock lock;
    private DistributedToolExecutionService processA;
    private DistributedToolExecutionService processB;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(4);
        toolCalls = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        store = new InMemorySessionStore(clock, 3600);
        lock = new InMemorySessionLock(clock);
        processA = newService(store, lock, Duration.ofSeconds(10));
        processB = newService(store, lock, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        toolCalls.shutdownNow();
        workers.shutdownNow();
    }

    // ==================== Persistence ====================

    @Test
    void shouldResumeSessionInAnotherProcess() throws Exception {
        await(processA.selectTool(SESSION, TOOL));
        await(processA.setParameters(SESSION, Map.of("pattern", "foo")));

        ToolResponse response = await(processB.execute(SESSION, ToolFunction.ofRaw(params -> params.get("pattern"))));

        assertEquals("foo", response.getData());
        ExecutionContext seenByA = await(processA.getContext(SESSION));
        assertEquals(ToolExecutionState.COMPLETED, seenByA.getState());
        assertEquals(1, seenByA.getHistory().size());
        assertEquals(1, store.get(SESSION).orElseThrow().getContext().getHistory().size());
    }

    @Test
    void shouldStartFreshWhenSessionIsUnknown() throws Exception {
        ExecutionContext context = await(processA.getContext("unknown"));

        assertEquals(ToolExecutionState.IDLE, context.getState());
        assertTrue(context.getHistory().isEmpty());
    }

    @Test
    void shouldLeaveNothingBehindWhenWriteFails() throws Exception {
        SessionStorePort failingStore = mock(SessionStorePort.class);
        when(failingStore.get(anyString())).thenReturn(Optional.empty());
        when(failingStore.save(anyString(), any())).thenThrow(new BackendUnavailableException("redis down", null));
        DistributedToolExecutionService service = newService(failingStore, lock, Duration.ZERO);

        Throwable failure = failureOf(service.selectTool(SESSION, TOOL));

        assertInstanceOf(BackendUnavailableException.class, failure);
        assertEquals(503, ((BackendUnavailableException) failure).getStatusCode());
    }

    @Test
    void shouldListAndDeleteThroughStore() throws Exception {
        await(processA.selectTool("a", TOOL));
        await(processB.selectTool("b", TOOL));

        assertEquals(List.of("a", "b"), await(processA.sessionIds()).stream().sorted().toList());

        await(processB.clearSession("a"));

        assertTrue(store.get("a").isEmpty());
        assertEquals(List.of("b"), await(processA.sessionIds()));
        assertTrue(processA.isDistributed());
    }

    // ==================== Locking ====================

    @Test
    void shouldFailFastWhenAnotherProcessIsExecuting() throws Exception {
        CompletableFuture<ToolOutcome> toolCall = new CompletableFuture<>();
        await(processA.selectTool(SESSION, TOOL));
        CompletableFuture<ToolResponse> running = processA.execute(SESSION, params -> toolCall);
        awaitState(processB, ToolExecutionState.EXECUTING);

        Throwable failure = failureOf(processB.execute(SESSION, ToolFunction.ofRaw(params -> "second")));

        assertInstanceOf(SessionBusyException.class, failure);
        toolCall.complete(ToolOutcome.raw("first"));
        assertEquals("first", await(running).getData());
        assertEquals(1, await(processB.getHistory(SESSION)).size());
    }

    @Test
    void shouldRejectExecutionWhenLockIsHeld() throws Exception {
        await(processA.selectTool(SESSION, TOOL));
        SessionLock foreign = lock.tryAcquire(SESSION, LOCK_TTL).orElseThrow();

        Throwable failure = failureOf(processA.execute(SESSION, ToolFunction.ofRaw(params -> "never")));

        assertInstanceOf(SessionBusyException.class, failure);
        ExecutionContext context = await(processB.getContext(SESSION));
        assertEquals(ToolExecutionState.TOOL_SELECTED, context.getState());
        assertTrue(context.getHistory().isEmpty());

        lock.release(foreign);
        assertEquals("now", await(processA.execute(SESSION, ToolFunction.ofRaw(params -> "now"))).getData());
    }

    @Test
    void shouldReleaseLockWhenExecutionEnds() throws Exception {
        await(processA.selectTool(SESSION, TOOL));
        await(processA.execute(SESSION, ToolFunction.ofRaw(params -> "done")));

        assertTrue(lock.tryAcquire(SESSION, LOCK_TTL).isPresent());
    }

    @Test
    void shouldReleaseLockWhenToolFails() throws Exception {
        await(processA.selectTool(SESSION, TOOL));
        failureOf(processA.execute(SESSION,
                params -> CompletableFuture.failedFuture(new IllegalStateException("Error: nope"))));

        assertTrue(lock.tryAcquire(SESSION, LOCK_TTL).isPresent());
    }

    @Test
    void shouldRenewLockWhileExecuting() throws Exception {
        SessionLockPort lockPort = mock(SessionLockPort.class);
        SessionLock held = new SessionLock(SESSION, "token-1", FIXED_NOW);
        when(lockPort.tryAcquire(eq(SESSION), eq(LOCK_TTL))).thenReturn(Optional.of(held));
        when(lockPort.renew(held, LOCK_TTL)).thenReturn(true);
        when(lockPort.release(held)).thenReturn(true);
        DistributedToolExecutionService service = newService(store, lockPort, Duration.ofMillis(20));
        CompletableFuture<ToolOutcome> toolCall = new CompletableFuture<>();
        await(service.selectTool(SESSION, TOOL));

        CompletableFuture<ToolResponse> running = service.execute(SESSION, params -> toolCall);

        verify(lockPort, timeout(2000).atLeast(2)).renew(held, LOCK_TTL);
        verify(lockPort, never()).release(any());
        toolCall.complete(ToolOutcome.raw("done"));
        await(running);
        verify(lockPort).release(held);
    }

    // ==================== Cross-process cancel ====================

    @Test
    void shouldAbandonExecutionCancelledByAnotherProcess() throws Exception {
        CompletableFuture<ToolOutcome> toolCall = new CompletableFuture<>();
        CountDownLatch invoked = new CountDownLatch(1);
        await(processA.selectTool(SESSION, TOOL));
        CompletableFuture<ToolResponse> running = processA.execute(SESSION, params -> {
            invoked.countDown();
            return toolCall;
        });
        assertTrue(invoked.await(5, TimeUnit.SECONDS));

        assertEquals(ToolExecutionState.CANCELLED, await(processB.cancel(SESSION)).getState());
        toolCall.complete(ToolOutcome.raw("late"));

        assertInstanceOf(CancellationException.class, failureOf(running));
        ExecutionContext context = await(processA.getContext(SESSION));
        assertEquals(ToolExecutionState.CANCELLED, context.getState());
        assertTrue(context.getHistory().isEmpty());
        assertTrue(lock.tryAcquire(SESSION, LOCK_TTL).isPresent());
    }

    @Test
    void shouldReleaseLockOnHeartbeatAfterAnotherProcessCancels() throws Exception {
        DistributedToolExecutionService holder = newService(store, lock, Duration.ofMillis(300),
                Duration.ofMillis(100));
        DistributedToolExecutionService other = newService(store, lock, Duration.ofMillis(300),
                Duration.ofMillis(100));
        CountDownLatch invoked = new CountDownLatch(1);
        await(holder.selectTool(SESSION, TOOL));
        CompletableFuture<ToolResponse> hung = holder.execute(SESSION, params -> {
            invoked.countDown();
            return new CompletableFuture<>();
        });
        assertTrue(invoked.await(5, TimeUnit.SECONDS));

        assertEquals(ToolExecutionState.CANCELLED, await(other.cancel(SESSION)).getState());

        assertInstanceOf(CancellationException.class, failureOf(hung));
        await(other.selectTool(SESSION, TOOL));
        assertEquals("again", await(other.execute(SESSION, ToolFunction.ofRaw(params -> "again"))).getData());
        assertEquals(1, await(holder.getHistory(SESSION)).size());
    }

    @Test
    void shouldStopRenewingOnceSessionLeftExecution() throws Exception {
        SessionLockPort lockPort = mock(SessionLockPort.class);
        SessionLock held = new SessionLock(SESSION, "token-1", FIXED_NOW);
        when(lockPort.tryAcquire(eq(SESSION), eq(LOCK_TTL))).thenReturn(Optional.of(held));
        when(lockPort.renew(held, LOCK_TTL)).thenReturn(true);
        when(lockPort.release(held)).thenReturn(true);
        DistributedToolExecutionService service = newService(store, lockPort, Duration.ofMillis(20));
        await(service.selectTool(SESSION, TOOL));
        service.execute(SESSION, params -> new CompletableFuture<>());
        awaitState(service, ToolExecutionState.EXECUTING);

        ExecutionContext reset = store.get(SESSION).orElseThrow().getContext().copy();
        reset.setState(ToolExecutionState.IDLE);
        reset.setExecutionId(null);
        store.save(SESSION, reset);

        verify(lockPort, timeout(2000)).release(held);
        Thread.sleep(100);
        verify(lockPort, atMost(1)).release(held);
        clearInvocations(lockPort);
        Thread.sleep(100);
        verify(lockPort, never()).renew(any(), any());
    }

    private DistributedToolExecutionService newService(SessionStorePort sessionStore, SessionLockPort sessionLock,
            Duration heartbeat) {
        return newService(sessionStore, sessionLock, LOCK_TTL, heartbeat);
    }

    private DistributedToolExecutionService newService(SessionStorePort sessionStore, SessionLockPort sessionLock,
            Duration lockTtl, Duration heartbeat) {
        return new DistributedToolExecutionService(new ToolStateMachine(clock), sessionStore, workers, toolCalls,
                scheduler, clock, Duration.ZERO, sessionLock, lockTtl, heartbeat);
    }

    private static void awaitState(ToolExecutionService service, ToolExecutionState expected) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (await(service.getContext(SESSION)).getState() == expected) {
                return;
            }
            Thread.sleep(10);
        }
        fail("session never reached " + expected);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (CancellationException e) {
            return e;
        } catch (ExecutionException e) {
            return ToolExecutionService.unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrupted");
        } catch (TimeoutException e) {
            fail("future did not complete");
        }
        return fail("expected the future to fail");
    }
}
