package me.golemcore.toolexec.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.component.ToolFunction;
import me.golemcore.toolexec.domain.exception.SessionBusyException;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.exception.ToolTimeoutException;
import me.golemcore.toolexec.domain.exception.ToolValidationException;
import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.ExecutionError;
import me.golemcore.toolexec.domain.model.ExecutionRecord;
import me.golemcore.toolexec.domain.model.Session;
import me.golemcore.toolexec.domain.model.ToolEvent;
import me.golemcore.toolexec.domain.model.ToolExecutionState;
import me.golemcore.toolexec.domain.model.ToolOutcome;
import me.golemcore.toolexec.domain.model.ToolResponse;
import me.golemcore.toolexec.domain.statemachine.ToolStateMachine;
import me.golemcore.toolexec.port.outbound.SessionStorePort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs tool invocations for many sessions.
 *
 * <p>
 * Every session id is bound to a {@link SessionActor}: operations on one
 * session are applied strictly in submission order and never concurrently,
 * while different sessions proceed in parallel on the actor executor. The tool
 * function runs on a separate executor, outside the actor, so a blocking tool
 * never holds up timeouts, {@link #cancel} or {@link #reset}. A result or
 * failure that arrives after the session left {@code EXECUTING}, or belongs to
 * an older execution, is discarded.
 *
 * <p>
 * All operations return futures. Failures are reported as
 * {@link ToolValidationException} (event not valid in the current state),
 * {@link SessionBusyException} (the session is executing),
 * {@link ToolExecutionException} (the tool failed),
 * {@link ToolTimeoutException}, or {@link CancellationException} (the
 * execution ended before it settled).
 *
 * <p>
 * Session contexts live in the {@link SessionStorePort}, so an idle session
 * expires with the store's TTL. An actor is dropped as soon as it has no queued
 * task and no execution in flight.
 */
@Slf4j
public class ToolExecutionService {

    private static final String ERROR_PREFIX_PATTERN = "^Error:\\s*";

    private final ToolStateMachine stateMachine;
    private final Executor actorExecutor;
    private final Executor toolExecutor;
    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;
    protected final SessionStorePort sessionStore;
    protected final Clock clock;

    private final Map<String, SessionActor> actors = new ConcurrentHashMap<>();

    /**
     * @param actorExecutor
     *            runs session actor tasks; may be small and bounded
     * @param toolExecutor
     *            runs tool functions, which may block for their whole call
     */
    public ToolExecutionService(ToolStateMachine stateMachine, SessionStorePort sessionStore,
            Executor actorExecutor, Executor toolExecutor, ScheduledExecutorService scheduler, Clock clock,
            Duration defaultTimeout) {
        this.stateMachine = stateMachine;
        this.sessionStore = sessionStore;
        this.actorExecutor = actorExecutor;
        this.toolExecutor = toolExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout != null ? defaultTimeout : Duration.ZERO;
    }

    // ==================== Operations ====================

    public CompletableFuture<ExecutionContext> selectTool(String sessionId, String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return CompletableFuture.failedFuture(new ToolValidationException("Tool name is required"));
        }
        return applyOnActor(sessionId, ToolEvent.selectTool(toolName));
    }

    public CompletableFuture<ExecutionContext> setParameters(String sessionId, Map<String, Object> parameters) {
        return applyOnActor(sessionId, ToolEvent.setParameters(parameters != null ? parameters : Map.of()));
    }

    /**
     * Executes the selected tool with the configured default timeout.
     */
    public CompletableFuture<ToolResponse> execute(String sessionId, ToolFunction function) {
        return execute(sessionId, function, defaultTimeout);
    }

    /**
     * Executes the selected tool with the session's parameters.
     *
     * @param timeout
     *            how long to wait for the tool before failing the execution;
     *            zero or null waits indefinitely
     * @return the recorded response envelope
     */
    public CompletableFuture<ToolResponse> execute(String sessionId, ToolFunction function, Duration timeout) {
        if (function == null) {
            return CompletableFuture.failedFuture(new ToolValidationException("Tool function is required"));
        }
        return onActor(sessionId, actor -> startExecution(actor, function, timeout))
                .thenCompose(Function.identity());
    }

    /**
     * Cancels an in-flight execution. Outside {@code EXECUTING} this is a no-op
     * that returns the unchanged context.
     */
    public CompletableFuture<ExecutionContext> cancel(String sessionId) {
        return applyOnActor(sessionId, ToolEvent.cancel());
    }

    /**
     * Returns the session to {@code IDLE}, keeping its history.
     */
    public CompletableFuture<ExecutionContext> reset(String sessionId) {
        return applyOnActor(sessionId, ToolEvent.reset());
    }

    public CompletableFuture<ExecutionContext> getContext(String sessionId) {
        return onActor(sessionId, actor -> load(actor).copy());
    }

    public CompletableFuture<List<ExecutionRecord>> getHistory(String sessionId) {
        return onActor(sessionId, actor -> List.copyOf(load(actor).getHistory()));
    }

    /**
     * Returns the most recent {@code limit} history records, oldest first.
     */
    public CompletableFuture<List<ExecutionRecord>> getHistory(String sessionId, int limit) {
        if (limit < 0) {
            return CompletableFuture.failedFuture(new ToolValidationException("History limit must be >= 0"));
        }
        return onActor(sessionId, actor -> {
            List<ExecutionRecord> history = load(actor).getHistory();
            int from = Math.max(0, history.size() - limit);
            return List.copyOf(history.subList(from, history.size()));
        });
    }

    public CompletableFuture<List<String>> sessionIds() {
        return CompletableFuture.supplyAsync(() -> {
            List<String> ids = new ArrayList<>(sessionStore.list());
            ids.sort(String::compareTo);
            return ids;
        }, actorExecutor);
    }

    /**
     * Forgets the session. An in-flight execution is abandoned and its caller
     * sees a {@link CancellationException}.
     */
    public CompletableFuture<Void> clearSession(String sessionId) {
        return onActor(sessionId, actor -> {
            SessionActor.PendingExecution pending = actor.takePending();
            if (pending != null) {
                abandon(actor, pending, "Session cleared");
            }
            sessionStore.delete(sessionId);
            log.debug("[ToolExec] cleared session {}", sessionId);
            return null;
        });
    }

    public boolean isDistributed() {
        return false;
    }

    /**
     * Number of sessions that currently have an actor, which is those with
     * queued operations or an execution in flight.
     */
    public int activeSessionCount() {
        return actors.size();
    }

    // ==================== Hooks ====================

    /**
     * Called before the session enters {@code EXECUTING}.
     *
     * @throws SessionBusyException
     *             if the execution may not start
     */
    protected void beforeExecute(String sessionId, String executionId) {
        // nothing to acquire locally
    }

    /**
     * Called once for every execution that passed {@link #beforeExecute}, when
     * it leaves {@code EXECUTING} or fails to enter it.
     */
    protected void afterExecute(String sessionId, String executionId) {
        // nothing to release locally
    }

    /**
     * Re-reads the session on its actor and runs {@code action} there if
     * {@code executionId} is still the execution in flight. If the stored
     * session moved on, the execution is abandoned instead and
     * {@link #afterExecute} runs for it.
     *
     * @return whether the execution was still current
     */
    protected CompletableFuture<Boolean> runIfExecuting(String sessionId, String executionId, Runnable action) {
        return onActor(sessionId, actor -> {
            if (currentExecution(actor, executionId) == null) {
                return false;
            }
            action.run();
            return true;
        });
    }

    // ==================== Actor tasks ====================

    private CompletableFuture<ExecutionContext> applyOnActor(String sessionId, ToolEvent event) {
        return onActor(sessionId, actor -> applyEvent(actor, event, null).copy());
    }

    private <T> CompletableFuture<T> onActor(String sessionId, Function<SessionActor, T> task) {
        if (sessionId == null || sessionId.isBlank()) {
            return CompletableFuture.failedFuture(new ToolValidationException("Session id is required"));
        }
        SessionActor actor = actors.compute(sessionId, (id, existing) -> {
            SessionActor bound = existing != null ? existing : new SessionActor(id, actorExecutor);
            bound.retain();
            return bound;
        });
        return runOn(actor, () -> task.apply(actor));
    }

    /**
     * Runs a task on an actor that holds a pending execution, from a callback
     * of that execution.
     */
    private <T> CompletableFuture<T> onPendingActor(SessionActor actor, Supplier<T> task) {
        actor.retain();
        return runOn(actor, task);
    }

    private <T> CompletableFuture<T> runOn(SessionActor actor, Supplier<T> task) {
        CompletableFuture<T> result = actor.submit(task);
        result.whenComplete((value, error) -> release(actor));
        return result;
    }

    private void release(SessionActor actor) {
        actor.release();
        actors.computeIfPresent(actor.sessionId(),
                (id, bound) -> bound == actor && actor.isIdle() ? null : bound);
    }

    private ExecutionContext load(SessionActor actor) {
        ExecutionContext resolved = sessionStore.get(actor.sessionId())
                .map(Session::getContext)
                .orElseGet(ExecutionContext::initial);
        SessionActor.PendingExecution pending = actor.pending();
        if (pending != null && (resolved.getState() != ToolExecutionState.EXECUTING
                || !pending.executionId().equals(resolved.getExecutionId()))) {
            actor.takePending();
            log.info("[ToolExec] execution {} of session {} was superseded (state {})", pending.executionId(),
                    actor.sessionId(), resolved.getState());
            abandon(actor, pending, "Execution superseded");
        }
        return resolved;
    }

    private ExecutionContext applyEvent(SessionActor actor, ToolEvent event, RuntimeException failure) {
        String sessionId = actor.sessionId();
        ExecutionContext current = load(actor);
        if (current.getState() == ToolExecutionState.EXECUTING && (event.getType() == ToolEvent.Type.SELECT_TOOL
                || event.getType() == ToolEvent.Type.SET_PARAMETERS)) {
            throw new SessionBusyException(sessionId);
        }
        ExecutionContext next = stateMachine.transition(current, event);
        if (next == current) {
            return current;
        }

        boolean leavingExecution = current.getState() == ToolExecutionState.EXECUTING
                && next.getState() != ToolExecutionState.EXECUTING;
        if (!leavingExecution) {
            sessionStore.save(sessionId, next);
            log.debug("[ToolExec] session {}: {} -> {}", sessionId, current.getState(), next.getState());
            return next;
        }

        SessionActor.PendingExecution pending = actor.takePending();
        try {
            sessionStore.save(sessionId, next);
        } catch (RuntimeException e) {
            if (pending != null) {
                pending.cancelTimeout();
                afterExecute(sessionId, pending.executionId());
                pending.response().completeExceptionally(e);
            }
            throw e;
        }
        log.debug("[ToolExec] session {}: {} -> {}", sessionId, current.getState(), next.getState());
        if (pending != null) {
            pending.cancelTimeout();
            afterExecute(sessionId, pending.executionId());
            settleResponse(pending, event, next, failure);
        }
        return next;
    }

    private CompletableFuture<ToolResponse> startExecution(SessionActor actor, ToolFunction function,
            Duration timeout) {
        String sessionId = actor.sessionId();
        ExecutionContext current = load(actor);
        if (current.getState() == ToolExecutionState.EXECUTING) {
            throw new SessionBusyException(sessionId);
        }
        stateMachine.validate(current, ToolEvent.Type.EXECUTE);

        String executionId = UUID.randomUUID().toString();
        String toolName = current.getSelectedTool();
        beforeExecute(sessionId, executionId);
        try {
            applyEvent(actor, ToolEvent.execute(executionId), null);
        } catch (RuntimeException e) {
            afterExecute(sessionId, executionId);
            throw e;
        }

        SessionActor.PendingExecution pending = new SessionActor.PendingExecution(executionId, toolName,
                clock.instant());
        actor.pending(pending);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            pending.timeoutTask(scheduler.schedule(() -> onTimeout(actor, executionId, timeout),
                    timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        log.debug("[ToolExec] session {}: executing {} ({})", sessionId, toolName, executionId);

        Map<String, Object> parameters = current.getParameters() != null
                ? new LinkedHashMap<>(current.getParameters())
                : new LinkedHashMap<>();
        invoke(function, parameters).whenComplete((outcome, error) -> onPendingActor(actor,
                () -> settle(actor, executionId, outcome, error))
                .exceptionally(settleFailure -> {
                    log.warn("[ToolExec] could not record outcome of execution {} for session {}: {}",
                            executionId, sessionId, settleFailure.getMessage());
                    return null;
                }));
        return pending.response();
    }

    private CompletableFuture<ToolOutcome> invoke(ToolFunction function, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> function.apply(parameters), toolExecutor)
                .thenCompose(future -> future != null
                        ? future
                        : CompletableFuture.failedFuture(new IllegalStateException("Tool returned no result")));
    }

    private Void settle(SessionActor actor, String executionId, ToolOutcome outcome, Throwable error) {
        SessionActor.PendingExecution pending = currentExecution(actor, executionId);
        if (pending == null) {
            log.debug("[ToolExec] discarding late outcome of execution {} for session {}", executionId,
                    actor.sessionId());
            return null;
        }

        long elapsed = Duration.between(pending.startedAt(), clock.instant()).toMillis();
        if (error == null) {
            ToolResponse response = envelope(pending.toolName(), outcome, elapsed);
            applyEvent(actor, ToolEvent.receivedResult(response), null);
            return null;
        }

        Throwable cause = unwrap(error);
        String message = normalizeErrorMessage(cause);
        log.debug("[ToolExec] tool {} failed for session {}: {}", pending.toolName(), actor.sessionId(), message);
        applyEvent(actor,
                ToolEvent.error(ExecutionError.of(ExecutionError.Kind.EXECUTION, message, clock.instant())),
                new ToolExecutionException(pending.toolName(), message, cause));
        return null;
    }

    private void onTimeout(SessionActor actor, String executionId, Duration timeout) {
        onPendingActor(actor, () -> {
            SessionActor.PendingExecution pending = currentExecution(actor, executionId);
            if (pending == null) {
                return null;
            }
            ToolTimeoutException timeoutError = new ToolTimeoutException(pending.toolName(), timeout);
            log.warn("[ToolExec] {}", timeoutError.getMessage());
            applyEvent(actor,
                    ToolEvent.error(ExecutionError.of(ExecutionError.Kind.TIMEOUT, timeoutError.getMessage(),
                            clock.instant())),
                    timeoutError);
            return null;
        }).exceptionally(e -> {
            log.warn("[ToolExec] could not record timeout of execution {}: {}", executionId, e.getMessage());
            return null;
        });
    }

    /**
     * The pending execution if {@code executionId} is still the one the session
     * is executing, otherwise null.
     */
    private SessionActor.PendingExecution currentExecution(SessionActor actor, String executionId) {
        ExecutionContext current = load(actor);
        SessionActor.PendingExecution pending = actor.pending();
        if (pending == null || !pending.executionId().equals(executionId)
                || current.getState() != ToolExecutionState.EXECUTING
                || !executionId.equals(current.getExecutionId())) {
            return null;
        }
        return pending;
    }

    private ToolResponse envelope(String toolName, ToolOutcome outcome, long elapsed) {
        if (outcome != null && outcome.isEnveloped()) {
            return outcome.getEnvelope();
        }
        Object data = outcome != null ? outcome.getValue() : null;
        return ToolResponses.success(data, toolName, elapsed, clock.instant());
    }

    private void settleResponse(SessionActor.PendingExecution pending, ToolEvent event, ExecutionContext next,
            RuntimeException failure) {
        switch (event.getType()) {
        case RECEIVED_RESULT -> pending.response().complete(next.getResult());
        case ERROR -> pending.response().completeExceptionally(failure != null
                ? failure
                : new ToolExecutionException(pending.toolName(), next.getError().getMessage(), null));
        default -> pending.response().completeExceptionally(
                new CancellationException("Execution " + pending.executionId() + " was "
                        + (event.getType() == ToolEvent.Type.RESET ? "reset" : "cancelled")));
        }
    }

    private void abandon(SessionActor actor, SessionActor.PendingExecution pending, String reason) {
        pending.cancelTimeout();
        afterExecute(actor.sessionId(), pending.executionId());
        pending.response().completeExceptionally(new CancellationException(reason));
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String normalizeErrorMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message.replaceFirst(ERROR_PREFIX_PATTERN, "");
    }
}
