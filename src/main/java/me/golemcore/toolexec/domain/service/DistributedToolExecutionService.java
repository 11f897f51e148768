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
import me.golemcore.toolexec.domain.exception.SessionBusyException;
import me.golemcore.toolexec.domain.model.SessionLock;
import me.golemcore.toolexec.domain.statemachine.ToolStateMachine;
import me.golemcore.toolexec.port.outbound.SessionLockPort;
import me.golemcore.toolexec.port.outbound.SessionStorePort;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ToolExecutionService} over a store shared between processes, so any
 * process can resume a session.
 *
 * <p>
 * Entering {@code EXECUTING} requires the session's lock; if another process
 * holds it the call fails at once with {@link SessionBusyException}. Every
 * heartbeat the holder re-reads the session: while its execution is still the
 * one in flight the lock is renewed, and once the session left
 * {@code EXECUTING}, also through a cancel or reset from another process, the
 * execution is abandoned and the lock released.
 *
 * <p>
 * Exclusion is advisory. If a tool call outlives the lock TTL because renewal
 * failed, another process may start a second execution of the same session.
 * The first one is then superseded: its outcome is discarded and its caller
 * sees a cancellation.
 */
@Slf4j
public class DistributedToolExecutionService extends ToolExecutionService {

    private final SessionLockPort sessionLock;
    private final ScheduledExecutorService scheduler;
    private final Duration lockTtl;
    private final Duration heartbeat;

    private final Map<String, HeldLock> heldLocks = new ConcurrentHashMap<>();

    public DistributedToolExecutionService(ToolStateMachine stateMachine, SessionStorePort sessionStore,
            Executor actorExecutor, Executor toolExecutor, ScheduledExecutorService scheduler, Clock clock,
            Duration defaultTimeout, SessionLockPort sessionLock, Duration lockTtl, Duration heartbeat) {
        super(stateMachine, sessionStore, actorExecutor, toolExecutor, scheduler, clock, defaultTimeout);
        this.sessionLock = sessionLock;
        this.scheduler = scheduler;
        this.lockTtl = lockTtl;
        this.heartbeat = heartbeat;
    }

    @Override
    public boolean isDistributed() {
        return true;
    }

    @Override
    protected void beforeExecute(String sessionId, String executionId) {
        SessionLock lock = sessionLock.tryAcquire(sessionId, lockTtl)
                .orElseThrow(() -> new SessionBusyException(sessionId));
        ScheduledFuture<?> renewal = null;
        if (!heartbeat.isZero() && !heartbeat.isNegative()) {
            renewal = scheduler.scheduleAtFixedRate(() -> beat(lock, executionId), heartbeat.toMillis(),
                    heartbeat.toMillis(), TimeUnit.MILLISECONDS);
        }
        heldLocks.put(executionId, new HeldLock(lock, renewal));
    }

    @Override
    protected void afterExecute(String sessionId, String executionId) {
        HeldLock held = heldLocks.remove(executionId);
        if (held == null) {
            return;
        }
        if (held.renewal() != null) {
            held.renewal().cancel(false);
        }
        if (!sessionLock.release(held.lock())) {
            log.debug("[Lock] lock of session {} had already expired or changed hands", sessionId);
        }
    }

    private void beat(SessionLock lock, String executionId) {
        runIfExecuting(lock.sessionId(), executionId, () -> renew(lock))
                .whenComplete((current, error) -> {
                    if (error != null) {
                        // store unreadable: keep the lock until the execution settles
                        log.warn("[Lock] could not check execution {} of session {}: {}", executionId,
                                lock.sessionId(), unwrap(error).getMessage());
                        renew(lock);
                    } else if (!current) {
                        log.info("[Lock] session {} left execution {}, lock released", lock.sessionId(),
                                executionId);
                    }
                });
    }

    private void renew(SessionLock lock) {
        try {
            if (!sessionLock.renew(lock, lockTtl)) {
                log.warn("[Lock] lost lock of session {} while executing", lock.sessionId());
            }
        } catch (RuntimeException e) {
            log.warn("[Lock] heartbeat failed for session {}: {}", lock.sessionId(), e.getMessage());
        }
    }

    private record HeldLock(SessionLock lock, ScheduledFuture<?> renewal) {
    }
}
