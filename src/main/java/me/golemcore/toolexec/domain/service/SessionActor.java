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

import me.golemcore.toolexec.domain.model.ToolResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serial task queue of one session. Tasks run on the shared executor, one at a
 * time, in submission order. {@code pending} is only changed from tasks run
 * through {@link #submit}. {@code inFlight} counts tasks retained but not yet
 * finished, so the owner can tell when the actor may be dropped.
 */
final class SessionActor {

    private final String sessionId;
    private final Executor executor;
    private final Object queueLock = new Object();

    private final AtomicInteger inFlight = new AtomicInteger();

    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
    private volatile PendingExecution pending;

    SessionActor(String sessionId, Executor executor) {
        this.sessionId = sessionId;
        this.executor = executor;
    }

    <T> CompletableFuture<T> submit(Supplier<T> task) {
        synchronized (queueLock) {
            CompletableFuture<T> result = tail.thenApplyAsync(ignored -> task.get(), executor);
            tail = result.handle((value, error) -> null);
            return result;
        }
    }

    String sessionId() {
        return sessionId;
    }

    void retain() {
        inFlight.incrementAndGet();
    }

    void release() {
        inFlight.decrementAndGet();
    }

    boolean isIdle() {
        return inFlight.get() <= 0 && pending == null;
    }

    PendingExecution pending() {
        return pending;
    }

    void pending(PendingExecution pending) {
        this.pending = pending;
    }

    PendingExecution takePending() {
        PendingExecution taken = pending;
        pending = null;
        return taken;
    }

    /**
     * An execution that has entered EXECUTING and whose caller still waits on
     * {@link #response}.
     */
    static final class PendingExecution {

        private final String executionId;
        private final String toolName;
        private final Instant startedAt;
        private final CompletableFuture<ToolResponse> response = new CompletableFuture<>();
        private ScheduledFuture<?> timeoutTask;

        PendingExecution(String executionId, String toolName, Instant startedAt) {
            this.executionId = executionId;
            this.toolName = toolName;
            this.startedAt = startedAt;
        }

        String executionId() {
            return executionId;
        }

        String toolName() {
            return toolName;
        }

        Instant startedAt() {
            return startedAt;
        }

        CompletableFuture<ToolResponse> response() {
            return response;
        }

        void timeoutTask(ScheduledFuture<?> timeoutTask) {
            this.timeoutTask = timeoutTask;
        }

        void cancelTimeout() {
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
        }
    }
}
