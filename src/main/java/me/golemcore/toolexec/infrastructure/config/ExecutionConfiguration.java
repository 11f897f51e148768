package me.golemcore.toolexec.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the execution service: a fixed pool of workers that run
 * session actors, an unbounded pool for tool calls, which may block for as long
 * as the tool runs, and a scheduler for timeouts and lock heartbeats. All use
 * daemon threads and are shut down with the context.
 */
@Configuration
@Slf4j
public class ExecutionConfiguration {

    public static final String WORKERS = "toolExecWorkers";
    public static final String TOOL_CALLS = "toolExecToolCalls";
    public static final String SCHEDULER = "toolExecScheduler";

    private final int workerThreads;
    private ExecutorService workers;
    private ExecutorService toolCalls;
    private ScheduledExecutorService scheduler;

    public ExecutionConfiguration(ToolExecProperties properties) {
        this.workerThreads = Math.max(1, properties.getExecution().getWorkerThreads());
    }

    @Bean(name = WORKERS)
    public synchronized ExecutorService toolExecWorkers() {
        if (workers == null) {
            workers = Executors.newFixedThreadPool(workerThreads, daemonThreads("toolexec-worker-"));
        }
        return workers;
    }

    @Bean(name = TOOL_CALLS)
    public synchronized ExecutorService toolExecToolCalls() {
        if (toolCalls == null) {
            toolCalls = Executors.newCachedThreadPool(daemonThreads("toolexec-tool-"));
        }
        return toolCalls;
    }

    @Bean(name = SCHEDULER)
    public synchronized ScheduledExecutorService toolExecScheduler() {
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("toolexec-scheduler-"));
        }
        return scheduler;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
        if (toolCalls != null) {
            toolCalls.shutdownNow();
        }
        log.debug("[ToolExec] executors shut down");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
