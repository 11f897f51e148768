package me.golemcore.toolexec;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore ToolExec.
 *
 * <p>
 * ToolExec runs tool invocations inside long-lived sessions. Each session moves
 * through an explicit lifecycle (tool selected, parameters set, executing,
 * completed or failed) and keeps the history of its results, so a client can
 * chain calls by passing the session id back.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → ToolStateMachine, ToolExecutionService, StatefulToolInvoker
 * Ports              → SessionStorePort, SessionLockPort, CacheStorePort
 * Adapters           → Redis (durable, shared) and in-memory implementations
 * </pre>
 *
 * <p>
 * At startup the Redis backend is probed once. When it answers, session state
 * is written through to Redis and guarded by a per-session lock so several
 * processes can serve the same sessions. Otherwise sessions live in this
 * process only.
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code toolexec.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolExecApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolExecApplication.class, args);
    }

}
