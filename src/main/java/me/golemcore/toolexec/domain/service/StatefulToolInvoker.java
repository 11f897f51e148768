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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.component.ToolFunction;
import me.golemcore.toolexec.domain.exception.ToolExecException;
import me.golemcore.toolexec.domain.model.ToolResponse;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One-call entry point for tools that run inside a session.
 *
 * <p>
 * Takes the tool's arguments as received from a caller. An optional
 * {@code sessionId} argument names the session to continue; without it a new
 * session is started. The remaining arguments become the tool's parameters.
 * The tool is selected, parameterized and executed in that session, and the
 * response is stamped with the session id so the caller can chain further
 * calls.
 *
 * <p>
 * Failures are returned as an error envelope, never thrown. Its status code
 * follows the failure: 400 invalid request, 408 timeout, 409 session busy, 500
 * anything else.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatefulToolInvoker {

    public static final String SESSION_ID_ARGUMENT = "sessionId";

    private final ToolExecutionService executionService;
    private final Clock clock;

    public CompletableFuture<ToolResponse> invoke(String toolName, Map<String, Object> arguments,
            ToolFunction function) {
        Map<String, Object> parameters = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
        Object requested = parameters.remove(SESSION_ID_ARGUMENT);
        String sessionId = requested instanceof String id && !id.isBlank()
                ? id
                : UUID.randomUUID().toString();

        return executionService.selectTool(sessionId, toolName)
                .thenCompose(context -> executionService.setParameters(sessionId, parameters))
                .thenCompose(context -> executionService.execute(sessionId, function))
                .thenApply(response -> ToolResponses.withSession(response, sessionId))
                .exceptionally(error -> failure(toolName, sessionId, error));
    }

    private ToolResponse failure(String toolName, String sessionId, Throwable error) {
        Throwable cause = ToolExecutionService.unwrap(error);
        int code = cause instanceof ToolExecException toolError ? toolError.getStatusCode() : 500;
        String message = ToolExecutionService.normalizeErrorMessage(cause);
        log.debug("[ToolExec] {} failed in session {} ({}): {}", toolName, sessionId, code, message);
        return ToolResponses.withSession(ToolResponses.error(message, toolName, code, clock.instant()), sessionId);
    }
}
