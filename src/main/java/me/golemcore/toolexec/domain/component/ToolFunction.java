package me.golemcore.toolexec.domain.component;

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

import me.golemcore.toolexec.domain.model.ToolOutcome;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * External unit of work invoked by the execution service with the session's
 * parameter map. The function is called exactly once per execution and must
 * not keep references to the session after its future settles.
 *
 * <p>
 * Implementations declare up front whether they return a raw value or a
 * pre-built envelope via {@link ToolOutcome}.
 */
@FunctionalInterface
public interface ToolFunction {

    /**
     * Starts the tool call.
     *
     * @param parameters
     *            the session's parameters, or an empty map when none were set
     * @return a future completing with the outcome, or exceptionally with the
     *         tool's failure
     */
    CompletableFuture<ToolOutcome> apply(Map<String, Object> parameters);

    /**
     * Adapts a synchronous function returning a raw value.
     */
    static ToolFunction ofRaw(Function<Map<String, Object>, Object> function) {
        return parameters -> CompletableFuture.completedFuture(ToolOutcome.raw(function.apply(parameters)));
    }

    /**
     * Adapts an asynchronous function returning a raw value.
     */
    static ToolFunction ofRawAsync(Function<Map<String, Object>, CompletableFuture<?>> function) {
        return parameters -> function.apply(parameters).thenApply(ToolOutcome::raw);
    }
}
