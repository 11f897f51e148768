package me.golemcore.toolexec.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool execution state carried by a session: the current lifecycle state, the
 * selected tool and its parameters, the last result or error, and the
 * append-only history of completed executions.
 *
 * <p>
 * Instances handed out by the execution service are copies; the state machine
 * never mutates a context in place.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionContext {

    @Builder.Default
    private ToolExecutionState state = ToolExecutionState.IDLE;

    private String selectedTool;
    private Map<String, Object> parameters;
    private ToolResponse result;
    private ExecutionError error;

    /**
     * Identifies the in-flight execution while {@link #state} is
     * {@link ToolExecutionState#EXECUTING}; null otherwise.
     */
    private String executionId;

    @Builder.Default
    private List<ExecutionRecord> history = new ArrayList<>();

    public static ExecutionContext initial() {
        return ExecutionContext.builder().build();
    }

    public ExecutionContext copy() {
        return toBuilder()
                .parameters(parameters != null ? new LinkedHashMap<>(parameters) : null)
                .history(history != null ? new ArrayList<>(history) : new ArrayList<>())
                .build();
    }
}
