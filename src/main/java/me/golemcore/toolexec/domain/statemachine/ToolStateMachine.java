package me.golemcore.toolexec.domain.statemachine;

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

import me.golemcore.toolexec.domain.exception.ToolValidationException;
import me.golemcore.toolexec.domain.model.ExecutionContext;
import me.golemcore.toolexec.domain.model.ExecutionRecord;
import me.golemcore.toolexec.domain.model.ToolEvent;
import me.golemcore.toolexec.domain.model.ToolExecutionState;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Transition function of a session's tool invocation lifecycle.
 *
 * <pre>
 * SELECT_TOOL      any but EXECUTING          → TOOL_SELECTED  (clears parameters, result, error)
 * SET_PARAMETERS   TOOL_SELECTED, PARAM_SET   → PARAMETERS_SET (replaces parameters)
 * EXECUTE          TOOL_SELECTED, PARAM_SET   → EXECUTING
 * RECEIVED_RESULT  EXECUTING                  → COMPLETED      (appends history)
 * ERROR            EXECUTING                  → FAILED
 * CANCEL           EXECUTING                  → CANCELLED      (no-op elsewhere)
 * RESET            any                        → IDLE           (keeps history)
 * </pre>
 *
 * <p>
 * Stateless and side-effect free: {@link #transition} returns a new context, or
 * the same instance when the event is a no-op. Events that are not valid in the
 * current state are rejected with {@link ToolValidationException} and nothing
 * changes.
 */
public class ToolStateMachine {

    public static final String NO_TOOL_SELECTED = "No tool selected";

    private static final Set<ToolExecutionState> EXECUTABLE_STATES = EnumSet.of(
            ToolExecutionState.TOOL_SELECTED, ToolExecutionState.PARAMETERS_SET);

    private final Clock clock;

    public ToolStateMachine(Clock clock) {
        this.clock = clock;
    }

    public ExecutionContext transition(ExecutionContext current, ToolEvent event) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(event, "event");
        validate(current, event.getType());

        return switch (event.getType()) {
        case SELECT_TOOL -> current.toBuilder()
                .state(ToolExecutionState.TOOL_SELECTED)
                .selectedTool(event.getToolName())
                .parameters(null)
                .result(null)
                .error(null)
                .executionId(null)
                .history(new ArrayList<>(current.getHistory()))
                .build();
        case SET_PARAMETERS -> current.toBuilder()
                .state(ToolExecutionState.PARAMETERS_SET)
                .parameters(event.getParameters() != null ? new LinkedHashMap<>(event.getParameters()) : null)
                .history(new ArrayList<>(current.getHistory()))
                .build();
        case EXECUTE -> current.toBuilder()
                .state(ToolExecutionState.EXECUTING)
                .executionId(event.getExecutionId())
                .history(new ArrayList<>(current.getHistory()))
                .build();
        case RECEIVED_RESULT -> complete(current, event);
        case ERROR -> current.toBuilder()
                .state(ToolExecutionState.FAILED)
                .result(null)
                .error(event.getError())
                .executionId(null)
                .history(new ArrayList<>(current.getHistory()))
                .build();
        case CANCEL -> current.getState() != ToolExecutionState.EXECUTING
                ? current
                : current.toBuilder()
                        .state(ToolExecutionState.CANCELLED)
                        .executionId(null)
                        .history(new ArrayList<>(current.getHistory()))
                        .build();
        case RESET -> ExecutionContext.builder()
                .state(ToolExecutionState.IDLE)
                .history(new ArrayList<>(current.getHistory()))
                .build();
        };
    }

    /**
     * Checks that {@code type} may be applied in the state of {@code current}
     * without computing the transition.
     *
     * @throws ToolValidationException
     *             if the event is not valid in the current state
     */
    public void validate(ExecutionContext current, ToolEvent.Type type) {
        ToolExecutionState state = current.getState();
        switch (type) {
        case SELECT_TOOL -> {
            if (state == ToolExecutionState.EXECUTING) {
                throw invalid(type, state);
            }
        }
        case SET_PARAMETERS -> {
            if (!EXECUTABLE_STATES.contains(state)) {
                throw invalid(type, state);
            }
        }
        case EXECUTE -> {
            if (current.getSelectedTool() == null || state == ToolExecutionState.IDLE) {
                throw new ToolValidationException(NO_TOOL_SELECTED);
            }
            if (!EXECUTABLE_STATES.contains(state)) {
                throw invalid(type, state);
            }
        }
        case RECEIVED_RESULT, ERROR -> {
            if (state != ToolExecutionState.EXECUTING) {
                throw invalid(type, state);
            }
        }
        case CANCEL, RESET -> {
            // accepted in every state
        }
        }
    }

    private ExecutionContext complete(ExecutionContext current, ToolEvent event) {
        List<ExecutionRecord> history = new ArrayList<>(current.getHistory());
        history.add(ExecutionRecord.builder()
                .tool(current.getSelectedTool())
                .result(event.getResult())
                .timestamp(clock.instant())
                .build());
        return current.toBuilder()
                .state(ToolExecutionState.COMPLETED)
                .result(event.getResult())
                .error(null)
                .executionId(null)
                .history(history)
                .build();
    }

    private static ToolValidationException invalid(ToolEvent.Type type, ToolExecutionState state) {
        return new ToolValidationException("Cannot apply " + type + " in state " + state);
    }
}
