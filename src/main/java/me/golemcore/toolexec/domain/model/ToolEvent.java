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

import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Input to the tool execution state machine. Use the static factories; each
 * event type carries only the payload its transition needs.
 */
@Value
public class ToolEvent {

    Type type;
    String toolName;
    Map<String, Object> parameters;
    String executionId;
    ToolResponse result;
    ExecutionError error;

    public static ToolEvent selectTool(String toolName) {
        Objects.requireNonNull(toolName, "toolName");
        return new ToolEvent(Type.SELECT_TOOL, toolName, null, null, null, null);
    }

    public static ToolEvent setParameters(Map<String, Object> parameters) {
        return new ToolEvent(Type.SET_PARAMETERS, null, parameters, null, null, null);
    }

    public static ToolEvent execute(String executionId) {
        Objects.requireNonNull(executionId, "executionId");
        return new ToolEvent(Type.EXECUTE, null, null, executionId, null, null);
    }

    public static ToolEvent receivedResult(ToolResponse result) {
        return new ToolEvent(Type.RECEIVED_RESULT, null, null, null, result, null);
    }

    public static ToolEvent error(ExecutionError error) {
        Objects.requireNonNull(error, "error");
        return new ToolEvent(Type.ERROR, null, null, null, null, error);
    }

    public static ToolEvent cancel() {
        return new ToolEvent(Type.CANCEL, null, null, null, null, null);
    }

    public static ToolEvent reset() {
        return new ToolEvent(Type.RESET, null, null, null, null, null);
    }

    /**
     * Event kinds accepted by the state machine.
     */
    public enum Type {
        SELECT_TOOL, SET_PARAMETERS, EXECUTE, RECEIVED_RESULT, ERROR, CANCEL, RESET
    }
}
