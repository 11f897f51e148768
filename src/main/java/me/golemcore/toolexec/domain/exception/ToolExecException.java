package me.golemcore.toolexec.domain.exception;

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

/**
 * Base type for failures surfaced by the tool execution core. Each subtype maps
 * to an HTTP-like status code used when the failure is rendered as an error
 * envelope.
 */
public abstract class ToolExecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ToolExecException(String message) {
        super(message);
    }

    protected ToolExecException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int getStatusCode();

    /**
     * Whether the caller may retry the same operation later.
     */
    public boolean isRetryable() {
        return false;
    }
}
