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
 * The session is already executing, here or in a process holding its lock.
 * Callers should retry later; executions are never queued.
 */
public class SessionBusyException extends ToolExecException {

    private static final long serialVersionUID = 1L;

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Session busy: " + sessionId + " is already executing");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public int getStatusCode() {
        return 409;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
