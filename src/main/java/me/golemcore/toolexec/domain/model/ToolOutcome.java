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

import java.util.Objects;

/**
 * Value produced by a tool function, tagged with whether it is already a
 * {@link ToolResponse} envelope or a raw result that still has to be wrapped.
 */
public final class ToolOutcome {

    private final Object value;
    private final ToolResponse envelope;

    private ToolOutcome(Object value, ToolResponse envelope) {
        this.value = value;
        this.envelope = envelope;
    }

    /**
     * A raw result; the execution service wraps it in a success envelope.
     */
    public static ToolOutcome raw(Object value) {
        return new ToolOutcome(value, null);
    }

    /**
     * A pre-built envelope that is recorded verbatim.
     */
    public static ToolOutcome enveloped(ToolResponse envelope) {
        return new ToolOutcome(null, Objects.requireNonNull(envelope, "envelope"));
    }

    public boolean isEnveloped() {
        return envelope != null;
    }

    public Object getValue() {
        return value;
    }

    public ToolResponse getEnvelope() {
        return envelope;
    }
}
