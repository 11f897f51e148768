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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the tool execution core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code toolexec.*} prefix:
 * <ul>
 * <li>{@link BackendProperties} - durable backend connection</li>
 * <li>{@link SessionProperties} - session TTL and store selection</li>
 * <li>{@link CacheProperties} - tiered cache</li>
 * <li>{@link LockProperties} - distributed execution lock</li>
 * <li>{@link ExecutionProperties} - tool call limits and worker threads</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "toolexec")
@Data
public class ToolExecProperties {

    /**
     * Prefix applied to every key written to the backend.
     */
    private String keyPrefix = "mcp:";

    private boolean verbose = false;

    private BackendProperties backend = new BackendProperties();
    private SessionProperties session = new SessionProperties();
    private CacheProperties cache = new CacheProperties();
    private LockProperties lock = new LockProperties();
    private ExecutionProperties execution = new ExecutionProperties();

    public String sessionKeyPrefix() {
        return keyPrefix + "session:";
    }

    public String sessionIndexKey() {
        return keyPrefix + "session-index";
    }

    public String lockKeyPrefix() {
        return keyPrefix + "lock:";
    }

    public String cacheKeyPrefix() {
        return keyPrefix + cache.getPrefix();
    }

    @Data
    public static class BackendProperties {
        private String url = "redis://localhost:6379";
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class SessionProperties {
        private long ttlSeconds = 3600;
        private boolean forceMemory = false;
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheProperties {
        private String prefix = "cache:";
        private long defaultTtlSeconds = 300;
        private boolean localTierEnabled = true;
        private int localMaxEntries = 1000;

        /**
         * Upper bound for how long a value stays in the local tier; 0 keeps the
         * remote TTL.
         */
        private long localMaxTtlSeconds = 60;
    }

    @Data
    public static class LockProperties {
        private Duration ttl = Duration.ofSeconds(30);
        private Duration heartbeat = Duration.ofSeconds(10);
    }

    @Data
    public static class ExecutionProperties {

        /**
         * Default timeout for a tool call; zero disables it.
         */
        private Duration timeout = Duration.ZERO;

        /**
         * Threads running session operations. Tool calls run on their own pool.
         */
        private int workerThreads = 4;
    }
}
