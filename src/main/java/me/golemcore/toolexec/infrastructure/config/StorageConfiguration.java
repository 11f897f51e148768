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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.adapter.outbound.memory.InMemorySessionLock;
import me.golemcore.toolexec.adapter.outbound.redis.RedisSessionLock;
import me.golemcore.toolexec.adapter.outbound.redis.TieredCacheStore;
import me.golemcore.toolexec.domain.service.DistributedToolExecutionService;
import me.golemcore.toolexec.domain.service.ToolExecutionService;
import me.golemcore.toolexec.domain.statemachine.ToolStateMachine;
import me.golemcore.toolexec.port.outbound.CacheStorePort;
import me.golemcore.toolexec.port.outbound.SessionLockPort;
import me.golemcore.toolexec.port.outbound.SessionStorePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the backend connection, the stores chosen at startup, and the execution
 * service on top of them.
 *
 * <p>
 * The Redis connection is lazy: building the factory does not connect, so the
 * application starts without Redis and falls back to in-memory stores.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(ToolExecProperties properties) {
        ToolExecProperties.BackendProperties backend = properties.getBackend();
        RedisURI uri = RedisURI.create(backend.getUrl());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        standalone.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            standalone.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            standalone.setPassword(RedisPassword.of(uri.getPassword()));
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(backend.getCommandTimeout())
                .clientOptions(ClientOptions.builder()
                        .socketOptions(SocketOptions.builder()
                                .connectTimeout(backend.getConnectTimeout())
                                .build())
                        .build());
        if (uri.isSsl()) {
            client.useSsl();
        }
        return new LettuceConnectionFactory(standalone, client.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }

    @Bean
    public BackendProbe backendProbe(RedisConnectionFactory redisConnectionFactory) {
        return new RedisBackendProbe(redisConnectionFactory);
    }

    @Bean
    public SessionStoreSelection sessionStoreSelection(ToolExecProperties properties, BackendProbe backendProbe,
            StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, Clock clock,
            @Qualifier(ExecutionConfiguration.SCHEDULER) ScheduledExecutorService scheduler) {
        return new SessionStoreFactory(properties, backendProbe, stringRedisTemplate, objectMapper, clock, scheduler)
                .create();
    }

    @Bean(destroyMethod = "close")
    public SessionStorePort sessionStorePort(SessionStoreSelection selection) {
        return selection.store();
    }

    @Bean
    public SessionLockPort sessionLockPort(SessionStoreSelection selection, StringRedisTemplate stringRedisTemplate,
            ToolExecProperties properties, Clock clock) {
        if (selection.durable()) {
            return new RedisSessionLock(stringRedisTemplate, clock, properties.lockKeyPrefix());
        }
        return new InMemorySessionLock(clock);
    }

    @Bean
    public CacheStorePort cacheStorePort(SessionStoreSelection selection, StringRedisTemplate stringRedisTemplate,
            ObjectMapper objectMapper, ToolExecProperties properties, Clock clock) {
        ToolExecProperties.CacheProperties cache = properties.getCache();
        Duration defaultTtl = Duration.ofSeconds(cache.getDefaultTtlSeconds());
        if (!selection.durable()) {
            log.info("[Cache] remote tier disabled, caching in process only");
            return TieredCacheStore.localOnly(objectMapper, clock, properties.cacheKeyPrefix(), defaultTtl,
                    cache.getLocalMaxEntries());
        }
        return new TieredCacheStore(stringRedisTemplate, objectMapper, clock, properties.cacheKeyPrefix(),
                defaultTtl, cache.isLocalTierEnabled(), cache.getLocalMaxEntries(),
                Duration.ofSeconds(cache.getLocalMaxTtlSeconds()));
    }

    @Bean
    public ToolStateMachine toolStateMachine(Clock clock) {
        return new ToolStateMachine(clock);
    }

    @Bean
    public ToolExecutionService toolExecutionService(ToolStateMachine toolStateMachine,
            @Qualifier(ExecutionConfiguration.WORKERS) ExecutorService workers,
            @Qualifier(ExecutionConfiguration.TOOL_CALLS) ExecutorService toolCalls,
            @Qualifier(ExecutionConfiguration.SCHEDULER) ScheduledExecutorService scheduler, Clock clock,
            ToolExecProperties properties, SessionStoreSelection selection, SessionStorePort sessionStorePort,
            SessionLockPort sessionLockPort) {
        Duration timeout = properties.getExecution().getTimeout();
        if (!selection.durable()) {
            log.warn("[ToolExec] durable backend unavailable: sessions are process-local, "
                    + "cannot be resumed by other processes and are not locked across processes");
            return new ToolExecutionService(toolStateMachine, sessionStorePort, workers, toolCalls, scheduler, clock,
                    timeout);
        }
        log.info("[ToolExec] distributed execution enabled (lock ttl {}, heartbeat {})",
                properties.getLock().getTtl(), properties.getLock().getHeartbeat());
        return new DistributedToolExecutionService(toolStateMachine, sessionStorePort, workers, toolCalls,
                scheduler, clock, timeout, sessionLockPort, properties.getLock().getTtl(),
                properties.getLock().getHeartbeat());
    }
}
