package me.golemcore.toolexec.port.outbound;

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

import me.golemcore.toolexec.domain.model.CacheEntry;
import me.golemcore.toolexec.domain.model.CacheStats;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Port for the key/value cache. Values are opaque serialized payloads. The cache
 * is an availability and latency optimization only; it is never the source of
 * truth for session state.
 *
 * <p>
 * None of the operations throw on backend unavailability.
 */
public interface CacheStorePort {

    Optional<String> get(String key);

    /**
     * Like {@link #get(String)} but reports the tier that served the value.
     */
    Optional<CacheEntry> getEntry(String key);

    Map<String, Optional<String>> getMany(Collection<String> keys);

    /**
     * Stores with the default TTL.
     */
    void set(String key, String value);

    /**
     * Stores with an explicit TTL; {@link Duration#ZERO} means no expiry.
     *
     * @throws IllegalArgumentException
     *             if {@code ttl} is negative
     */
    void set(String key, String value, Duration ttl);

    void setMany(Map<String, String> values, Duration ttl);

    void delete(String key);

    /**
     * View of this cache whose keys are scoped under {@code namespace}.
     */
    CacheStorePort namespace(String namespace);

    /**
     * Removes every key of {@code namespace} from both tiers.
     */
    void invalidateNamespace(String namespace);

    CacheStats stats();
}
