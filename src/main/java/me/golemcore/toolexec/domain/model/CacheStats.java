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

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of tiered cache counters.
 */
@Value
@Builder
public class CacheStats {

    boolean localTierEnabled;
    boolean remoteTierEnabled;
    int localSize;
    int localMaxSize;
    long localHits;
    long localMisses;
    long remoteHits;
    long remoteFailures;
    long staleHits;
    long sets;

    public double getLocalHitRate() {
        long total = localHits + localMisses;
        return total == 0 ? 0.0 : (double) localHits / total;
    }
}
