package me.golemcore.orchestrator.domain.model;

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
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered event log of one inbound request as it passes through the router,
 * the provider cascade and the tool registry.
 *
 * <p>
 * Events are appended only while the trace is active. The recorder moves a
 * trace out of the active set exactly once, when it is ended.
 */
@Data
@Builder
public class Trace {

    private String traceId;
    private String userId;
    private String sessionId;
    private Instant startTime;
    private Instant endTime;

    @Builder.Default
    private volatile TraceStatus status = TraceStatus.STARTED;

    @Builder.Default
    private List<TraceEvent> events = new CopyOnWriteArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new ConcurrentHashMap<>();

    /**
     * Wall-clock duration of a completed trace, or null while it is active.
     */
    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }
}
