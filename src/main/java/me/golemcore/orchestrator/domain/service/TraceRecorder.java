package me.golemcore.orchestrator.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Trace;
import me.golemcore.orchestrator.domain.model.TraceEvent;
import me.golemcore.orchestrator.domain.model.TraceMetrics;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * In-memory recorder of per-request traces.
 *
 * <p>
 * Tracing is best-effort: unknown trace ids are ignored and internal failures
 * are logged and swallowed, so the request path never fails because of the
 * recorder. Retention is bounded by {@code orchestrator.trace.max-traces} and
 * {@code orchestrator.trace.ttl}; the oldest completed traces are evicted
 * first.
 */
@Service
@Slf4j
public class TraceRecorder {

    private static final int TRACE_ID_LENGTH = 8;

    private final Clock clock;
    private final int maxTraces;
    private final Duration ttl;

    private final Map<String, Trace> activeTraces = new ConcurrentHashMap<>();
    private final Map<String, Trace> completedTraces = new ConcurrentHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();

    public TraceRecorder(OrchestratorProperties properties, Clock clock) {
        OrchestratorProperties.TraceProperties traceProperties = properties.getTrace();
        this.clock = clock;
        this.maxTraces = traceProperties.getMaxTraces();
        this.ttl = traceProperties.getTtl();
        log.info("[Trace] Recorder configured (maxTraces: {}, ttl: {})", maxTraces, ttl);
    }

    // ==================== lifecycle ====================

    public String begin(String userId, String sessionId) {
        String traceId = newTraceId();
        Trace trace = Trace.builder()
                .traceId(traceId)
                .userId(userId)
                .sessionId(sessionId)
                .startTime(Instant.now(clock))
                .build();
        activeTraces.put(traceId, trace);
        totalRequests.incrementAndGet();
        log.debug("[Trace] Started {} for user {}", traceId, userId);
        return traceId;
    }

    public void event(String traceId, String component, TraceStep step, Map<String, Object> details,
            Long durationMs, boolean success, String error) {
        if (traceId == null) {
            return;
        }
        try {
            Trace trace = activeTraces.get(traceId);
            if (trace == null) {
                log.trace("[Trace] Ignoring event for unknown trace {}", traceId);
                return;
            }
            trace.getEvents().add(TraceEvent.builder()
                    .timestamp(Instant.now(clock))
                    .component(component)
                    .step(step)
                    .success(success)
                    .error(error)
                    .durationMs(durationMs)
                    .details(details != null ? Map.copyOf(withoutNulls(details)) : Map.of())
                    .build());
            if (trace.getStatus() == TraceStatus.STARTED) {
                trace.setStatus(TraceStatus.IN_PROGRESS);
            }
        } catch (RuntimeException e) { // NOSONAR - tracing must never break the request path
            log.warn("[Trace] Failed to record event for {}: {}", traceId, e.getMessage());
        }
    }

    public void success(String traceId, String component, TraceStep step, Map<String, Object> details,
            Long durationMs) {
        event(traceId, component, step, details, durationMs, true, null);
    }

    public void failure(String traceId, String component, TraceStep step, String error, Long durationMs) {
        event(traceId, component, step, null, durationMs, false, error);
    }

    public void end(String traceId, TraceStatus status, Map<String, Object> details) {
        if (traceId == null) {
            return;
        }
        try {
            Trace trace = activeTraces.remove(traceId);
            if (trace == null) {
                log.trace("[Trace] Ignoring end for unknown trace {}", traceId);
                return;
            }
            TraceStatus finalStatus = status != null && status.isTerminal() ? status : TraceStatus.COMPLETED;
            trace.setEndTime(Instant.now(clock));
            trace.setStatus(finalStatus);
            if (details != null) {
                trace.getMetadata().putAll(withoutNulls(details));
            }
            completedTraces.put(traceId, trace);
            if (finalStatus == TraceStatus.COMPLETED) {
                successfulRequests.incrementAndGet();
            } else {
                failedRequests.incrementAndGet();
            }
            log.debug("[Trace] Finished {} with status {} in {}ms", traceId, finalStatus,
                    trace.getDuration().toMillis());
            enforceRetention();
        } catch (RuntimeException e) { // NOSONAR - tracing must never break the request path
            log.warn("[Trace] Failed to end trace {}: {}", traceId, e.getMessage());
        }
    }

    /**
     * Run an operation and record its duration and outcome as a trace event. The
     * operation's failure is recorded and rethrown unchanged.
     */
    public <T> T timed(String traceId, String component, TraceStep step, Supplier<T> operation) {
        Instant started = Instant.now(clock);
        try {
            T result = operation.get();
            success(traceId, component, step, null, elapsedMs(started));
            return result;
        } catch (RuntimeException e) {
            failure(traceId, component, step, e.getMessage(), elapsedMs(started));
            throw e;
        }
    }

    // ==================== queries ====================

    public Trace get(String traceId) {
        Trace trace = activeTraces.get(traceId);
        return trace != null ? trace : completedTraces.get(traceId);
    }

    public List<Trace> userTraces(String userId, int limit) {
        return Stream.concat(activeTraces.values().stream(), completedTraces.values().stream())
                .filter(trace -> userId.equals(trace.getUserId()))
                .sorted(Comparator.comparing(Trace::getStartTime).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public TraceMetrics metrics() {
        List<Trace> completed = new ArrayList<>(completedTraces.values());

        double averageDuration = completed.stream()
                .map(Trace::getDuration)
                .filter(d -> d != null)
                .mapToLong(Duration::toMillis)
                .average()
                .orElse(0.0);

        Map<String, long[]> totals = new HashMap<>();
        for (Trace trace : completed) {
            for (TraceEvent event : trace.getEvents()) {
                if (event.getDurationMs() == null || event.getComponent() == null) {
                    continue;
                }
                long[] acc = totals.computeIfAbsent(event.getComponent(), k -> new long[2]);
                acc[0] += event.getDurationMs();
                acc[1]++;
            }
        }
        Map<String, TraceMetrics.ComponentPerformance> performance = new LinkedHashMap<>();
        totals.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> performance.put(entry.getKey(), TraceMetrics.ComponentPerformance.builder()
                        .totalMs(entry.getValue()[0])
                        .count(entry.getValue()[1])
                        .averageMs((double) entry.getValue()[0] / entry.getValue()[1])
                        .build()));

        long total = totalRequests.get();
        long successful = successfulRequests.get();
        return TraceMetrics.builder()
                .totalRequests(total)
                .successfulRequests(successful)
                .failedRequests(failedRequests.get())
                .successRate(total > 0 ? (double) successful / total : 0.0)
                .activeTraces(activeTraces.size())
                .completedTraces(completed.size())
                .averageDurationMs(averageDuration)
                .componentPerformance(performance)
                .build();
    }

    // ==================== retention ====================

    /**
     * Time out active traces older than the TTL, drop expired completed traces and
     * trim the completed set to the configured maximum.
     *
     * @return number of traces removed from the completed set
     */
    public synchronized int cleanup() {
        Instant cutoff = Instant.now(clock).minus(ttl);

        int removed = dropExpired(cutoff);
        for (Trace stale : List.copyOf(activeTraces.values())) {
            if (stale.getStartTime().isBefore(cutoff)) {
                end(stale.getTraceId(), TraceStatus.TIMEOUT, Map.of("reason", "trace ttl exceeded"));
            }
        }
        removed += evictOverflow();
        if (removed > 0) {
            log.info("[Trace] Cleaned up {} traces", removed);
        }
        return removed;
    }

    private synchronized void enforceRetention() {
        dropExpired(Instant.now(clock).minus(ttl));
        evictOverflow();
    }

    private int dropExpired(Instant cutoff) {
        int before = completedTraces.size();
        completedTraces.values().removeIf(trace -> completedAt(trace).isBefore(cutoff));
        return before - completedTraces.size();
    }

    private int evictOverflow() {
        int overflow = completedTraces.size() - maxTraces;
        if (overflow <= 0) {
            return 0;
        }
        completedTraces.values().stream()
                .sorted(Comparator.comparing(this::completedAt))
                .limit(overflow)
                .map(Trace::getTraceId)
                .toList()
                .forEach(completedTraces::remove);
        return overflow;
    }

    private Instant completedAt(Trace trace) {
        return trace.getEndTime() != null ? trace.getEndTime() : trace.getStartTime();
    }

    private long elapsedMs(Instant started) {
        return Duration.between(started, Instant.now(clock)).toMillis();
    }

    private String newTraceId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, TRACE_ID_LENGTH);
        } while (activeTraces.containsKey(id) || completedTraces.containsKey(id));
        return id;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> details) {
        Map<String, Object> copy = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
