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
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ConfirmationOutcome;
import me.golemcore.orchestrator.domain.model.ConfirmationResolution;
import me.golemcore.orchestrator.domain.model.ConfirmationSession;
import me.golemcore.orchestrator.domain.model.ConfirmationStatus;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Store of confirmation sessions gating sensitive tool executions.
 *
 * <p>
 * Each session is bound to one user and one tool invocation. A resolve attempt
 * passes four checks in order (exists, owner matches, still pending, not
 * expired) and the pending-to-resolved transition happens inside
 * {@link ConcurrentHashMap#computeIfPresent} for the session id. Only the
 * caller that wins that transition with {@code confirmed=true} runs the tool,
 * so a session executes its tool at most once. Expiry is checked lazily on
 * resolve and listing; {@link #cleanupExpired()} only bounds memory.
 */
@Service
@Slf4j
public class ConfirmationSessionService {

    private static final int SESSION_ID_LENGTH = 8;

    private final ToolRegistry toolRegistry;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration retention;

    private final Map<String, ConfirmationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userSessions = new ConcurrentHashMap<>();

    public ConfirmationSessionService(ToolRegistry toolRegistry, OrchestratorProperties properties, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.clock = clock;
        this.defaultTtl = properties.getConfirmation().getDefaultTtl();
        this.retention = properties.getConfirmation().getRetention();
    }

    /**
     * Open a new pending session.
     *
     * @param prompt
     *            text shown to the user, or null to render it from the tool
     * @param ttl
     *            lifetime, or null for {@code orchestrator.confirmation.default-ttl}
     * @return a fresh session id
     */
    public String open(String userId, String toolName, Map<String, Object> parameters, String prompt,
            Duration ttl) {
        Instant now = Instant.now(clock);
        Map<String, Object> params = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();

        AtomicReference<String> created = new AtomicReference<>();
        while (created.get() == null) {
            String candidate = UUID.randomUUID().toString().substring(0, SESSION_ID_LENGTH);
            sessions.computeIfAbsent(candidate, id -> {
                created.set(id);
                return ConfirmationSession.builder()
                        .sessionId(id)
                        .userId(userId)
                        .toolName(toolName)
                        .parameters(params)
                        .prompt(prompt != null ? prompt : renderPrompt(toolName, params))
                        .createdAt(now)
                        .expiresAt(now.plus(ttl != null ? ttl : defaultTtl))
                        .build();
            });
        }
        String sessionId = created.get();
        userSessions.computeIfAbsent(userId, key -> ConcurrentHashMap.newKeySet()).add(sessionId);
        log.info("[Confirm] Opened session {} for user {} (tool: {})", sessionId, userId, toolName);
        return sessionId;
    }

    /**
     * Resolve a session.
     *
     * @param userId
     *            caller's user id, or null to skip the ownership check
     * @return the tool result when confirmed and executed, otherwise null
     */
    public ToolResult resolve(String sessionId, boolean confirmed, String userId) {
        return resolveDetailed(sessionId, confirmed, userId).result();
    }

    public ConfirmationResolution resolveDetailed(String sessionId, boolean confirmed, String userId) {
        Instant now = Instant.now(clock);
        AtomicReference<ConfirmationOutcome> outcome = new AtomicReference<>();

        ConfirmationSession resolved = sessionId == null ? null
                : sessions.computeIfPresent(sessionId, (id, session) -> {
                    if (userId != null && !userId.equals(session.getUserId())) {
                        outcome.set(ConfirmationOutcome.USER_MISMATCH);
                        return session;
                    }
                    if (!session.isPending()) {
                        outcome.set(ConfirmationOutcome.ALREADY_RESOLVED);
                        return session;
                    }
                    if (session.isExpired(now)) {
                        outcome.set(ConfirmationOutcome.EXPIRED);
                        return session.toBuilder().status(ConfirmationStatus.EXPIRED).build();
                    }
                    outcome.set(confirmed ? ConfirmationOutcome.EXECUTED : ConfirmationOutcome.CANCELLED);
                    return session.toBuilder()
                            .status(confirmed ? ConfirmationStatus.CONFIRMED : ConfirmationStatus.CANCELLED)
                            .resolvedAt(now)
                            .build();
                });

        if (resolved == null) {
            log.warn("[Confirm] Session {} not found", sessionId);
            return ConfirmationResolution.rejected(ConfirmationOutcome.NOT_FOUND, null);
        }

        switch (outcome.get()) {
        case USER_MISMATCH -> {
            log.warn("[Confirm] User {} tried to resolve session {} owned by {}", userId, sessionId,
                    resolved.getUserId());
            return ConfirmationResolution.rejected(ConfirmationOutcome.USER_MISMATCH, resolved);
        }
        case ALREADY_RESOLVED -> {
            log.warn("[Confirm] Session {} already resolved ({})", sessionId, resolved.getStatus());
            return ConfirmationResolution.rejected(ConfirmationOutcome.ALREADY_RESOLVED, resolved);
        }
        case EXPIRED -> {
            log.info("[Confirm] Session {} expired", sessionId);
            return ConfirmationResolution.rejected(ConfirmationOutcome.EXPIRED, resolved);
        }
        case CANCELLED -> {
            log.info("[Confirm] Session {} cancelled by user", sessionId);
            return ConfirmationResolution.rejected(ConfirmationOutcome.CANCELLED, resolved);
        }
        default -> {
            log.info("[Confirm] Session {} confirmed, executing {}", sessionId, resolved.getToolName());
            ToolResult result = toolRegistry.execute(resolved.getToolName(), resolved.getParameters());
            ConfirmationSession withResult = sessions.computeIfPresent(sessionId,
                    (id, session) -> session.toBuilder().result(result).build());
            return new ConfirmationResolution(ConfirmationOutcome.EXECUTED,
                    withResult != null ? withResult : resolved, result);
        }
        }
    }

    // ==================== queries ====================

    public ConfirmationSession get(String sessionId) {
        return sessionId != null ? sessions.get(sessionId) : null;
    }

    /**
     * Pending sessions of the user, newest first. Sessions found past their expiry
     * are marked expired and left out.
     */
    public List<ConfirmationSession> pending(String userId) {
        Set<String> ids = userSessions.get(userId);
        if (ids == null) {
            return List.of();
        }
        Instant now = Instant.now(clock);
        return ids.stream()
                .map(id -> expireIfDue(id, now))
                .filter(session -> session != null && session.isPending())
                .sorted(Comparator.comparing(ConfirmationSession::getCreatedAt).reversed())
                .toList();
    }

    public boolean cancel(String sessionId) {
        Instant now = Instant.now(clock);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        if (sessionId != null) {
            sessions.computeIfPresent(sessionId, (id, session) -> {
                if (!session.isPending()) {
                    return session;
                }
                cancelled.set(true);
                return session.toBuilder().status(ConfirmationStatus.CANCELLED).resolvedAt(now).build();
            });
        }
        if (cancelled.get()) {
            log.info("[Confirm] Session {} cancelled", sessionId);
        }
        return cancelled.get();
    }

    // ==================== maintenance ====================

    /**
     * Mark overdue pending sessions as expired and drop finished sessions older
     * than the retention window.
     *
     * @return number of sessions newly marked expired
     */
    public int cleanupExpired() {
        Instant now = Instant.now(clock);
        int expired = 0;
        for (String sessionId : List.copyOf(sessions.keySet())) {
            ConfirmationSession before = sessions.get(sessionId);
            ConfirmationSession after = expireIfDue(sessionId, now);
            if (before != null && before.isPending() && after != null && !after.isPending()) {
                expired++;
            }
        }

        Instant cutoff = now.minus(retention);
        sessions.values().removeIf(session -> !session.isPending() && session.getExpiresAt().isBefore(cutoff));
        userSessions.forEach((userId, ids) -> ids.removeIf(id -> !sessions.containsKey(id)));
        userSessions.values().removeIf(Set::isEmpty);

        if (expired > 0) {
            log.info("[Confirm] Marked {} sessions expired", expired);
        }
        return expired;
    }

    public Map<String, Object> stats() {
        Map<String, Long> byStatus = new TreeMap<>();
        double totalResponseSeconds = 0;
        int responded = 0;
        for (ConfirmationSession session : sessions.values()) {
            byStatus.merge(session.getStatus().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
            boolean answered = session.getStatus() == ConfirmationStatus.CONFIRMED
                    || session.getStatus() == ConfirmationStatus.CANCELLED;
            if (answered && session.getResolvedAt() != null) {
                totalResponseSeconds += Duration.between(session.getCreatedAt(), session.getResolvedAt())
                        .toMillis() / 1000.0;
                responded++;
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalSessions", sessions.size());
        stats.put("byStatus", byStatus);
        stats.put("pendingSessions", byStatus.getOrDefault("pending", 0L));
        stats.put("activeUsers", userSessions.size());
        stats.put("avgResponseTimeSeconds", responded > 0 ? totalResponseSeconds / responded : 0.0);
        return stats;
    }

    private ConfirmationSession expireIfDue(String sessionId, Instant now) {
        return sessions.computeIfPresent(sessionId, (id, session) -> {
            if (session.isPending() && session.isExpired(now)) {
                return session.toBuilder().status(ConfirmationStatus.EXPIRED).build();
            }
            return session;
        });
    }

    private String renderPrompt(String toolName, Map<String, Object> parameters) {
        ToolComponent tool = toolRegistry.get(toolName);
        if (tool != null) {
            return tool.confirmationMessage(parameters);
        }
        return "Confirm execution of " + toolName + "? Reply yes or no.";
    }
}
