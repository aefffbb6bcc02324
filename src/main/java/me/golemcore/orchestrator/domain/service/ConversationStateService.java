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
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.StateKind;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-user store of the active {@link ConversationState} with lazy expiry.
 *
 * <p>
 * A user has at most one active state. Installing a new state, clearing it, or
 * discovering on access that it expired moves the previous state into a
 * bounded per-user history ring. Every read-modify-write runs inside
 * {@link ConcurrentHashMap#compute} for the user's key, so concurrent callers
 * for the same user observe a single consistent transition.
 */
@Service
@Slf4j
public class ConversationStateService {

    public static final String CONFIRMATION_SESSION_ID = "confirmation_session_id";
    public static final String OPTIONS = "options";
    public static final String CURRENT_STEP = "current_step";
    public static final String TOTAL_STEPS = "total_steps";
    public static final String STEP_DATA = "step_data";

    private static final String KEY_USER_ID = "user_id";
    private static final String KEY_STATE_TYPE = "state_type";
    private static final String KEY_ORIGINAL_MESSAGE = "original_message";
    private static final String KEY_TOOL_TO_EXECUTE = "tool_to_execute";
    private static final String KEY_PARAMETERS = "parameters";
    private static final String KEY_CREATED_AT = "created_at";
    private static final String KEY_EXPIRES_AT = "expires_at";

    private final Clock clock;
    private final int historyLimit;
    private final Map<StateKind, Duration> defaultTtls = new EnumMap<>(StateKind.class);

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();
    private final Map<String, Deque<ConversationState>> history = new ConcurrentHashMap<>();

    public ConversationStateService(OrchestratorProperties properties, Clock clock) {
        OrchestratorProperties.ConversationProperties conversation = properties.getConversation();
        this.clock = clock;
        this.historyLimit = Math.max(1, conversation.getHistoryLimit());
        defaultTtls.put(StateKind.NORMAL, conversation.getNormalTtl());
        defaultTtls.put(StateKind.CONFIRMATION, conversation.getConfirmationTtl());
        defaultTtls.put(StateKind.CLARIFICATION, conversation.getClarificationTtl());
        defaultTtls.put(StateKind.MULTI_STEP, conversation.getMultiStepTtl());
    }

    /**
     * Install a new state for the user, archiving any previous one.
     *
     * @param ttl
     *            lifetime of the state, or null for the kind's default
     */
    public ConversationState set(String userId, StateKind kind, String originalMessage, String toolToExecute,
            Map<String, Object> parameters, Duration ttl) {
        Instant now = Instant.now(clock);
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl(kind);
        ConversationState state = ConversationState.builder()
                .userId(userId)
                .kind(kind)
                .originalMessage(originalMessage != null ? originalMessage : "")
                .toolToExecute(toolToExecute)
                .parameters(immutableCopy(parameters))
                .createdAt(now)
                .expiresAt(now.plus(effectiveTtl))
                .build();

        states.compute(userId, (key, previous) -> {
            if (previous != null) {
                archive(key, previous);
            }
            return state;
        });
        log.info("[State] Set {} for user {} (ttl: {}s)", kind.getValue(), userId, effectiveTtl.toSeconds());
        return state;
    }

    /**
     * Current state of the user, or null. An expired state is moved to history
     * and null is returned.
     */
    public ConversationState get(String userId) {
        Instant now = Instant.now(clock);
        return states.computeIfPresent(userId, (key, state) -> {
            if (state.isExpired(now)) {
                log.info("[State] State {} of user {} expired", state.getKind().getValue(), key);
                archive(key, state);
                return null;
            }
            return state;
        });
    }

    /**
     * Merge parameters into the live state of the user.
     *
     * @return the updated state, or null when the user has no live state
     */
    public ConversationState update(String userId, Map<String, Object> parameters) {
        Instant now = Instant.now(clock);
        ConversationState updated = states.computeIfPresent(userId, (key, state) -> {
            if (state.isExpired(now)) {
                archive(key, state);
                return null;
            }
            Map<String, Object> merged = new LinkedHashMap<>(state.getParameters());
            if (parameters != null) {
                merged.putAll(parameters);
            }
            return state.toBuilder().parameters(immutableCopy(merged)).build();
        });
        if (updated != null) {
            log.debug("[State] Updated state of user {}", userId);
        }
        return updated;
    }

    public boolean clear(String userId) {
        AtomicBoolean cleared = new AtomicBoolean(false);
        states.computeIfPresent(userId, (key, state) -> {
            archive(key, state);
            cleared.set(true);
            return null;
        });
        if (cleared.get()) {
            log.info("[State] Cleared state of user {}", userId);
        }
        return cleared.get();
    }

    // ==================== kind-specific helpers ====================

    public ConversationState setNormal(String userId) {
        return set(userId, StateKind.NORMAL, "", null, null, null);
    }

    public ConversationState setConfirmation(String userId, String originalMessage, String toolName,
            Map<String, Object> parameters, String confirmationSessionId) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (parameters != null) {
            params.putAll(parameters);
        }
        params.put(CONFIRMATION_SESSION_ID, confirmationSessionId);
        return set(userId, StateKind.CONFIRMATION, originalMessage, toolName, params, null);
    }

    public ConversationState setClarification(String userId, String originalMessage,
            List<Map<String, Object>> options) {
        return set(userId, StateKind.CLARIFICATION, originalMessage, null,
                Map.of(OPTIONS, options != null ? List.copyOf(options) : List.of()), null);
    }

    public ConversationState setMultiStep(String userId, String originalMessage, int currentStep, int totalSteps,
            Map<String, Object> stepData) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(CURRENT_STEP, currentStep);
        params.put(TOTAL_STEPS, totalSteps);
        params.put(STEP_DATA, stepData != null ? stepData : Map.of());
        return set(userId, StateKind.MULTI_STEP, originalMessage, null, params, null);
    }

    public Duration defaultTtl(StateKind kind) {
        return defaultTtls.get(kind);
    }

    // ==================== history and maintenance ====================

    /**
     * Most recent archived states of the user, oldest first.
     */
    public List<ConversationState> history(String userId, int limit) {
        Deque<ConversationState> ring = history.get(userId);
        if (ring == null || limit <= 0) {
            return List.of();
        }
        List<ConversationState> snapshot;
        synchronized (ring) {
            snapshot = new ArrayList<>(ring);
        }
        int from = Math.max(0, snapshot.size() - limit);
        return List.copyOf(snapshot.subList(from, snapshot.size()));
    }

    public int cleanupExpired() {
        int removed = 0;
        for (String userId : List.copyOf(states.keySet())) {
            ConversationState before = states.get(userId);
            if (before != null && get(userId) == null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[State] Cleaned up {} expired states", removed);
        }
        return removed;
    }

    public Map<String, Object> stats() {
        Map<String, Long> byType = new TreeMap<>();
        for (ConversationState state : states.values()) {
            byType.merge(state.getKind().getValue(), 1L, Long::sum);
        }
        int historyRecords = history.values().stream().mapToInt(Deque::size).sum();

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeStates", states.size());
        stats.put("byType", byType);
        stats.put("usersWithHistory", history.size());
        stats.put("totalHistoryRecords", historyRecords);
        return stats;
    }

    // ==================== export / import ====================

    /**
     * Flatten the live state of the user into a serializable map with ISO-8601
     * timestamps, or null when there is none.
     */
    public Map<String, Object> export(String userId) {
        ConversationState state = get(userId);
        if (state == null) {
            return null;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_USER_ID, state.getUserId());
        data.put(KEY_STATE_TYPE, state.getKind().getValue());
        data.put(KEY_ORIGINAL_MESSAGE, state.getOriginalMessage());
        data.put(KEY_TOOL_TO_EXECUTE, state.getToolToExecute());
        data.put(KEY_PARAMETERS, new LinkedHashMap<>(state.getParameters()));
        data.put(KEY_CREATED_AT, state.getCreatedAt().toString());
        data.put(KEY_EXPIRES_AT, state.getExpiresAt() != null ? state.getExpiresAt().toString() : null);
        return data;
    }

    /**
     * Restore a state produced by {@link #export(String)}. The imported state
     * replaces the user's live state; the replaced state is archived.
     *
     * @throws IllegalArgumentException
     *             when a required field is missing or malformed
     */
    @SuppressWarnings("unchecked")
    public ConversationState importState(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("State data is required");
        }
        String userId = requireString(data, KEY_USER_ID);
        try {
            Object rawParameters = data.get(KEY_PARAMETERS);
            Object expiresAt = data.get(KEY_EXPIRES_AT);
            ConversationState state = ConversationState.builder()
                    .userId(userId)
                    .kind(StateKind.fromValue(requireString(data, KEY_STATE_TYPE)))
                    .originalMessage(requireString(data, KEY_ORIGINAL_MESSAGE))
                    .toolToExecute((String) data.get(KEY_TOOL_TO_EXECUTE))
                    .parameters(immutableCopy(rawParameters instanceof Map
                            ? (Map<String, Object>) rawParameters
                            : null))
                    .createdAt(Instant.parse(requireString(data, KEY_CREATED_AT)))
                    .expiresAt(expiresAt != null ? Instant.parse(expiresAt.toString()) : null)
                    .build();
            states.compute(userId, (key, previous) -> {
                if (previous != null) {
                    archive(key, previous);
                }
                return state;
            });
            log.info("[State] Imported {} state for user {}", state.getKind().getValue(), userId);
            return state;
        } catch (DateTimeParseException | ClassCastException e) {
            throw new IllegalArgumentException("Malformed state data for user " + userId + ": " + e.getMessage(), e);
        }
    }

    private void archive(String userId, ConversationState state) {
        Deque<ConversationState> ring = history.computeIfAbsent(userId, key -> new ArrayDeque<>());
        synchronized (ring) {
            ring.addLast(state);
            while (ring.size() > historyLimit) {
                ring.removeFirst();
            }
        }
    }

    private static String requireString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing field: " + key);
        }
        return value.toString();
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
