package me.golemcore.orchestrator.domain.loop;

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
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent user/assistant exchanges per user, bounded to
 * {@code orchestrator.conversation.max-turns} turns. Fed to the providers as
 * conversation context.
 *
 * <p>
 * Users idle for longer than {@code orchestrator.conversation.history-ttl} are
 * dropped by {@link #cleanupExpired()}.
 */
@Component
@Slf4j
public class TurnHistoryStore {

    private final Map<String, History> turns = new ConcurrentHashMap<>();
    private final int maxMessages;
    private final Duration ttl;
    private final Clock clock;

    public TurnHistoryStore(OrchestratorProperties properties, Clock clock) {
        this.maxMessages = Math.max(0, properties.getConversation().getMaxTurns()) * 2;
        this.ttl = properties.getConversation().getHistoryTtl();
        this.clock = clock;
    }

    public void append(String userId, String userText, String assistantText) {
        if (maxMessages == 0) {
            return;
        }
        History history = turns.computeIfAbsent(userId, key -> new History());
        synchronized (history) {
            history.messages.addLast(Message.user(userText));
            history.messages.addLast(Message.assistant(assistantText != null ? assistantText : ""));
            while (history.messages.size() > maxMessages) {
                history.messages.removeFirst();
            }
            history.lastTouched = clock.instant();
        }
    }

    /**
     * Snapshot of the user's recent messages, oldest first.
     */
    public List<Message> recent(String userId) {
        History history = turns.get(userId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(new ArrayList<>(history.messages));
        }
    }

    public boolean clear(String userId) {
        return turns.remove(userId) != null;
    }

    public int users() {
        return turns.size();
    }

    /**
     * Drop users whose last exchange is older than the history TTL.
     *
     * @return number of users removed
     */
    public int cleanupExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        for (Map.Entry<String, History> entry : turns.entrySet()) {
            if (entry.getValue().lastTouched().isBefore(cutoff) && turns.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Turn] Dropped turn history of {} idle user(s)", removed);
        }
        return removed;
    }

    private final class History {
        private final Deque<Message> messages = new ArrayDeque<>();
        private Instant lastTouched = clock.instant();

        synchronized Instant lastTouched() {
            return lastTouched;
        }
    }
}
