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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.loop.TurnHistoryStore;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic memory-bound cleanup of traces, confirmation sessions,
 * conversation states and idle turn history. Expiry itself is lazy in each store; this sweep only
 * reclaims entries nobody reads again.
 */
@Component
@Slf4j
public class RetentionSweeper {

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final TraceRecorder traceRecorder;
    private final ConfirmationSessionService confirmationSessions;
    private final ConversationStateService conversationStates;
    private final TurnHistoryStore turnHistory;
    private final OrchestratorProperties.MaintenanceProperties maintenance;

    private ScheduledExecutorService sweepExecutor;

    public RetentionSweeper(TraceRecorder traceRecorder, ConfirmationSessionService confirmationSessions,
            ConversationStateService conversationStates, TurnHistoryStore turnHistory,
            OrchestratorProperties properties) {
        this.traceRecorder = traceRecorder;
        this.confirmationSessions = confirmationSessions;
        this.conversationStates = conversationStates;
        this.turnHistory = turnHistory;
        this.maintenance = properties.getMaintenance();
    }

    @PostConstruct
    void start() {
        if (!maintenance.isEnabled()) {
            log.info("[Infra] Retention sweep disabled");
            return;
        }
        long intervalMs = maintenance.getSweepInterval().toMillis();
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Infra] Retention sweep every {}", maintenance.getSweepInterval());
    }

    @PreDestroy
    void stop() {
        if (sweepExecutor == null) {
            return;
        }
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one sweep over all stores. Failures are logged and never propagate, so
     * the schedule keeps running.
     *
     * @return number of entries removed or expired
     */
    public int sweep() {
        int removed = 0;
        try {
            removed += traceRecorder.cleanup();
            removed += confirmationSessions.cleanupExpired();
            removed += conversationStates.cleanupExpired();
            removed += turnHistory.cleanupExpired();
        } catch (RuntimeException e) { // NOSONAR - a failed sweep must not cancel the schedule
            log.warn("[Infra] Retention sweep failed: {}", e.getMessage());
        }
        if (removed > 0) {
            log.debug("[Infra] Retention sweep reclaimed {} entries", removed);
        }
        return removed;
    }
}
