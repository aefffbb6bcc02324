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
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.domain.model.ProviderAttempt;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmProviderPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a completion against the provider tiers in configured order and returns
 * the first normalized reply.
 *
 * <p>
 * Each tier is called at most once per {@link #complete}. A tier that is not
 * configured is skipped and recorded as {@code provider.unavailable}; any
 * failure is classified by {@link ProviderErrorClassifier} and the next tier
 * is tried. When no tier produces a reply a {@link ProviderUnavailableException}
 * carrying every attempt is thrown.
 *
 * <p>
 * Every attempt, skipped or not, becomes a {@code PROVIDER_CALL} trace event
 * whose component is the provider id.
 */
@Service
@Slf4j
public class ProviderFallbackExecutor {

    private final Map<String, LlmProviderPort> providers = new LinkedHashMap<>();
    private final OrchestratorProperties properties;
    private final TraceRecorder traceRecorder;
    private final Clock clock;

    public ProviderFallbackExecutor(List<LlmProviderPort> providers, OrchestratorProperties properties,
            TraceRecorder traceRecorder, Clock clock) {
        for (LlmProviderPort provider : providers) {
            this.providers.put(provider.getProviderId(), provider);
        }
        this.properties = properties;
        this.traceRecorder = traceRecorder;
        this.clock = clock;
        log.info("[Providers] Tier order: {} (registered: {})", tierOrder(), this.providers.keySet());
    }

    public NormalizedReply complete(LlmRequest request, String traceId) {
        List<ProviderAttempt> attempts = new ArrayList<>();
        long timeoutMs = properties.getProviders().getTimeoutMs();

        for (String providerId : tierOrder()) {
            LlmProviderPort provider = providers.get(providerId);
            if (provider == null || !provider.isAvailable()) {
                log.debug("[Providers] Skipping {}: not configured", providerId);
                ProviderAttempt skipped = new ProviderAttempt(providerId, false,
                        ProviderErrorClassifier.UNAVAILABLE, "not configured", 0);
                attempts.add(skipped);
                record(traceId, skipped, null);
                continue;
            }

            Instant started = Instant.now(clock);
            CompletableFuture<NormalizedReply> future = null;
            try {
                future = provider.complete(request);
                NormalizedReply reply = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                if (reply == null) {
                    throw new IllegalStateException("Provider returned no reply");
                }
                ProviderAttempt attempt = new ProviderAttempt(providerId, true, null, null, elapsedMs(started));
                attempts.add(attempt);
                record(traceId, attempt, reply);
                if (attempts.size() > 1) {
                    log.info("[Providers] {} answered after {} failed tier(s)", providerId, attempts.size() - 1);
                }
                return reply;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ProviderAttempt attempt = failed(providerId, ProviderErrorClassifier.UNKNOWN, "interrupted",
                        started);
                attempts.add(attempt);
                record(traceId, attempt, null);
                throw new ProviderUnavailableException(attempts);
            } catch (TimeoutException e) {
                future.cancel(true);
                ProviderAttempt attempt = failed(providerId, ProviderErrorClassifier.TIMEOUT,
                        "no reply within " + timeoutMs + "ms", started);
                attempts.add(attempt);
                record(traceId, attempt, null);
                log.warn("[Providers] {} timed out after {}ms, trying next tier", providerId, timeoutMs);
            } catch (ExecutionException | RuntimeException e) { // NOSONAR - any tier failure moves the cascade on
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                String code = ProviderErrorClassifier.classify(cause);
                ProviderAttempt attempt = failed(providerId, code, cause.getMessage(), started);
                attempts.add(attempt);
                record(traceId, attempt, null);
                log.warn("[Providers] {} failed ({}): {}, trying next tier", providerId, code, cause.getMessage());
            }
        }

        log.error("[Providers] All tiers failed: {}", attempts);
        throw new ProviderUnavailableException(attempts);
    }

    /**
     * Tier list for the status surface, in cascade order.
     */
    public List<Map<String, Object>> describeTiers() {
        List<Map<String, Object>> tiers = new ArrayList<>();
        int position = 1;
        for (String providerId : tierOrder()) {
            LlmProviderPort provider = providers.get(providerId);
            Map<String, Object> tier = new LinkedHashMap<>();
            tier.put("position", position++);
            tier.put("id", providerId);
            tier.put("registered", provider != null);
            tier.put("available", provider != null && provider.isAvailable());
            tier.put("toolCalling", provider != null && provider.supportsTools());
            tiers.add(tier);
        }
        return tiers;
    }

    private List<String> tierOrder() {
        return new ArrayList<>(new LinkedHashSet<>(properties.getProviders().getOrder()));
    }

    private ProviderAttempt failed(String providerId, String code, String error, Instant started) {
        return new ProviderAttempt(providerId, false, code, error, elapsedMs(started));
    }

    private void record(String traceId, ProviderAttempt attempt, NormalizedReply reply) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_code", attempt.errorCode());
        if (reply instanceof NormalizedReply.ToolDirective directive) {
            details.put("reply", "tool_directive");
            details.put("tool", directive.toolName());
        } else if (reply != null) {
            details.put("reply", "text");
        }
        traceRecorder.event(traceId, attempt.provider(), TraceStep.PROVIDER_CALL, details,
                attempt.durationMs(), attempt.success(), attempt.error());
    }

    private long elapsedMs(Instant started) {
        return Duration.between(started, Instant.now(clock)).toMillis();
    }
}
