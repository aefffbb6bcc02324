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

package me.golemcore.orchestrator.adapter.outbound.infra;

import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.InfrastructureCommandResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.InfrastructureCommandPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Infrastructure command adapter talking to a command gateway over HTTP using
 * Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.tools.infrastructure.api-url} - gateway base URL
 * <li>{@code orchestrator.tools.infrastructure.api-key} - bearer token
 * </ul>
 *
 * <p>
 * Without a configured URL the adapter answers with emulated listings so that
 * the confirmation flow can be exercised end to end.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpInfrastructureCommandAdapter implements InfrastructureCommandPort {

    private final OrchestratorProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final Clock clock;

    private volatile CommandGatewayApi client;

    @Override
    public CompletableFuture<InfrastructureCommandResult> execute(String command, Map<String, Object> filters) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                return emulate(command);
            }
            Instant started = Instant.now(clock);
            CommandRequest request = new CommandRequest();
            request.setCommand(command);
            request.setFilters(filters != null ? filters : Map.of());
            CommandResponse response = client().execute(properties.getTools().getInfrastructure().getApiKey(),
                    request);
            long elapsed = Duration.between(started, Instant.now(clock)).toMillis();
            log.info("[Infra] Command '{}' finished in {}ms (success: {})", command, elapsed,
                    response != null && response.isSuccess());
            if (response == null) {
                return InfrastructureCommandResult.builder()
                        .success(false)
                        .command(command)
                        .error("Empty response from command gateway")
                        .executionTimeMs(elapsed)
                        .build();
            }
            return InfrastructureCommandResult.builder()
                    .success(response.isSuccess())
                    .command(command)
                    .response(response.getResponse())
                    .payload(response.getData())
                    .error(response.getError())
                    .executionTimeMs(elapsed)
                    .build();
        });
    }

    @Override
    public boolean isAvailable() {
        String url = properties.getTools().getInfrastructure().getApiUrl();
        return url != null && !url.isBlank();
    }

    private CommandGatewayApi client() {
        CommandGatewayApi current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    String url = properties.getTools().getInfrastructure().getApiUrl();
                    client = feignClientFactory.create(CommandGatewayApi.class, url);
                    log.info("[Infra] Command gateway client initialized with URL: {}", url);
                }
                current = client;
            }
        }
        return current;
    }

    private InfrastructureCommandResult emulate(String command) {
        String category = categorize(command);
        Map<String, Object> payload = switch (category) {
        case "applications" -> Map.of("apps", List.of(
                Map.of("name", "web-app", "region", "nyc3", "status", "active"),
                Map.of("name", "api-service", "region", "sfo2", "status", "active")));
        case "databases" -> Map.of("databases", List.of(
                Map.of("name", "production_db", "engine", "postgres", "version", "14"),
                Map.of("name", "analytics_db", "engine", "postgres", "version", "13")));
        case "deployments" -> Map.of("deployments", List.of(
                Map.of("id", "dep-123", "status", "success", "created_at", "2024-01-20"),
                Map.of("id", "dep-124", "status", "in_progress", "created_at", "2024-01-21")));
        default -> Map.of("message", "Emulated response for command: " + command);
        };
        log.debug("[Infra] Gateway not configured, emulating '{}'", command);
        return InfrastructureCommandResult.builder()
                .success(true)
                .command(command)
                .response("[EMULATED] Results for " + category)
                .payload(payload)
                .emulated(true)
                .executionTimeMs(0L)
                .build();
    }

    static String categorize(String command) {
        String lower = command != null ? command.toLowerCase(Locale.ROOT) : "";
        if (lower.contains("deploy")) {
            return "deployments";
        }
        if (lower.contains("database") || lower.contains("/db") || lower.contains("datname")) {
            return "databases";
        }
        if (lower.contains("app")) {
            return "applications";
        }
        return "general";
    }

    // Feign API interface
    public interface CommandGatewayApi {
        @RequestLine("POST /commands")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        CommandResponse execute(@Param("apiKey") String apiKey, CommandRequest request);
    }

    @Data
    public static class CommandRequest {
        private String command;
        private Map<String, Object> filters;
    }

    @Data
    public static class CommandResponse {
        private boolean success;
        private String response;
        private Map<String, Object> data;
        private String error;
    }
}
