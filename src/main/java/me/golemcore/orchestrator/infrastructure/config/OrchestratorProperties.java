package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link ProvidersProperties} - provider tiers and their credentials</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link TraceProperties} - trace retention bounds</li>
 * <li>{@link ConfirmationProperties} - confirmation session timeouts</li>
 * <li>{@link ConversationProperties} - per-kind state TTLs and history</li>
 * <li>{@link ToolsProperties} - tool execution and backends</li>
 * <li>{@link AgentsProperties} - agent routing predicates</li>
 * <li>{@link MaintenanceProperties} - background retention sweep</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private ProvidersProperties providers = new ProvidersProperties();
    private HttpProperties http = new HttpProperties();
    private TraceProperties trace = new TraceProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private ToolsProperties tools = new ToolsProperties();
    private AgentsProperties agents = new AgentsProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private List<String> order = new ArrayList<>(List.of("openai", "anthropic", "fallback"));
        private long timeoutMs = 60000;
        private String systemPrompt = "You are a helpful assistant with access to infrastructure tools. "
                + "Use a tool only when the user asks for an action it covers. Answer briefly.";
        private ModelProviderProperties openai = new ModelProviderProperties("gpt-4o-mini");
        private ModelProviderProperties anthropic = new ModelProviderProperties("claude-3-5-haiku-latest");
        private FallbackProviderProperties fallback = new FallbackProviderProperties();
    }

    @Data
    public static class ModelProviderProperties {
        private boolean enabled = true;
        private String apiKey;
        private String model;
        private String baseUrl;
        private int maxTokens = 1024;
        private Double temperature = 0.7;

        public ModelProviderProperties() {
        }

        public ModelProviderProperties(String model) {
            this.model = model;
        }
    }

    @Data
    public static class FallbackProviderProperties {
        private boolean enabled = true;
        private String apiUrl;
        private String apiKey;
        private String model = "default";
        private double temperature = 0.7;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TRACING ====================

    @Data
    public static class TraceProperties {
        private int maxTraces = 1000;
        private Duration ttl = Duration.ofHours(24);
    }

    // ==================== CONFIRMATION ====================

    @Data
    public static class ConfirmationProperties {
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Duration retention = Duration.ofHours(1);
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        private int historyLimit = 10;
        private int maxTurns = 20;
        private Duration historyTtl = Duration.ofHours(1);
        private Duration normalTtl = Duration.ofSeconds(60);
        private Duration confirmationTtl = Duration.ofMinutes(5);
        private Duration clarificationTtl = Duration.ofMinutes(3);
        private Duration multiStepTtl = Duration.ofMinutes(10);
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Duration executionTimeout = Duration.ofSeconds(30);
        private List<String> disabled = new ArrayList<>();
        private InfrastructureProperties infrastructure = new InfrastructureProperties();
    }

    @Data
    public static class InfrastructureProperties {
        private String apiUrl;
        private String apiKey;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentsProperties {
        private List<String> adminUsers = new ArrayList<>();
        private List<String> commandPrefixes = new ArrayList<>(List.of("/mcp", "/db", "/docs"));
    }

    // ==================== MAINTENANCE ====================

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = true;
        private Duration sweepInterval = Duration.ofMinutes(1);
    }
}
