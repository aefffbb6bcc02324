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

package me.golemcore.orchestrator.adapter.outbound.llm;

import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.LlmProviderPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Tertiary tier: an OpenAI-compatible completion endpoint used in degraded,
 * text-only mode.
 *
 * <p>
 * Only the system prompt and the latest user utterance are sent. Tools are
 * never offered and the reply is always plain text, so a turn that reaches
 * this tier cannot trigger a tool action.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.providers.fallback.api-url} - base URL of the API
 * <li>{@code orchestrator.providers.fallback.api-key} - bearer token
 * <li>{@code orchestrator.providers.fallback.model} - model name sent with the
 * request
 * </ul>
 *
 * <p>
 * Provider ID: {@code "fallback"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackTextProviderAdapter implements LlmProviderPort {

    public static final String PROVIDER_ID = "fallback";

    private final OrchestratorProperties properties;
    private final FeignClientFactory feignClientFactory;

    private FallbackCompletionApi client;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        OrchestratorProperties.FallbackProviderProperties config = properties.getProviders().getFallback();
        return config.isEnabled()
                && config.getApiUrl() != null && !config.getApiUrl().isBlank()
                && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public boolean supportsTools() {
        return false;
    }

    @Override
    public CompletableFuture<NormalizedReply> complete(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            FallbackCompletionApi api = getClient();
            OrchestratorProperties.FallbackProviderProperties config = properties.getProviders().getFallback();

            CompletionRequest apiRequest = buildRequest(request, config);
            CompletionResponse apiResponse = api.complete(config.getApiKey(), apiRequest);
            return new NormalizedReply.Text(PROVIDER_ID, extractText(apiResponse));
        });
    }

    synchronized FallbackCompletionApi getClient() {
        if (client == null) {
            String apiUrl = properties.getProviders().getFallback().getApiUrl();
            client = feignClientFactory.create(FallbackCompletionApi.class, apiUrl);
            log.info("[Providers] Fallback completion client initialized with URL: {}", apiUrl);
        }
        return client;
    }

    CompletionRequest buildRequest(LlmRequest request, OrchestratorProperties.FallbackProviderProperties config) {
        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(new ApiMessage("system", request.getSystemPrompt()));
        }
        String prompt = request.textOnlyPrompt();
        messages.add(new ApiMessage("user", prompt != null ? prompt : ""));

        CompletionRequest apiRequest = new CompletionRequest();
        apiRequest.setModel(config.getModel());
        apiRequest.setTemperature(config.getTemperature());
        apiRequest.setMessages(messages);
        return apiRequest;
    }

    private String extractText(CompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            throw new IllegalStateException("Fallback completion returned no choices");
        }
        ApiMessage message = response.getChoices().get(0).getMessage();
        if (message == null || message.getContent() == null) {
            throw new IllegalStateException("Fallback completion returned an empty message");
        }
        return message.getContent();
    }

    public interface FallbackCompletionApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        CompletionResponse complete(@Param("apiKey") String apiKey, CompletionRequest request);
    }

    @Data
    public static class CompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private double temperature;
    }

    @Data
    public static class CompletionResponse {
        private String id;
        private String model;
        private List<Choice> choices;
    }

    @Data
    public static class Choice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiMessage {
        private String role;
        private String content;
    }
}
