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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmProviderPort;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for provider tiers backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * The chat model is created lazily on first use so that a tier without
 * credentials never builds a client. Retries are disabled on the model; the
 * fallback cascade decides what happens after a failure.
 */
@Slf4j
public abstract class Langchain4jProviderAdapter implements LlmProviderPort {

    protected final OrchestratorProperties properties;
    private final Langchain4jMessageMapper mapper;

    private volatile ChatModel chatModel;

    protected Langchain4jProviderAdapter(OrchestratorProperties properties, Langchain4jMessageMapper mapper) {
        this.properties = properties;
        this.mapper = mapper;
    }

    /**
     * Provider settings for this tier.
     */
    protected abstract OrchestratorProperties.ModelProviderProperties config();

    protected abstract ChatModel createModel();

    @Override
    public boolean isAvailable() {
        OrchestratorProperties.ModelProviderProperties config = config();
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public boolean supportsTools() {
        return true;
    }

    @Override
    public CompletableFuture<NormalizedReply> complete(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getChatModel();
            List<ToolSpecification> tools = mapper.toToolSpecifications(request);

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(mapper.toChatMessages(request));
            if (!tools.isEmpty()) {
                builder.toolSpecifications(tools);
            }

            log.debug("[Providers] {} request: {} messages, {} tools", getProviderId(),
                    request.getMessages().size(), tools.size());
            ChatResponse response = model.chat(builder.build());
            return mapper.normalize(getProviderId(), response);
        });
    }

    protected Duration timeout() {
        return Duration.ofMillis(properties.getProviders().getTimeoutMs());
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                model = chatModel;
                if (model == null) {
                    model = createModel();
                    chatModel = model;
                    log.info("[Providers] Initialized {} with model {}", getProviderId(), config().getModel());
                }
            }
        }
        return model;
    }
}
