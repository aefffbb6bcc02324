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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

/**
 * Primary tier: OpenAI chat completions with tool calling.
 *
 * <p>
 * Provider ID: {@code "openai"}
 */
@Component
public class OpenAiProviderAdapter extends Langchain4jProviderAdapter {

    public static final String PROVIDER_ID = "openai";

    public OpenAiProviderAdapter(OrchestratorProperties properties, Langchain4jMessageMapper mapper) {
        super(properties, mapper);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    protected OrchestratorProperties.ModelProviderProperties config() {
        return properties.getProviders().getOpenai();
    }

    @Override
    protected ChatModel createModel() {
        OrchestratorProperties.ModelProviderProperties config = config();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(config.getMaxTokens())
                .maxRetries(0)
                .timeout(timeout());

        if (hasText(config.getBaseUrl())) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }
}
