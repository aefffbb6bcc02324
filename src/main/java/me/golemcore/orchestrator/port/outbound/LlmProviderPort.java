package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.NormalizedReply;

import java.util.concurrent.CompletableFuture;

/**
 * Port for one provider tier of the completion cascade.
 *
 * <p>
 * Implementations translate the provider-neutral {@link LlmRequest} into their
 * native API and normalize the native reply into a {@link NormalizedReply}
 * before returning. Failures complete the future exceptionally; the cascade
 * classifies them and moves on to the next tier.
 */
public interface LlmProviderPort {

    /**
     * Provider identifier referenced by {@code orchestrator.providers.order}.
     */
    String getProviderId();

    /**
     * Whether the tier is configured (enabled and has credentials).
     */
    boolean isAvailable();

    /**
     * Whether the tier can return tool directives.
     */
    boolean supportsTools();

    CompletableFuture<NormalizedReply> complete(LlmRequest request);
}
