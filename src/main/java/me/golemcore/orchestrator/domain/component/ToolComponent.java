package me.golemcore.orchestrator.domain.component;

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

import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for tools the orchestrator can dispatch.
 *
 * <p>
 * A tool declares its catalog metadata and a JSON-schema parameter contract.
 * The registry validates parameters against that contract before calling
 * {@link #execute(Map)}, and converts anything the tool throws into a failure
 * result.
 */
public interface ToolComponent {

    ToolMetadata getMetadata();

    ToolDefinition getDefinition();

    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getMetadata().getName();
    }

    /**
     * Validate parameters against the declared contract.
     *
     * @return an error naming the offending field, or empty when valid
     */
    default Optional<String> validate(Map<String, Object> parameters) {
        return ToolParameterValidator.validate(getDefinition().getInputSchema(), parameters);
    }

    /**
     * Prompt shown to the user before a confirmation-gated execution.
     */
    default String confirmationMessage(Map<String, Object> parameters) {
        ToolMetadata metadata = getMetadata();
        StringBuilder sb = new StringBuilder();
        sb.append("Confirmation required\n\n");
        sb.append("Tool: ").append(metadata.getName()).append('\n');
        sb.append(metadata.getDescription()).append('\n');
        if (parameters != null && !parameters.isEmpty()) {
            sb.append("\nParameters:\n");
            parameters.forEach((key, value) -> {
                if (!"user_id".equals(key)) {
                    sb.append("- ").append(key).append(": ").append(value).append('\n');
                }
            });
        }
        if (metadata.getEstimatedTime() != null) {
            sb.append("\nEstimated time: ").append(metadata.getEstimatedTime()).append('\n');
        }
        sb.append("\nProceed? Reply yes or no.");
        return sb.toString();
    }
}
