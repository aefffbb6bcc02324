package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A pending sensitive action awaiting an explicit yes/no from its owner.
 * Immutable; the store replaces the instance on every status transition.
 */
@Value
@Builder(toBuilder = true)
public class ConfirmationSession {

    String sessionId;
    String userId;
    String toolName;
    @Builder.Default
    Map<String, Object> parameters = Map.of();
    String prompt;
    @Builder.Default
    ConfirmationStatus status = ConfirmationStatus.PENDING;
    Instant createdAt;
    Instant expiresAt;
    Instant resolvedAt;
    ToolResult result;

    public boolean isPending() {
        return status == ConfirmationStatus.PENDING;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
