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

/**
 * Static catalog information about a registered tool.
 */
@Value
@Builder
public class ToolMetadata {

    String name;
    String description;
    @Builder.Default
    String version = "1.0.0";
    @Builder.Default
    String author = "system";
    @Builder.Default
    boolean requiresConfirmation = false;
    /** Human estimate such as "5-30 seconds", or null when instant. */
    String estimatedTime;
}
