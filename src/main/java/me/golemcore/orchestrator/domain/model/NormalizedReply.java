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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider reply normalized into one closed shape: either plain text or a
 * directive to invoke a tool. Every provider adapter produces one of these
 * variants, so callers never branch on provider identity.
 */
public sealed interface NormalizedReply permits NormalizedReply.Text, NormalizedReply.ToolDirective {

    /** Identity of the provider tier that produced the reply. */
    String provider();

    /** Free text of the reply; may be empty for a tool directive. */
    String text();

    record Text(String provider, String text) implements NormalizedReply {
    }

    record ToolDirective(String provider, String text, String callId, String toolName,
            Map<String, Object> arguments) implements NormalizedReply {

        public ToolDirective {
            arguments = arguments != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                    : Map.of();
        }
    }
}
