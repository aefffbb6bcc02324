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

/**
 * Short-term conversational mode of a user.
 */
public enum StateKind {
    NORMAL("normal"),
    CONFIRMATION("confirmation"),
    CLARIFICATION("clarification"),
    MULTI_STEP("multi_step");

    private final String value;

    StateKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StateKind fromValue(String value) {
        for (StateKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown state kind: " + value);
    }
}
