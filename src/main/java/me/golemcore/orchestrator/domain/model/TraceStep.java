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
 * Catalogue of processing steps a trace event can describe.
 */
public enum TraceStep {
    MESSAGE_RECEIVED,
    CONFIRMATION_CHECK,
    AGENT_ROUTING,
    AGENT_PROCESSING,
    PROVIDER_CALL,
    TOOL_EXECUTION,
    CONFIRMATION_REQUEST,
    RESPONSE_GENERATION,
    RESPONSE_SENT,
    ERROR_HANDLING
}
