package me.golemcore.orchestrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main Spring Boot application class for the conversational orchestrator.
 *
 * <p>
 * The orchestrator receives chat messages, selects an agent through a
 * priority-ordered chain, runs it against a cascade of LLM providers, dispatches
 * tool calls through the tool registry and gates sensitive tools behind an
 * explicit user confirmation. Every turn is recorded by the trace recorder.
 *
 * <p>
 * Architecture follows hexagonal (ports and adapters) layout:
 * <ul>
 * <li>{@code domain} - routing, provider cascade, tools, confirmations,
 * conversation state, tracing</li>
 * <li>{@code port} - outbound contracts for providers and tool backends</li>
 * <li>{@code adapter} - WebFlux endpoints, langchain4j and Feign clients</li>
 * <li>{@code infrastructure} - configuration and HTTP plumbing</li>
 * </ul>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
