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

import java.util.List;

/**
 * Raised when every provider tier failed or was unavailable. The only error
 * that aborts a turn.
 */
public class ProviderUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<ProviderAttempt> attempts;

    public ProviderUnavailableException(List<ProviderAttempt> attempts) {
        super("No provider available: " + describe(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    private static String describe(List<ProviderAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "no providers configured";
        }
        StringBuilder sb = new StringBuilder();
        for (ProviderAttempt attempt : attempts) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(attempt.provider()).append('=').append(attempt.errorCode());
        }
        return sb.toString();
    }
}
