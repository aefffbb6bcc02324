package me.golemcore.orchestrator.domain.loop;

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

import java.util.Locale;
import java.util.Set;

/**
 * Interpretation of a user's reply to a confirmation prompt.
 */
public enum ConfirmationAnswer {

    YES, NO, UNRECOGNIZED;

    private static final Set<String> YES_WORDS = Set.of("yes", "y", "ok", "да", "подтверждаю", "confirm", "✅");
    private static final Set<String> NO_WORDS = Set.of("no", "n", "нет", "отмена", "cancel", "❌");

    public static ConfirmationAnswer parse(String text) {
        if (text == null) {
            return UNRECOGNIZED;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (YES_WORDS.contains(normalized)) {
            return YES;
        }
        if (NO_WORDS.contains(normalized)) {
            return NO;
        }
        return UNRECOGNIZED;
    }
}
