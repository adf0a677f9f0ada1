package me.golemcore.spychat.domain.service;

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
 * Helpers for judging tool argument values supplied by the LLM.
 */
public final class ArgumentValueSupport {

    private static final Set<String> PLACEHOLDERS = Set.of(
            "none", "not specified", "unspecified", "not provided", "unknown", "n/a", "null", "nil",
            "tbd", "?", "mission id", "mission_id", "<mission_id>");

    private ArgumentValueSupport() {
    }

    public static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    /**
     * True for values a model invents when it has nothing real to pass, such as
     * {@code "none"} or {@code "not specified"}.
     */
    public static boolean isPlaceholder(Object value) {
        if (isBlank(value)) {
            return true;
        }
        String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
        return PLACEHOLDERS.contains(normalized);
    }
}
