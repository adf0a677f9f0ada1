package me.golemcore.spychat.domain.system.toolloop;

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

import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.ToolDefinition;
import me.golemcore.spychat.domain.service.ArgumentValueSupport;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Allows a tool call only when every required argument value appears verbatim
 * in the user's message, as a whole token and ignoring case, and is not a
 * placeholder such as {@code "none"}. Stops the model from guessing record ids.
 */
public class ExplicitReferencePolicy implements ToolInvocationPolicy {

    private static final String TOKEN_CHARS = "A-Za-z0-9_\\-";

    @Override
    public Decision evaluate(ToolDefinition definition, Message.ToolCall call, String userText) {
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        for (String required : definition.requiredArguments()) {
            Object value = arguments.get(required);
            if (ArgumentValueSupport.isPlaceholder(value)) {
                return Decision.deny(required, "missing or placeholder value");
            }
            if (!mentions(userText, value.toString().trim())) {
                return Decision.deny(required, "value not present in user message: " + value);
            }
        }
        return Decision.allow();
    }

    static boolean mentions(String text, String value) {
        if (text == null || text.isBlank() || value.isEmpty()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?<![" + TOKEN_CHARS + "])" + Pattern.quote(value)
                + "(?![" + TOKEN_CHARS + "])", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return pattern.matcher(text).find();
    }
}
