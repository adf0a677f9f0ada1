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

/**
 * Decides whether the LLM may invoke a tool with the arguments it chose.
 */
public interface ToolInvocationPolicy {

    Decision evaluate(ToolDefinition definition, Message.ToolCall call, String userText);

    /**
     * @param allowed
     *            whether the invocation may run
     * @param argument
     *            the offending argument when denied
     * @param reason
     *            diagnostic for logs
     */
    record Decision(boolean allowed, String argument, String reason) {

        public static Decision allow() {
            return new Decision(true, null, null);
        }

        public static Decision deny(String argument, String reason) {
            return new Decision(false, argument, reason);
        }
    }
}
