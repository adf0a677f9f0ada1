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
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.ToolResult;

/**
 * Result of one tool invocation as folded back into the conversation.
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        ToolResult failure = ToolResult.failure(kind, reason).withInvocationId(toolCall.getId());
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), failure, "Error: " + reason, true);
    }
}
