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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.component.ToolComponent;
import me.golemcore.spychat.domain.model.Message;
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.ToolResult;
import me.golemcore.spychat.domain.service.MissionContextCache;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Executes tool calls through {@link MissionContextCache}, so identical
 * invocations across turns and conversations share one fetch.
 */
@Slf4j
public class CachingToolExecutor implements ToolExecutorPort {

    private final MissionContextCache cache;
    private final long toolTimeoutMs;

    public CachingToolExecutor(MissionContextCache cache, long toolTimeoutMs) {
        this.cache = cache;
        this.toolTimeoutMs = toolTimeoutMs;
    }

    @Override
    public ToolExecutionOutcome execute(ToolComponent tool, Message.ToolCall toolCall) {
        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        String key = MissionContextCache.cacheKey(toolCall.getName(), arguments);

        ToolResult result;
        try {
            result = cache.getAsync(key, () -> tool.execute(arguments).orTimeout(toolTimeoutMs, TimeUnit.MILLISECONDS))
                    .join();
        } catch (RuntimeException e) { // NOSONAR - reported as a tool error
            log.warn("[ToolLoop] Tool {} failed: {}", toolCall.getName(), e.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }

        ToolResult bound = result.withInvocationId(toolCall.getId());
        String content = bound.isSuccess() ? bound.payload() : "Error: " + bound.payload();
        log.debug("[ToolLoop] Tool {} -> {}", toolCall.getName(), bound.isSuccess() ? "ok" : bound.getFailureKind());
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), bound, content, false);
    }
}
