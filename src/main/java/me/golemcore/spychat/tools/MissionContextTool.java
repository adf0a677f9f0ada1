package me.golemcore.spychat.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.component.ToolComponent;
import me.golemcore.spychat.domain.model.ToolDefinition;
import me.golemcore.spychat.domain.model.ToolFailureKind;
import me.golemcore.spychat.domain.model.ToolResult;
import me.golemcore.spychat.domain.service.ArgumentValueSupport;
import me.golemcore.spychat.port.outbound.MissionContextPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Tool for retrieving a mission briefing by id.
 *
 * <p>
 * The model is instructed to call it only when the user names a mission id;
 * the tool-call loop enforces the same rule before the tool ever runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MissionContextTool implements ToolComponent {

    public static final String TOOL_NAME = "get_mission_context";
    public static final String PARAM_MISSION_ID = "mission_id";

    private static final Pattern MISSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final MissionContextPort missionContextPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Retrieves context information for a specific mission. "
                        + "ONLY use this tool when the user has explicitly provided a mission ID in their message. "
                        + "Do NOT guess or invent mission IDs. If the user asks about a mission without giving "
                        + "its ID, ask them which mission they mean instead of calling this tool.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_MISSION_ID, Map.of(
                                        "type", "string",
                                        "description", "Unique ID of the mission to retrieve")),
                        "required", List.of(PARAM_MISSION_ID)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object raw = parameters != null ? parameters.get(PARAM_MISSION_ID) : null;
        if (ArgumentValueSupport.isPlaceholder(raw)) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "No mission ID provided. Please specify a mission ID."));
        }
        String missionId = raw.toString().trim();
        if (!MISSION_ID_PATTERN.matcher(missionId).matches()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid mission ID: " + missionId));
        }

        return CompletableFuture.supplyAsync(() -> {
            Optional<String> context = missionContextPort.fetchMissionContext(missionId);
            if (context.isEmpty()) {
                log.debug("[MissionTool] No mission found: {}", missionId);
                return ToolResult.failure(ToolFailureKind.NOT_FOUND, "No mission found with ID: " + missionId);
            }
            return ToolResult.success(context.get());
        });
    }
}
