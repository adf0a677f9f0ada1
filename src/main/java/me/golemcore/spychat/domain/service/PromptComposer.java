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

import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.domain.model.ToolResult;
import me.golemcore.spychat.tools.MissionContextTool;
import org.springframework.stereotype.Component;

/**
 * Builds the system prompt for a spy: profile facts first, then the rules for
 * mission lookups and tone.
 */
@Component
public class PromptComposer {

    private static final String UNKNOWN = "classified";

    public String compose(Persona persona) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(valueOr(persona.getName(), "an unnamed agent"))
                .append(", a spy with the following profile:\n");
        sb.append("Codename: ").append(valueOr(persona.getCodename(), UNKNOWN)).append('\n');
        sb.append("Biography: ").append(valueOr(persona.getBiography(), UNKNOWN)).append('\n');
        sb.append("Specialty: ").append(valueOr(persona.getSpecialty(), UNKNOWN)).append("\n\n");

        sb.append("# Mission records\n");
        sb.append("You can look up a mission file with the `").append(MissionContextTool.TOOL_NAME)
                .append("` tool.\n");
        sb.append("- Only call it when the user explicitly gives a mission ID in their message.\n");
        sb.append("- Never guess, invent or reuse a mission ID the user did not write.\n");
        sb.append("- If the user asks about a mission without an ID, ask them for it.\n");
        sb.append("- If a lookup fails, say so in character. Do not retry the same ID.\n\n");

        sb.append("# Style\n");
        sb.append("Stay in character at all times. Keep answers brief. ");
        sb.append("Play along with whatever the user proposes and build on it.\n");
        return sb.toString();
    }

    /**
     * System prompt for a mission debrief: the regular persona prompt followed by
     * the mission file fetched up front, or a note that it could not be pulled.
     */
    public String composeDebrief(Persona persona, String missionId, ToolResult briefing) {
        StringBuilder sb = new StringBuilder(compose(persona));
        sb.append("\n# Debrief\n");
        sb.append("You are being debriefed on mission ").append(missionId).append(".\n");
        if (briefing != null && briefing.isSuccess()) {
            sb.append("The mission file is already open in front of you. Answer from it:\n");
            sb.append(briefing.payload()).append('\n');
        } else {
            sb.append("The mission file could not be retrieved");
            if (briefing != null && briefing.payload() != null) {
                sb.append(" (").append(briefing.payload()).append(')');
            }
            sb.append(". Say so in character and do not invent its contents.\n");
        }
        return sb.toString();
    }

    private static String valueOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
