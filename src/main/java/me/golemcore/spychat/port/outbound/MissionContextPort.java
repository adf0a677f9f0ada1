package me.golemcore.spychat.port.outbound;

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

import java.util.Optional;

/**
 * Source of mission briefing records.
 */
public interface MissionContextPort {

    /**
     * Loads the briefing text for a mission.
     *
     * @param missionId
     *            identifier as spoken by the user
     * @return briefing text, or empty when no such mission exists
     */
    Optional<String> fetchMissionContext(String missionId);
}
