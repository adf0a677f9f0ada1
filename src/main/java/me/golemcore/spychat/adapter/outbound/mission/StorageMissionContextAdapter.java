package me.golemcore.spychat.adapter.outbound.mission;

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
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.port.outbound.MissionContextPort;
import me.golemcore.spychat.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads mission briefings from {@code missions/<missionId>.txt} in the
 * workspace. Ids outside {@code [A-Za-z0-9_-]} are treated as unknown so a
 * mission id can never address a file outside the missions directory.
 */
@Component
@Slf4j
public class StorageMissionContextAdapter implements MissionContextPort {

    private static final Pattern MISSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final String EXTENSION = ".txt";

    private final StoragePort storagePort;
    private final String directory;

    public StorageMissionContextAdapter(StoragePort storagePort, SpyChatProperties properties) {
        this.storagePort = storagePort;
        this.directory = properties.getStorage().getDirectories().getMissions();
    }

    @Override
    public Optional<String> fetchMissionContext(String missionId) {
        if (missionId == null || !MISSION_ID.matcher(missionId).matches()) {
            log.debug("[Missions] Rejected mission id: {}", missionId);
            return Optional.empty();
        }
        String content = storagePort.getText(directory, missionId + EXTENSION).join();
        if (content == null) {
            log.debug("[Missions] No mission file for {}", missionId);
            return Optional.empty();
        }
        log.debug("[Missions] Loaded mission {} ({} chars)", missionId, content.length());
        return Optional.of(content);
    }
}
