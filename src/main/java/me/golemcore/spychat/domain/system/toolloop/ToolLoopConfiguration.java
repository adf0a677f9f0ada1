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

import me.golemcore.spychat.domain.service.MissionContextCache;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.infrastructure.i18n.MessageService;
import me.golemcore.spychat.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolCallLoop (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(MissionContextCache missionContextCache, SpyChatProperties properties) {
        return new CachingToolExecutor(missionContextCache, properties.getTurn().getToolTimeoutMs());
    }

    @Bean
    public ToolInvocationPolicy toolInvocationPolicy() {
        return new ExplicitReferencePolicy();
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolCallLoop toolCallLoop(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            ToolInvocationPolicy toolInvocationPolicy, HistoryWriter historyWriter, MessageService messageService,
            SpyChatProperties properties, Clock clock) {
        return new DefaultToolCallLoop(llmPort, toolExecutorPort, toolInvocationPolicy, historyWriter,
                messageService, properties.getTurn(), clock);
    }
}
