package me.golemcore.spychat.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the spy chat service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code spychat.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location and directory names</li>
 * <li>{@link LlmProperties} - LLM provider, model and endpoint</li>
 * <li>{@link TurnProperties} - tool-call bound, timeouts, worker pool</li>
 * <li>{@link CacheProperties} - mission lookup cache</li>
 * <li>{@link PersonaSeed} - spies created on first start</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "spychat")
@Data
public class SpyChatProperties {

    private StorageProperties storage = new StorageProperties();
    private LlmProperties llm = new LlmProperties();
    private TurnProperties turn = new TurnProperties();
    private CacheProperties cache = new CacheProperties();
    private List<PersonaSeed> personas = new ArrayList<>();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.spychat/workspace";
    }

    @Data
    public static class DirectoriesProperties {
        private String conversations = "conversations";
        private String personas = "personas";
        private String missions = "missions";
    }

    @Data
    public static class LlmProperties {
        /**
         * {@code openai} for any OpenAI-compatible endpoint (Ollama included), or
         * {@code anthropic}.
         */
        private String provider = "openai";
        private String model = "llama3.2";
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey = "ollama";
        private long timeoutMs = 60_000L;
        private double temperature = 0.7;
        private int maxTokens = 1024;
    }

    @Data
    public static class TurnProperties {
        private int maxToolCalls = 2;
        private long llmTimeoutMs = 90_000L;
        private long toolTimeoutMs = 15_000L;
        private long deadlineMs = 240_000L;
        private int workerThreads = 8;
    }

    @Data
    public static class CacheProperties {
        /**
         * How long an error result stays cached. Zero keeps errors until explicitly
         * invalidated.
         */
        private Duration errorTtl = Duration.ZERO;
    }

    @Data
    public static class PersonaSeed {
        private String id;
        private String name;
        private String codename;
        private String biography;
        private String specialty;
    }
}
