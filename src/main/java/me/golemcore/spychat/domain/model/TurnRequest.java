package me.golemcore.spychat.domain.model;

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

import lombok.Builder;
import lombok.Data;
import me.golemcore.spychat.domain.component.ToolComponent;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs of one agent turn. {@link #history} already ends with the user's
 * message.
 */
@Data
@Builder
public class TurnRequest {

    private Persona persona;
    private String systemPrompt;
    private String userText;

    @Builder.Default
    private List<Message> history = new ArrayList<>();

    @Builder.Default
    private List<ToolComponent> tools = new ArrayList<>();
}
