package me.golemcore.loom.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message carried by a node. Written once together with its node and never
 * changed afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeMessage {

    private Role role;
    private String content;
    private Instant timestamp;

    public static NodeMessage user(String content, Instant timestamp) {
        return new NodeMessage(Role.USER, content, timestamp);
    }

    public static NodeMessage assistant(String content, Instant timestamp) {
        return new NodeMessage(Role.ASSISTANT, content, timestamp);
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return role == Role.USER;
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return role == Role.ASSISTANT;
    }
}
