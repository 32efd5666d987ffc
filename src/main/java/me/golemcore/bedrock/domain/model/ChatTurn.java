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

package me.golemcore.bedrock.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single role-tagged turn of a conversation holding one or more content
 * parts. Turns are immutable once built.
 */
@Value
@Builder
public class ChatTurn {

    ChatMessageType role;

    @Singular
    List<ContentPart> parts;

    /**
     * Creates a turn with a single text part.
     */
    public static ChatTurn text(ChatMessageType role, String text) {
        return ChatTurn.builder()
                .role(role)
                .part(TextContent.of(text))
                .build();
    }

    public boolean isSystem() {
        return role == ChatMessageType.SYSTEM;
    }
}
