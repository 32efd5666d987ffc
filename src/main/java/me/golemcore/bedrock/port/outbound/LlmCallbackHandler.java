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

package me.golemcore.bedrock.port.outbound;

import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentResponse;

import java.util.List;

/**
 * Receives lifecycle notifications for content generation calls. All methods
 * default to no-ops so handlers only override what they need.
 */
public interface LlmCallbackHandler {

    default void onGenerateContentStart(List<ChatTurn> turns) {
        // Default no-op
    }

    default void onGenerateContentEnd(ContentResponse response) {
        // Default no-op
    }

    default void onError(Throwable error) {
        // Default no-op
    }
}
