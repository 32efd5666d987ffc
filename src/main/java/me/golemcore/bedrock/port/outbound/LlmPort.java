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

import me.golemcore.bedrock.domain.model.CallOptions;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentResponse;

import java.util.List;

/**
 * Port for generating chat completions from an LLM provider. Calls are
 * synchronous and return a single-choice response.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "bedrock").
     */
    String getProviderId();

    /**
     * Generates a completion for a multi-turn conversation.
     */
    ContentResponse generateContent(List<ChatTurn> turns, CallOptions options);

    /**
     * Generates a completion for a single human prompt and returns its text.
     */
    String call(String prompt, CallOptions options);

    /**
     * Returns the model identifier used when the call options name none.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
