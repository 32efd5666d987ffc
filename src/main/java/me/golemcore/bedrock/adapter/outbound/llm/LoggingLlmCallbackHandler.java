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

package me.golemcore.bedrock.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentChoice;
import me.golemcore.bedrock.domain.model.ContentResponse;
import me.golemcore.bedrock.port.outbound.LlmCallbackHandler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Callback handler that logs generation lifecycle events.
 */
@Component
@Slf4j
public class LoggingLlmCallbackHandler implements LlmCallbackHandler {

    @Override
    public void onGenerateContentStart(List<ChatTurn> turns) {
        log.debug("[LLM] Generating content for {} turns", turns.size());
    }

    @Override
    public void onGenerateContentEnd(ContentResponse response) {
        for (ContentChoice choice : response.getChoices()) {
            Map<String, Object> info = choice.getGenerationInfo() != null ? choice.getGenerationInfo() : Map.of();
            log.debug("[LLM] Generation finished: stopReason={}, inputTokens={}, outputTokens={}",
                    choice.getStopReason(),
                    info.get(ContentChoice.INPUT_TOKENS),
                    info.get(ContentChoice.OUTPUT_TOKENS));
        }
    }

    @Override
    public void onError(Throwable error) {
        log.error("[LLM] Generation failed", error);
    }
}
