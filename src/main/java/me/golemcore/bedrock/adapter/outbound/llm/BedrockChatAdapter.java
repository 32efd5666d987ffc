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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.adapter.outbound.bedrock.BedrockConverseClient;
import me.golemcore.bedrock.domain.exception.UnexpectedOutputException;
import me.golemcore.bedrock.domain.model.CallOptions;
import me.golemcore.bedrock.domain.model.ChatMessageType;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentChoice;
import me.golemcore.bedrock.domain.model.ContentResponse;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import me.golemcore.bedrock.port.outbound.LlmCallbackHandler;
import me.golemcore.bedrock.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * LLM adapter backed by the Amazon Bedrock Converse API.
 *
 * <p>
 * Resolves the model for each call (the call options' model, or
 * {@code bedrock.model-id} when none is given), delegates the request to
 * {@link BedrockConverseClient} and notifies every registered
 * {@link LlmCallbackHandler} of start, completion and failure.
 *
 * <p>
 * Provider ID: {@code "bedrock"}
 *
 * @see BedrockConverseClient
 * @see BedrockProperties
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BedrockChatAdapter implements LlmPort {

    private static final String PROVIDER_ID = "bedrock";

    private final BedrockProperties properties;
    private final BedrockConverseClient converseClient;
    private final List<LlmCallbackHandler> callbackHandlers;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public ContentResponse generateContent(List<ChatTurn> turns, CallOptions options) {
        CallOptions effectiveOptions = options != null ? options : CallOptions.defaults();
        String model = resolveModel(effectiveOptions);
        log.debug("[Bedrock] Generating content with model {}", model);

        callbackHandlers.forEach(handler -> handler.onGenerateContentStart(turns));

        ContentResponse response;
        try {
            response = converseClient.createCompletion(model, turns, effectiveOptions);
        } catch (RuntimeException e) {
            callbackHandlers.forEach(handler -> handler.onError(e));
            throw e;
        }

        for (LlmCallbackHandler handler : callbackHandlers) {
            handler.onGenerateContentEnd(response);
        }
        return response;
    }

    @Override
    public String call(String prompt, CallOptions options) {
        ContentResponse response = generateContent(List.of(ChatTurn.text(ChatMessageType.HUMAN, prompt)), options);
        List<ContentChoice> choices = response.getChoices();
        if (choices == null || choices.isEmpty()) {
            throw new UnexpectedOutputException("empty response from model");
        }
        return choices.get(0).getContent();
    }

    @Override
    public String getCurrentModel() {
        return properties.getModelId();
    }

    @Override
    public boolean isAvailable() {
        return properties.getRegion() != null && !properties.getRegion().isBlank();
    }

    private String resolveModel(CallOptions options) {
        String requestModel = options.getModel();
        if (requestModel != null && !requestModel.isBlank()) {
            return requestModel;
        }
        return properties.getModelId();
    }
}
