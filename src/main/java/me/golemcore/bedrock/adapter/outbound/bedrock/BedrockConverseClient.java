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

package me.golemcore.bedrock.adapter.outbound.bedrock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.CallOptions;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentResponse;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;

import java.util.List;

/**
 * Runs one chat completion against the Bedrock Converse API.
 *
 * <p>
 * The request is fully translated before the transport is touched, so an
 * invalid turn never results in a network call. The single blocking
 * {@code converse} call is neither retried nor timed out here; AWS SDK
 * exceptions propagate to the caller unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BedrockConverseClient {

    private final BedrockRuntimeClient bedrockRuntimeClient;
    private final BedrockMessageTranslator translator;
    private final BedrockResponseAssembler assembler;

    public ContentResponse createCompletion(String modelId, List<ChatTurn> turns, CallOptions options) {
        ConverseRequest request = translator.translate(modelId, turns, options);

        log.debug("[Bedrock] Sending converse request: model={}, messages={}", modelId,
                request.messages().size());
        ConverseResponse response = bedrockRuntimeClient.converse(request);

        return assembler.assemble(response);
    }
}
