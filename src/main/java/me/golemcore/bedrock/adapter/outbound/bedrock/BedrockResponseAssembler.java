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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.exception.UnexpectedOutputException;
import me.golemcore.bedrock.domain.model.ContentChoice;
import me.golemcore.bedrock.domain.model.ContentResponse;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseOutput;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.ImageBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ImageSource;
import software.amazon.awssdk.services.bedrockruntime.model.TokenUsage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a {@link ConverseResponse} into a single-choice
 * {@link ContentResponse}.
 *
 * <p>
 * Text blocks and byte-sourced image blocks are joined with {@code "\n"} in
 * response order. Any other block kind (documents, tool use, citations,
 * reasoning) is skipped without error. The output itself must be the message
 * variant; anything else fails with {@link UnexpectedOutputException}.
 */
@Component
@Slf4j
public class BedrockResponseAssembler {

    private static final String SEPARATOR = "\n";

    public ContentResponse assemble(ConverseResponse response) {
        ConverseOutput output = response.output();
        // Converse is documented to always return a message
        if (output == null || output.type() != ConverseOutput.Type.MESSAGE || output.message() == null) {
            throw new UnexpectedOutputException("unexpected output type: "
                    + (output == null ? "null" : output.type()));
        }

        List<String> outputContents = new ArrayList<>();
        for (ContentBlock block : output.message().content()) {
            if (block.type() == ContentBlock.Type.TEXT) {
                outputContents.add(block.text());
            } else if (block.type() == ContentBlock.Type.IMAGE) {
                appendImageBytes(block.image(), outputContents);
            } else {
                log.trace("[Bedrock] Skipping response block of type {}", block.type());
            }
        }

        return ContentResponse.builder()
                .choice(ContentChoice.builder()
                        .content(String.join(SEPARATOR, outputContents))
                        .stopReason(response.stopReasonAsString())
                        .generationInfo(generationInfo(response.usage()))
                        .build())
                .build();
    }

    // Lossy: bytes are decoded as UTF-8, so invalid sequences become U+FFFD and the
    // original image cannot be recovered. Kept as-is pending a product decision.
    private static void appendImageBytes(ImageBlock image, List<String> outputContents) {
        ImageSource source = image != null ? image.source() : null;
        if (source != null && source.type() == ImageSource.Type.BYTES && source.bytes() != null) {
            outputContents.add(new String(source.bytes().asByteArray(), StandardCharsets.UTF_8));
        }
    }

    private static Map<String, Object> generationInfo(TokenUsage usage) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put(ContentChoice.INPUT_TOKENS, usage != null ? usage.inputTokens() : null);
        info.put(ContentChoice.OUTPUT_TOKENS, usage != null ? usage.outputTokens() : null);
        return info;
    }
}
