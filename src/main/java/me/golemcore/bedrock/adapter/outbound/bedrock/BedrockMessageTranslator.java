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
import me.golemcore.bedrock.domain.exception.MessageValidationException;
import me.golemcore.bedrock.domain.exception.UnsupportedFormatException;
import me.golemcore.bedrock.domain.model.BinaryContent;
import me.golemcore.bedrock.domain.model.CallOptions;
import me.golemcore.bedrock.domain.model.ChatMessageType;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentPart;
import me.golemcore.bedrock.domain.model.ImageUrlContent;
import me.golemcore.bedrock.domain.model.TextContent;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentFormat;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentSource;
import software.amazon.awssdk.services.bedrockruntime.model.ImageBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ImageFormat;
import software.amazon.awssdk.services.bedrockruntime.model.ImageSource;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates generic chat turns into a Bedrock {@link ConverseRequest}.
 *
 * <p>
 * System turns are split off into the request's {@code system} field (at most
 * one, text only); every other turn becomes a wire {@link Message} in the
 * original order. Translation is all-or-nothing: the first turn or part that
 * cannot be represented aborts it with a
 * {@link me.golemcore.bedrock.domain.exception.BedrockChatException}.
 *
 * @see BedrockFormatResolver
 * @see BedrockResponseAssembler
 */
@Component
@Slf4j
public class BedrockMessageTranslator {

    static final int DEFAULT_MAX_TOKENS = 512;

    private final ContentPart.Visitor<ContentBlock> contentConverter = new ContentBlockConverter();

    /**
     * Builds the Converse request for the given model, turns and options.
     */
    public ConverseRequest translate(String modelId, List<ChatTurn> turns, CallOptions options) {
        List<ChatTurn> systemTurns = new ArrayList<>();
        List<ChatTurn> otherTurns = new ArrayList<>();
        for (ChatTurn turn : turns) {
            if (turn.isSystem()) {
                systemTurns.add(turn);
            } else {
                otherTurns.add(turn);
            }
        }

        Optional<SystemContentBlock> systemPrompt = convertSystemTurns(systemTurns);
        List<Message> messages = convertTurns(otherTurns);

        ConverseRequest.Builder builder = ConverseRequest.builder()
                .modelId(modelId)
                .messages(messages)
                .inferenceConfig(toInferenceConfig(options));
        systemPrompt.ifPresent(block -> builder.system(List.of(block)));

        log.trace("[Bedrock] Translated {} turns ({} system) for model {}", turns.size(), systemTurns.size(),
                modelId);
        return builder.build();
    }

    InferenceConfiguration toInferenceConfig(CallOptions options) {
        return InferenceConfiguration.builder()
                .maxTokens(resolveMaxTokens(options.getMaxTokens()))
                .topP((float) options.getTopP())
                .temperature((float) options.getTemperature())
                .stopSequences(options.getStopWords())
                .build();
    }

    static int resolveMaxTokens(int maxTokens) {
        return maxTokens <= 0 ? DEFAULT_MAX_TOKENS : maxTokens;
    }

    private Optional<SystemContentBlock> convertSystemTurns(List<ChatTurn> systemTurns) {
        if (systemTurns.isEmpty()) {
            return Optional.empty();
        }
        if (systemTurns.size() > 1) {
            throw new MessageValidationException(
                    "expected at most one system message, got " + systemTurns.size());
        }

        List<ContentPart> parts = systemTurns.get(0).getParts();
        if (parts.size() != 1) {
            throw new MessageValidationException(
                    "expected system message to have exactly one part, got " + parts.size());
        }
        ContentPart part = parts.get(0);
        if (!(part instanceof TextContent text)) {
            throw new MessageValidationException(
                    "expected system message to be text content, got " + describe(part));
        }
        return Optional.of(SystemContentBlock.fromText(text.getText()));
    }

    private List<Message> convertTurns(List<ChatTurn> turns) {
        List<Message> messages = new ArrayList<>(turns.size());
        for (ChatTurn turn : turns) {
            ConversationRole role = toConversationRole(turn.getRole());

            List<ContentBlock> content = new ArrayList<>(turn.getParts().size());
            for (ContentPart part : turn.getParts()) {
                content.add(convertPart(part));
            }

            messages.add(Message.builder()
                    .role(role)
                    .content(content)
                    .build());
        }
        return messages;
    }

    static ConversationRole toConversationRole(ChatMessageType role) {
        if (role == null) {
            throw new MessageValidationException("unsupported role: null");
        }
        return switch (role) {
        case HUMAN -> ConversationRole.USER;
        case AI -> ConversationRole.ASSISTANT;
        case SYSTEM, GENERIC, TOOL, FUNCTION -> throw new MessageValidationException("unsupported role: " + role);
        };
    }

    private ContentBlock convertPart(ContentPart part) {
        if (part == null) {
            throw new MessageValidationException("unsupported content type: null");
        }
        return part.accept(contentConverter);
    }

    private static String describe(ContentPart part) {
        return part == null ? "null" : part.getClass().getSimpleName();
    }

    private static ContentBlock imageBlock(ImageFormat format, byte[] data) {
        return ContentBlock.fromImage(ImageBlock.builder()
                .format(format)
                .source(ImageSource.fromBytes(SdkBytes.fromByteArray(data)))
                .build());
    }

    private static ContentBlock documentBlock(String name, DocumentFormat format, byte[] data) {
        return ContentBlock.fromDocument(DocumentBlock.builder()
                .name(name)
                .format(format)
                .source(DocumentSource.fromBytes(SdkBytes.fromByteArray(data)))
                .build());
    }

    private static final class ContentBlockConverter implements ContentPart.Visitor<ContentBlock> {

        @Override
        public ContentBlock visitText(TextContent content) {
            return ContentBlock.fromText(content.getText());
        }

        @Override
        public ContentBlock visitBinary(BinaryContent content) {
            String mimeType = content.getMimeType();

            Optional<ImageFormat> imageFormat = BedrockFormatResolver.findImageFormat(mimeType);
            if (imageFormat.isPresent()) {
                return imageBlock(imageFormat.get(), content.getData());
            }

            Optional<DocumentFormat> documentFormat = BedrockFormatResolver.findDocumentFormat(mimeType);
            if (documentFormat.isPresent()) {
                return documentBlock(content.getFilename(), documentFormat.get(), content.getData());
            }

            throw new UnsupportedFormatException(mimeType, "unsupported content type: " + mimeType);
        }

        @Override
        public ContentBlock visitImageUrl(ImageUrlContent content) {
            ImageDataUrl dataUrl = ImageDataUrl.parse(content.getUrl());
            ImageFormat format = BedrockFormatResolver.imageFormat(dataUrl.getMimeType());
            return imageBlock(format, dataUrl.decodeData());
        }
    }
}
