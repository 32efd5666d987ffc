package me.golemcore.bedrock.adapter.outbound.bedrock;

import me.golemcore.bedrock.domain.exception.MessageValidationException;
import me.golemcore.bedrock.domain.exception.UnsupportedFormatException;
import me.golemcore.bedrock.domain.model.BinaryContent;
import me.golemcore.bedrock.domain.model.CallOptions;
import me.golemcore.bedrock.domain.model.ChatMessageType;
import me.golemcore.bedrock.domain.model.ChatTurn;
import me.golemcore.bedrock.domain.model.ContentPart;
import me.golemcore.bedrock.domain.model.ImageUrlContent;
import me.golemcore.bedrock.domain.model.TextContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentFormat;
import software.amazon.awssdk.services.bedrockruntime.model.ImageBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ImageFormat;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BedrockMessageTranslatorTest {

    private static final String MODEL_ID = "anthropic.claude-3-haiku-20240307-v1:0";
    private static final String SYSTEM_PROMPT = "You are a helpful assistant.";
    private static final byte[] DATA = new byte[] { 0, 1, 2, (byte) 0xFE, (byte) 0xFF };

    private BedrockMessageTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new BedrockMessageTranslator();
    }

    private ConverseRequest translate(List<ChatTurn> turns) {
        return translator.translate(MODEL_ID, turns, CallOptions.defaults());
    }

    private ContentBlock singleBlock(ChatTurn turn) {
        ConverseRequest request = translate(List.of(turn));
        assertEquals(1, request.messages().size());
        assertEquals(1, request.messages().get(0).content().size());
        return request.messages().get(0).content().get(0);
    }

    private static ChatTurn humanWith(ContentPart part) {
        return ChatTurn.builder().role(ChatMessageType.HUMAN).part(part).build();
    }

    // ===== system turns =====

    @Test
    void shouldOmitSystemWhenNoSystemTurn() {
        ConverseRequest request = translate(List.of(ChatTurn.text(ChatMessageType.HUMAN, "Hi")));

        assertFalse(request.hasSystem());
        assertEquals(MODEL_ID, request.modelId());
    }

    @Test
    void shouldExtractSingleSystemTurnAsPreamble() {
        ConverseRequest request = translate(List.of(
                ChatTurn.text(ChatMessageType.HUMAN, "Hi"),
                ChatTurn.text(ChatMessageType.SYSTEM, SYSTEM_PROMPT),
                ChatTurn.text(ChatMessageType.AI, "Hello!")));

        assertEquals(1, request.system().size());
        assertEquals(SYSTEM_PROMPT, request.system().get(0).text());
        assertEquals(2, request.messages().size());
        assertTrue(request.messages().stream()
                .flatMap(message -> message.content().stream())
                .noneMatch(block -> SYSTEM_PROMPT.equals(block.text())));
    }

    @Test
    void shouldRejectMultipleSystemTurns() {
        List<ChatTurn> turns = List.of(
                ChatTurn.text(ChatMessageType.SYSTEM, "first"),
                ChatTurn.text(ChatMessageType.HUMAN, "Hi"),
                ChatTurn.text(ChatMessageType.SYSTEM, "second"));

        MessageValidationException error = assertThrows(MessageValidationException.class, () -> translate(turns));
        assertEquals("expected at most one system message, got 2", error.getMessage());
    }

    @Test
    void shouldRejectNonTextSystemContent() {
        ChatTurn system = ChatTurn.builder()
                .role(ChatMessageType.SYSTEM)
                .part(BinaryContent.of("image/png", "a.png", DATA))
                .build();

        MessageValidationException error = assertThrows(MessageValidationException.class,
                () -> translate(List.of(system)));
        assertTrue(error.getMessage().contains("BinaryContent"));
    }

    @Test
    void shouldRejectSystemTurnWithoutParts() {
        ChatTurn system = ChatTurn.builder().role(ChatMessageType.SYSTEM).build();

        assertThrows(MessageValidationException.class, () -> translate(List.of(system)));
    }

    @Test
    void shouldRejectSystemTurnWithSeveralParts() {
        ChatTurn system = ChatTurn.builder()
                .role(ChatMessageType.SYSTEM)
                .part(TextContent.of("one"))
                .part(TextContent.of("two"))
                .build();

        assertThrows(MessageValidationException.class, () -> translate(List.of(system)));
    }

    // ===== roles =====

    @Test
    void shouldMapRolesAndPreserveOrder() {
        List<ChatTurn> turns = new ArrayList<>();
        turns.add(ChatTurn.text(ChatMessageType.HUMAN, "q1"));
        turns.add(ChatTurn.text(ChatMessageType.AI, "a1"));
        turns.add(ChatTurn.text(ChatMessageType.SYSTEM, SYSTEM_PROMPT));
        turns.add(ChatTurn.text(ChatMessageType.HUMAN, "q2"));

        List<Message> messages = translate(turns).messages();

        assertEquals(3, messages.size());
        assertEquals(ConversationRole.USER, messages.get(0).role());
        assertEquals("q1", messages.get(0).content().get(0).text());
        assertEquals(ConversationRole.ASSISTANT, messages.get(1).role());
        assertEquals("a1", messages.get(1).content().get(0).text());
        assertEquals(ConversationRole.USER, messages.get(2).role());
        assertEquals("q2", messages.get(2).content().get(0).text());
    }

    @ParameterizedTest
    @EnumSource(value = ChatMessageType.class, names = { "GENERIC", "TOOL", "FUNCTION" })
    void shouldRejectUnsupportedRoles(ChatMessageType role) {
        List<ChatTurn> turns = List.of(
                ChatTurn.text(ChatMessageType.HUMAN, "fine"),
                ChatTurn.text(role, "not fine"));

        MessageValidationException error = assertThrows(MessageValidationException.class, () -> translate(turns));
        assertEquals("unsupported role: " + role.getValue(), error.getMessage());
    }

    @Test
    void shouldRejectMissingRole() {
        ChatTurn turn = ChatTurn.builder().part(TextContent.of("no role")).build();

        assertThrows(MessageValidationException.class, () -> translate(List.of(turn)));
    }

    // ===== text parts =====

    @Test
    void shouldCopyTextVerbatim() {
        String text = "  multi\nline\ttext with ünïcödé  ";

        ContentBlock block = singleBlock(humanWith(TextContent.of(text)));

        assertEquals(ContentBlock.Type.TEXT, block.type());
        assertEquals(text, block.text());
    }

    @Test
    void shouldKeepPartOrderWithinTurn() {
        ChatTurn turn = ChatTurn.builder()
                .role(ChatMessageType.HUMAN)
                .part(TextContent.of("Describe this"))
                .part(BinaryContent.of("image/png", "cat.png", DATA))
                .part(TextContent.of("and this"))
                .part(BinaryContent.of("application/pdf", "report.pdf", DATA))
                .build();

        List<ContentBlock> content = translate(List.of(turn)).messages().get(0).content();

        assertEquals(4, content.size());
        assertEquals(ContentBlock.Type.TEXT, content.get(0).type());
        assertEquals(ContentBlock.Type.IMAGE, content.get(1).type());
        assertEquals(ContentBlock.Type.TEXT, content.get(2).type());
        assertEquals(ContentBlock.Type.DOCUMENT, content.get(3).type());
    }

    // ===== binary parts =====

    @ParameterizedTest
    @CsvSource({
            "image/png, PNG",
            "image/jpeg, JPEG",
            "image/gif, GIF",
            "image/webp, WEBP"
    })
    void shouldConvertBinaryImages(String mimeType, ImageFormat expected) {
        ContentBlock block = singleBlock(humanWith(BinaryContent.of(mimeType, "picture", DATA)));

        assertEquals(ContentBlock.Type.IMAGE, block.type());
        ImageBlock image = block.image();
        assertEquals(expected, image.format());
        assertArrayEquals(DATA, image.source().bytes().asByteArray());
    }

    @ParameterizedTest
    @CsvSource({
            "application/pdf, PDF",
            "text/csv, CSV",
            "application/msword, DOC",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document, DOCX",
            "application/vnd.ms-excel, XLS",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet, XLSX",
            "text/html, HTML",
            "text/plain, TXT",
            "text/markdown, MD"
    })
    void shouldConvertBinaryDocuments(String mimeType, DocumentFormat expected) {
        ContentBlock block = singleBlock(humanWith(BinaryContent.of(mimeType, "quarterly-report", DATA)));

        assertEquals(ContentBlock.Type.DOCUMENT, block.type());
        DocumentBlock document = block.document();
        assertEquals(expected, document.format());
        assertEquals("quarterly-report", document.name());
        assertArrayEquals(DATA, document.source().bytes().asByteArray());
    }

    @Test
    void shouldRejectUnsupportedBinaryMimeType() {
        ChatTurn turn = humanWith(BinaryContent.of("audio/mpeg", "song.mp3", DATA));

        UnsupportedFormatException error = assertThrows(UnsupportedFormatException.class,
                () -> translate(List.of(turn)));
        assertEquals("audio/mpeg", error.getMimeType());
        assertEquals("unsupported content type: audio/mpeg", error.getMessage());
    }

    @Test
    void shouldFailWholeTranslationOnFirstBadPart() {
        ChatTurn turn = ChatTurn.builder()
                .role(ChatMessageType.HUMAN)
                .part(TextContent.of("ok"))
                .part(BinaryContent.of("application/zip", "archive.zip", DATA))
                .build();

        assertThrows(UnsupportedFormatException.class,
                () -> translate(List.of(turn, ChatTurn.text(ChatMessageType.AI, "never reached"))));
    }

    // ===== image URL parts =====

    @Test
    void shouldDecodeBase64ImageUrl() {
        String url = "data:image/png;base64," + Base64.getEncoder().encodeToString(DATA);

        ContentBlock block = singleBlock(humanWith(ImageUrlContent.of(url)));

        assertEquals(ImageFormat.PNG, block.image().format());
        assertArrayEquals(DATA, block.image().source().bytes().asByteArray());
    }

    @Test
    void shouldPassRawImageUrlPayloadThrough() {
        ContentBlock block = singleBlock(humanWith(ImageUrlContent.of("data:image/png;literal-bytes")));

        assertEquals(ImageFormat.PNG, block.image().format());
        assertArrayEquals("literal-bytes".getBytes(StandardCharsets.UTF_8),
                block.image().source().bytes().asByteArray());
    }

    @Test
    void shouldRejectImageUrlWithoutDataPrefix() {
        ChatTurn turn = humanWith(ImageUrlContent.of("https://example.com/cat.png;x"));

        assertThrows(MessageValidationException.class, () -> translate(List.of(turn)));
    }

    @Test
    void shouldRejectDocumentMimeTypeInImageUrl() {
        ChatTurn turn = humanWith(ImageUrlContent.of("data:application/pdf;base64,AAAA"));

        UnsupportedFormatException error = assertThrows(UnsupportedFormatException.class,
                () -> translate(List.of(turn)));
        assertEquals("application/pdf", error.getMimeType());
    }

    @Test
    void shouldResolveImageUrlFormatBeforeDecodingPayload() {
        ChatTurn turn = humanWith(ImageUrlContent.of("data:image/bmp;base64,***"));

        assertThrows(UnsupportedFormatException.class, () -> translate(List.of(turn)));
    }

    @Test
    void shouldRejectUndecodableBase64ImageUrl() {
        ChatTurn turn = humanWith(ImageUrlContent.of("data:image/png;base64,***"));

        assertThrows(MessageValidationException.class, () -> translate(List.of(turn)));
    }

    // ===== inference configuration =====

    @ParameterizedTest
    @CsvSource({ "0, 512", "-5, 512", "1, 1", "100, 100", "4096, 4096" })
    void shouldResolveMaxTokens(int requested, int expected) {
        CallOptions options = CallOptions.builder().maxTokens(requested).build();

        InferenceConfiguration config = translator.translate(MODEL_ID, List.of(), options).inferenceConfig();

        assertEquals(expected, config.maxTokens());
    }

    @Test
    void shouldPassSamplingParametersThroughUnchanged() {
        CallOptions options = CallOptions.builder()
                .maxTokens(256)
                .temperature(0.25)
                .topP(0.9)
                .stopWord("\n\nHuman:")
                .stopWord("END")
                .build();

        InferenceConfiguration config = translator.translate(MODEL_ID, List.of(), options).inferenceConfig();

        assertEquals(256, config.maxTokens());
        assertEquals(0.25f, config.temperature());
        assertEquals(0.9f, config.topP());
        assertEquals(List.of("\n\nHuman:", "END"), config.stopSequences());
    }

    @Test
    void shouldPassZeroSamplingParameters() {
        InferenceConfiguration config = translator.translate(MODEL_ID, List.of(), CallOptions.defaults())
                .inferenceConfig();

        assertEquals(0.0f, config.temperature());
        assertEquals(0.0f, config.topP());
        assertTrue(config.stopSequences().isEmpty());
    }

    @Test
    void shouldProduceEmptyMessageListForEmptyConversation() {
        ConverseRequest request = translate(List.of());

        assertTrue(request.messages().isEmpty());
        assertFalse(request.hasSystem());
    }
}
