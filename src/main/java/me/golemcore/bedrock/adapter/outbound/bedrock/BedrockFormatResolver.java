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

import me.golemcore.bedrock.domain.exception.UnsupportedFormatException;
import software.amazon.awssdk.services.bedrockruntime.model.DocumentFormat;
import software.amazon.awssdk.services.bedrockruntime.model.ImageFormat;

import java.util.Map;
import java.util.Optional;

/**
 * Maps MIME types to the image and document formats accepted by the Converse
 * API.
 *
 * <p>
 * The two tables are disjoint and matched literally (case-sensitive). A MIME
 * type that is in neither table is always an error; there is no fallback
 * format.
 */
public final class BedrockFormatResolver {

    private static final Map<String, ImageFormat> IMAGE_FORMATS = Map.of(
            "image/png", ImageFormat.PNG,
            "image/jpeg", ImageFormat.JPEG,
            "image/gif", ImageFormat.GIF,
            "image/webp", ImageFormat.WEBP);

    private static final Map<String, DocumentFormat> DOCUMENT_FORMATS = Map.of(
            "application/pdf", DocumentFormat.PDF,
            "text/csv", DocumentFormat.CSV,
            "application/msword", DocumentFormat.DOC,
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document", DocumentFormat.DOCX,
            "application/vnd.ms-excel", DocumentFormat.XLS,
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", DocumentFormat.XLSX,
            "text/html", DocumentFormat.HTML,
            "text/plain", DocumentFormat.TXT,
            "text/markdown", DocumentFormat.MD);

    private BedrockFormatResolver() {
    }

    /**
     * Resolves an image MIME type.
     *
     * @throws UnsupportedFormatException
     *             if the MIME type is not a supported image type
     */
    public static ImageFormat imageFormat(String mimeType) {
        return findImageFormat(mimeType).orElseThrow(() -> new UnsupportedFormatException(mimeType));
    }

    /**
     * Resolves a document MIME type.
     *
     * @throws UnsupportedFormatException
     *             if the MIME type is not a supported document type
     */
    static DocumentFormat documentFormat(String mimeType) {
        return findDocumentFormat(mimeType).orElseThrow(() -> new UnsupportedFormatException(mimeType));
    }

    public static Optional<ImageFormat> findImageFormat(String mimeType) {
        return mimeType == null ? Optional.empty() : Optional.ofNullable(IMAGE_FORMATS.get(mimeType));
    }

    public static Optional<DocumentFormat> findDocumentFormat(String mimeType) {
        return mimeType == null ? Optional.empty() : Optional.ofNullable(DOCUMENT_FORMATS.get(mimeType));
    }

    static Map<String, ImageFormat> imageFormats() {
        return IMAGE_FORMATS;
    }

    static Map<String, DocumentFormat> documentFormats() {
        return DOCUMENT_FORMATS;
    }
}
