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

import me.golemcore.bedrock.domain.exception.MessageValidationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Parsed inline image URL of the form {@code data:<mime>;[base64,]<payload>}.
 *
 * <p>
 * The URL must contain exactly one {@code ;}. A payload starting with
 * {@code base64,} is decoded with the standard padded alphabet (CR and LF are
 * skipped); any other
 * payload is taken literally as UTF-8 bytes.
 */
final class ImageDataUrl {

    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = "base64,";
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]");

    private final String mimeType;
    private final String payload;

    private ImageDataUrl(String mimeType, String payload) {
        this.mimeType = mimeType;
        this.payload = payload;
    }

    static ImageDataUrl parse(String url) {
        if (url == null) {
            throw new MessageValidationException("unsupported image url: null");
        }

        String[] segments = url.split(";", -1);
        if (segments.length != 2) {
            throw new MessageValidationException("unsupported image url: " + url);
        }
        if (!segments[0].startsWith(DATA_PREFIX)) {
            throw new MessageValidationException("unsupported image url: " + url);
        }

        return new ImageDataUrl(segments[0].substring(DATA_PREFIX.length()), segments[1]);
    }

    String getMimeType() {
        return mimeType;
    }

    /**
     * Decodes the payload segment.
     *
     * @throws MessageValidationException
     *             if a {@code base64,} payload is not valid base64
     */
    byte[] decodeData() {
        if (!payload.startsWith(BASE64_MARKER)) {
            return payload.getBytes(StandardCharsets.UTF_8);
        }
        try {
            // CR/LF from line-wrapped encoders are skipped
            String encoded = LINE_BREAKS.matcher(payload.substring(BASE64_MARKER.length())).replaceAll("");
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new MessageValidationException("invalid base64 image payload: " + e.getMessage(), e);
        }
    }
}
