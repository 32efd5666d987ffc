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

package me.golemcore.bedrock.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Binary content part (image or document) with its MIME type and original file
 * name. The MIME type decides whether the part is sent as an image or as a
 * document.
 */
@Value
public final class BinaryContent implements ContentPart {

    String mimeType;
    String filename;
    byte[] data;

    @Builder
    public BinaryContent(String mimeType, String filename, byte[] data) {
        this.mimeType = mimeType;
        this.filename = filename;
        this.data = data != null ? data.clone() : null;
    }

    /**
     * Returns a copy of the payload; the part itself stays unchanged.
     */
    public byte[] getData() {
        return data != null ? data.clone() : null;
    }

    public static BinaryContent of(String mimeType, String filename, byte[] data) {
        return new BinaryContent(mimeType, filename, data);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
