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

/**
 * One unit of content within a {@link ChatTurn}.
 *
 * <p>
 * The set of variants is closed: {@link TextContent}, {@link BinaryContent} and
 * {@link ImageUrlContent}. Code that needs to branch on the variant goes
 * through {@link Visitor}, so adding a new kind of content breaks compilation
 * of every translation site until it handles the new kind.
 */
public sealed interface ContentPart permits TextContent, BinaryContent, ImageUrlContent {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over content part variants.
     *
     * @param <R>
     *            result type
     */
    interface Visitor<R> {

        R visitText(TextContent content);

        R visitBinary(BinaryContent content);

        R visitImageUrl(ImageUrlContent content);
    }
}
