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
 * Role of a conversation turn in the provider-agnostic chat model.
 *
 * <p>
 * Only {@link #SYSTEM}, {@link #HUMAN} and {@link #AI} can be sent to Bedrock.
 * The remaining roles exist in the generic model and are rejected during
 * translation.
 */
public enum ChatMessageType {
    SYSTEM("system"), HUMAN("human"), AI("ai"), GENERIC("generic"), TOOL("tool"), FUNCTION("function");

    private final String value;

    ChatMessageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
