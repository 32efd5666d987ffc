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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Caller-supplied generation options for a single completion call.
 *
 * <p>
 * A {@code maxTokens} value of zero or less means "use the provider default".
 * {@code temperature}, {@code topP} and {@code stopWords} are sent as given,
 * zero values included.
 */
@Value
@Builder(toBuilder = true)
public class CallOptions {

    /** Model id; {@code null} or blank falls back to the adapter's default model. */
    String model;

    int maxTokens;

    double temperature;

    double topP;

    @Singular
    List<String> stopWords;

    public static CallOptions defaults() {
        return CallOptions.builder().build();
    }
}
