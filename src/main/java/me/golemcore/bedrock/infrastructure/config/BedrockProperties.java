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

package me.golemcore.bedrock.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bedrock connection and model settings, bound from application.properties
 * under the {@code bedrock.*} prefix.
 *
 * <p>
 * Credentials are not configured here; the client uses the AWS SDK default
 * credentials provider chain (environment, profile, instance role).
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bedrock")
@Data
public class BedrockProperties {

    public static final String DEFAULT_MODEL_ID = "amazon.titan-text-lite-v1";

    private String region = "us-east-1";
    private String modelId = DEFAULT_MODEL_ID;

    /** Custom endpoint URI, e.g. a VPC endpoint. */
    private String endpointOverride;

    /** Overall API call timeout enforced by the SDK client; unset means SDK default. */
    private Long apiCallTimeoutMs;
}
