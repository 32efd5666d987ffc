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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Creates the {@link BedrockRuntimeClient} used as the Converse transport.
 *
 * <p>
 * Region, endpoint override and API call timeout come from
 * {@link BedrockProperties}. Retries follow the SDK's default retry policy;
 * nothing above the client retries.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class BedrockClientConfiguration {

    private final BedrockProperties properties;

    @Bean(destroyMethod = "close")
    public BedrockRuntimeClient bedrockRuntimeClient() {
        BedrockRuntimeClientBuilder builder = BedrockRuntimeClient.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());

        String endpointOverride = properties.getEndpointOverride();
        if (endpointOverride != null && !endpointOverride.isBlank()) {
            builder.endpointOverride(URI.create(endpointOverride));
        }

        Long apiCallTimeoutMs = properties.getApiCallTimeoutMs();
        if (apiCallTimeoutMs != null && apiCallTimeoutMs > 0) {
            builder.overrideConfiguration(ClientOverrideConfiguration.builder()
                    .apiCallTimeout(Duration.ofMillis(apiCallTimeoutMs))
                    .build());
        }

        log.info("[Bedrock] Runtime client configured: region={}, model={}", properties.getRegion(),
                properties.getModelId());
        return builder.build();
    }
}
