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

package me.golemcore.bedrock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Bedrock chat adapter.
 *
 * <p>
 * Translates provider-agnostic chat turns into Amazon Bedrock Converse
 * requests and flattens the responses back into a single-choice result.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → ChatTurn, ContentPart, CallOptions, ContentResponse
 * Port               → LlmPort, LlmCallbackHandler
 * Outbound Adapter   → BedrockChatAdapter → BedrockConverseClient
 *                      (BedrockMessageTranslator, BedrockResponseAssembler)
 * Infrastructure     → BedrockProperties, BedrockClientConfiguration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code bedrock.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BedrockChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(BedrockChatApplication.class, args);
    }

}
