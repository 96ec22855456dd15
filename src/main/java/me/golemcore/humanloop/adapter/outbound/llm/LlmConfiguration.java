package me.golemcore.humanloop.adapter.outbound.llm;

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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.infrastructure.config.HumanLoopProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible chat model used by the pizza agent. Registered only when
 * {@code hitl.llm.api-key} is set; without it the agent fails each run with a
 * configuration error instead of failing startup.
 */
@Configuration
@ConditionalOnProperty(prefix = "hitl.llm", name = "api-key")
@Slf4j
public class LlmConfiguration {

    @Bean
    public ChatModel chatModel(HumanLoopProperties properties) {
        HumanLoopProperties.LlmProperties llm = properties.getLlm();
        log.info("[LLM] Using model {} at {}", llm.getModel(), llm.getBaseUrl());
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(1)
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }
}
