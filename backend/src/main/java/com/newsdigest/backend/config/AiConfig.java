package com.newsdigest.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible chat model pointed at OpenRouter. Only created when an API key is configured.
 */
@Slf4j
@Configuration
public class AiConfig {

    @Bean
    @ConditionalOnExpression("T(org.springframework.util.StringUtils).hasText('${digest.ai.api-key:}')")
    public ChatModel chatModel(DigestProperties digestProperties) {
        DigestProperties.Ai ai = digestProperties.getAi();
        log.info("🤖 Configuring chat model {} at {}", ai.getModel(), ai.getBaseUrl());

        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(ai.getBaseUrl())
                .apiKey(ai.getApiKey())
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(ai.getModel())
                        .temperature(ai.getTemperature())
                        .build())
                .build();
    }
}
