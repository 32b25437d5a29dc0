package com.eainde.dealflow.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model behind the reasoning port: any OpenAI compatible endpoint.
 */
@Configuration
public class ReasoningModelConfig {

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel reasoningChatModel(
            @Value("${dealflow.reasoning.base-url}") String baseUrl,
            @Value("${dealflow.reasoning.api-key}") String apiKey,
            @Value("${dealflow.reasoning.model}") String modelName,
            @Value("${dealflow.reasoning.timeout:PT120S}") Duration timeout,
            @Value("${dealflow.reasoning.max-retries:2}") int maxRetries) {
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .timeout(timeout)
                .maxRetries(maxRetries)
                .build();
    }
}
