package com.example.FundScout.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    static final String ADVISOR_SYSTEM = "You are a precise public funding advisor. "
            + "Use only the programs and fields you are given. Do not invent anything.";

    /**
     * OpenAI is the default ChatClient for selection and enrichment (JSON mode).
     * Only created when an OpenAiChatModel bean exists, so a missing key does not break startup.
     */
    @Bean
    @Primary
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(ADVISOR_SYSTEM)
                .build();
    }

    /**
     * DeepSeek ChatClient as an alternative, selected with funding.selection-model=deepseek.
     */
    @Bean
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(ADVISOR_SYSTEM)
                .build();
    }

    /**
     * If no ChatClient beans are registered, build one from OpenAI when available,
     * otherwise from DeepSeek.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(ADVISOR_SYSTEM)
                    .build();
        }

        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel)
                    .defaultSystem(ADVISOR_SYSTEM)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
