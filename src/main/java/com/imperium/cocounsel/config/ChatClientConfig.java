package com.imperium.cocounsel.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 四个专家共用同一个 {@link ChatClient}。
 * ChatModel 与 ChatClient.Builder 由 spring-ai-starter-model-openai 自动配置，
 * 系统提示由各专家在调用时给出，这里不设默认值。
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }
}
