package com.orgmind.chat.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提供 {@link ChatClient} bean。
 * ChatModel 与 ChatClient.Builder 由 spring-ai-starter-model-openai 自动配置。
 * 历史消息由 ContextProvider 从库中加载，这里不挂载 ChatMemory advisor。
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }
}
