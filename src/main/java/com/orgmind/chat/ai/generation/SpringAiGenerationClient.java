package com.orgmind.chat.ai.generation;

import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.MessageRole;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GenerationClient 实现：通过 Spring AI ChatClient 流式调用 LLM。
 * <p>
 * 历史消息以多轮消息注入；检索到的图谱文档拼入用户问题，要求优先引用文档内容。
 */
@Component
public class SpringAiGenerationClient implements GenerationClient {

    private static final String SYSTEM_PROMPT = "You are the assistant of an enterprise knowledge graph. "
            + "Answer questions using the documents of the current graph when they are provided, "
            + "and say so clearly when the documents do not cover the question. "
            + "Use Markdown where appropriate. Do not fabricate citations.";

    /**
     * 占位符：question, documents。
     */
    private static final PromptTemplate GROUNDED_PROMPT_TEMPLATE = new PromptTemplate("""
        Based on the documents in the knowledge graph, please answer the following question: {question}

        Documents:
        ---------------------
        {documents}
        ---------------------
        """);

    private static final String UNGROUNDED_PROMPT_PREFIX =
            "Based on the documents in the knowledge graph, please answer the following question: ";

    private final ChatClient chatClient;

    @Value("${app.chat.generation.max-tokens:0}")
    private int maxTokens;

    public SpringAiGenerationClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Flux<String> stream(GenerationRequest request) {
        var promptSpec = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .messages(toPromptMessages(request.history()))
                .user(buildUserPrompt(request));

        // 可选：限制最大输出 tokens
        if (maxTokens > 0) {
            promptSpec = promptSpec.options(OpenAiChatOptions.builder().maxTokens(maxTokens).build());
        }

        return promptSpec.stream().content();
    }

    private static String buildUserPrompt(GenerationRequest request) {
        if (request.documents().isEmpty()) {
            return UNGROUNDED_PROMPT_PREFIX + request.question();
        }
        return GROUNDED_PROMPT_TEMPLATE.render(Map.<String, Object>of(
                "question", request.question(),
                "documents", String.join("\n---\n", request.documents())));
    }

    private static List<Message> toPromptMessages(List<ChatMessage> history) {
        List<Message> messages = new ArrayList<>();
        for (ChatMessage m : history) {
            if (m == null || m.getContent() == null || m.getContent().isBlank()) {
                continue;
            }
            // 库中内容已做 HTML 转义，送模型前还原
            String text = HtmlUtils.htmlUnescape(m.getContent());
            if (m.hasRole(MessageRole.ASSISTANT)) {
                messages.add(new AssistantMessage(text));
            } else {
                messages.add(new UserMessage(text));
            }
        }
        return messages;
    }
}
