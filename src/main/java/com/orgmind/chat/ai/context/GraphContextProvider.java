package com.orgmind.chat.ai.context;

import com.orgmind.chat.ai.generation.GenerationRequest;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.policy.ContextTrimPolicy;
import com.orgmind.chat.service.MessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * 默认上下文：最近历史消息（按字符上限从最早处裁剪）+ 以 graph_id 过滤的向量检索。
 * <p>
 * 检索失败不影响回答，降级为无参考文档。
 */
@Component
public class GraphContextProvider implements ContextProvider {

    private static final Logger log = LoggerFactory.getLogger(GraphContextProvider.class);

    static final String GRAPH_ID_METADATA_KEY = "graph_id";

    private final MessageService messageService;

    @Nullable
    private final VectorStore vectorStore;

    @Value("${app.rag.top-k:8}")
    private int topK = 8;

    public GraphContextProvider(MessageService messageService, @Nullable VectorStore vectorStore) {
        this.messageService = messageService;
        this.vectorStore = vectorStore;
    }

    @Override
    public GenerationRequest build(String graphId, ChatMessage userMessage) {
        String question = HtmlUtils.htmlUnescape(userMessage.getContent() != null ? userMessage.getContent() : "");
        List<ChatMessage> history = loadHistory(userMessage);
        List<String> documents = retrieve(graphId, question);
        return new GenerationRequest(graphId, userMessage.getThreadId(), question, history, documents);
    }

    private List<ChatMessage> loadHistory(ChatMessage userMessage) {
        if (userMessage.getCreatedAt() == null) {
            return List.of();
        }
        List<ChatMessage> recent = messageService.listRecentBefore(userMessage.getThreadId(),
                userMessage.getCreatedAt(), ContextTrimPolicy.DEFAULT_MAX_HISTORY_MESSAGES);
        return trimToBudget(recent, ContextTrimPolicy.DEFAULT_MAX_CONTEXT_CHARS);
    }

    static List<ChatMessage> trimToBudget(List<ChatMessage> oldestFirst, int maxChars) {
        LinkedList<ChatMessage> kept = new LinkedList<>();
        int used = 0;
        for (int i = oldestFirst.size() - 1; i >= 0; i--) {
            ChatMessage m = oldestFirst.get(i);
            int len = m.getContent() != null ? m.getContent().length() : 0;
            if (used + len > maxChars) {
                break;
            }
            used += len;
            kept.addFirst(m);
        }
        return kept;
    }

    private List<String> retrieve(String graphId, String question) {
        if (vectorStore == null || question.isBlank()) {
            return List.of();
        }
        try {
            List<Document> docs = vectorStore.similaritySearch(SearchRequest.builder()
                    .query(question)
                    .topK(topK)
                    .filterExpression(new FilterExpressionBuilder().eq(GRAPH_ID_METADATA_KEY, graphId).build())
                    .build());
            if (CollectionUtils.isEmpty(docs)) {
                return List.of();
            }
            List<String> texts = new ArrayList<>();
            for (Document d : docs) {
                if (d != null && d.getText() != null && !d.getText().isBlank()) {
                    texts.add(d.getText());
                }
            }
            return texts;
        } catch (RuntimeException e) {
            log.warn("Graph retrieval failed for graph {}: {}", graphId, e.getMessage());
            return List.of();
        }
    }
}
