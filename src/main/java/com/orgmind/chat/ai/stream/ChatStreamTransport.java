package com.orgmind.chat.ai.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgmind.chat.ai.generation.GenerationException;
import com.orgmind.chat.ai.orchestrator.ResponseOrchestrator;
import com.orgmind.chat.ai.orchestrator.StreamingSession;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.policy.ChatAccessGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * SSE 传输层：把编排器的会话桥接到客户端连接。
 * <p>
 * 片段通道逐个转为 chunk 事件；通道关闭后等待完成通道给出结论，再发出唯一的 done 或 error。
 * 不根据通道关闭推断成功，也不自行裁决终态。客户端断开（取消订阅）后立即停止写出，
 * 后台生成与落库照常完成。
 */
@Component
public class ChatStreamTransport {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamTransport.class);

    public static final String EVENT_CHUNK = "chunk";
    public static final String EVENT_DONE = "done";
    public static final String EVENT_ERROR = "error";

    static final String GENERIC_ERROR_MESSAGE = "Failed to generate response";

    private final ChatAccessGuard chatAccessGuard;
    private final ResponseOrchestrator responseOrchestrator;
    private final ObjectMapper objectMapper;

    public ChatStreamTransport(ChatAccessGuard chatAccessGuard,
            ResponseOrchestrator responseOrchestrator,
            ObjectMapper objectMapper) {
        this.chatAccessGuard = chatAccessGuard;
        this.responseOrchestrator = responseOrchestrator;
        this.objectMapper = objectMapper;
    }

    /**
     * 校验并启动一次流式回答。校验失败或会话无法启动时同步抛出，不会打开事件流。
     *
     * @throws com.orgmind.chat.policy.ChatGuardException 前置校验未通过
     * @throws com.orgmind.chat.ai.orchestrator.StreamRejectedException 会话无法启动
     */
    public OpenedStream open(String graphId, String threadId, String userMessageId, String userId) {
        ChatThread thread = chatAccessGuard.checkStream(graphId, threadId, userId).requireAllowed();
        StreamingSession session = responseOrchestrator.generate(graphId, thread.getId(), userMessageId);
        StreamConnection connection = new StreamConnection(session.key());
        return new OpenedStream(connection, bridge(session, connection));
    }

    Flux<ServerSentEvent<String>> bridge(StreamingSession session, StreamConnection connection) {
        Flux<ServerSentEvent<String>> chunks = session.fragments()
                .map(fragment -> {
                    connection.markStreaming();
                    return event(EVENT_CHUNK, Map.of("content", fragment));
                });

        Mono<ServerSentEvent<String>> terminal = session.completion()
                .map(messageId -> {
                    connection.finish(TransportState.DONE);
                    log.info("Stream done: session={}, messageId={}", connection.sessionKey(), messageId);
                    return event(EVENT_DONE, Map.of("content", messageId));
                })
                .onErrorResume(e -> Mono.fromSupplier(() -> {
                    connection.finish(TransportState.FAILED);
                    log.info("Stream failed: session={}, error={}", connection.sessionKey(), e.getMessage());
                    return event(EVENT_ERROR, Map.of("error", describe(e)));
                }));

        return chunks
                .concatWith(terminal)
                .doOnCancel(() -> {
                    if (connection.finish(TransportState.ABANDONED)) {
                        log.info("Client disconnected, stream abandoned: session={}", connection.sessionKey());
                    }
                });
    }

    static String describe(Throwable error) {
        if (error instanceof GenerationException && error.getMessage() != null && !error.getMessage().isBlank()) {
            return error.getMessage();
        }
        return GENERIC_ERROR_MESSAGE;
    }

    private ServerSentEvent<String> event(String name, Map<String, ?> payload) {
        return ServerSentEvent.<String>builder(toJson(payload)).event(name).build();
    }

    private String toJson(Map<String, ?> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize SSE payload: {}", e.getMessage());
            return "{}";
        }
    }
}
