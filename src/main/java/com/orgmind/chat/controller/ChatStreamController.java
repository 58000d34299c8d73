package com.orgmind.chat.controller;

import com.orgmind.chat.ai.stream.ChatStreamTransport;
import com.orgmind.chat.ai.stream.OpenedStream;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * 流式回答接口（SSE）。
 * 事件：chunk（片段）、done（assistant 消息ID）、error（错误信息），done/error 只出现一次且在最后。
 * 关闭连接即停止推送，后台生成照常完成并落库。
 */
@RestController
@RequestMapping("/api/graphs/{graphId}/chat")
@Tag(name = "Chat Stream", description = "SSE 流式回答接口")
public class ChatStreamController {

    private final ChatStreamTransport chatStreamTransport;

    public ChatStreamController(ChatStreamTransport chatStreamTransport) {
        this.chatStreamTransport = chatStreamTransport;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "流式获取回答", description = "返回 SSE 事件流：chunk/done/error；前置校验失败时返回 JSON 错误")
    public ResponseEntity<Flux<ServerSentEvent<String>>> stream(
            @Parameter(description = "图谱 ID", required = true)
            @PathVariable String graphId,
            @Parameter(description = "线程 ID", required = true)
            @RequestParam String threadId,
            @Parameter(description = "待回答的用户消息 ID", required = true)
            @RequestParam String userMessageId,
            @Parameter(description = "调用者用户 ID（网关注入）", required = true)
            @RequestHeader(value = ChatHeaders.HEADER_USER_ID, required = false) String userIdHeader) {
        String userId = ChatHeaders.requireUserId(userIdHeader);
        OpenedStream opened = chatStreamTransport.open(graphId, threadId, userMessageId, userId);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(opened.events());
    }
}
