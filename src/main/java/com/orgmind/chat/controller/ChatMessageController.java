package com.orgmind.chat.controller;

import com.orgmind.chat.model.dto.request.SendMessageRequest;
import com.orgmind.chat.model.dto.response.ChatMessageResponse;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.policy.ChatAccessGuard;
import com.orgmind.chat.service.MessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 消息提交接口。保存用户消息后返回 streamUrl，客户端随后 GET 该地址获取流式回答。
 */
@RestController
@RequestMapping("/api/graphs/{graphId}/chat/threads")
@Tag(name = "Chat Messages", description = "用户消息提交接口")
public class ChatMessageController {

    private static final Logger log = LoggerFactory.getLogger(ChatMessageController.class);

    private static final String STREAM_PATH_TEMPLATE = "/api/graphs/%s/chat/stream?threadId=%s&userMessageId=%s";

    private final ChatAccessGuard chatAccessGuard;
    private final MessageService messageService;

    public ChatMessageController(ChatAccessGuard chatAccessGuard, MessageService messageService) {
        this.chatAccessGuard = chatAccessGuard;
        this.messageService = messageService;
    }

    @PostMapping("/{threadId}/messages")
    @Operation(summary = "提交消息", description = "保存用户消息并返回流式回答地址")
    public ResponseEntity<ChatMessageResponse> send(
            @Parameter(description = "图谱 ID", required = true)
            @PathVariable String graphId,
            @Parameter(description = "线程 ID", required = true)
            @PathVariable String threadId,
            @Parameter(description = "调用者用户 ID（网关注入）", required = true)
            @RequestHeader(value = ChatHeaders.HEADER_USER_ID, required = false) String userIdHeader,
            @Valid @RequestBody SendMessageRequest body) {
        String userId = ChatHeaders.requireUserId(userIdHeader);
        ChatThread thread = chatAccessGuard.checkSubmission(graphId, threadId, userId, body.getContent())
                .requireAllowed();

        ChatMessage message = messageService.saveUserMessage(thread, body.getContent());
        log.info("User message saved: thread={}, message={}, chars={}", threadId, message.getId(),
                body.getContent().length());

        ChatMessageResponse response = ChatMessageResponse.from(message);
        response.setStreamUrl(String.format(STREAM_PATH_TEMPLATE, graphId, threadId, message.getId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
