package com.orgmind.chat.controller;

import com.orgmind.chat.model.dto.response.ChatMessageResponse;
import com.orgmind.chat.model.dto.response.ChatThreadResponse;
import com.orgmind.chat.model.dto.response.MessagesPageResponse;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.policy.ChatAccessGuard;
import com.orgmind.chat.policy.ChatGuardException;
import com.orgmind.chat.policy.GuardFailure;
import com.orgmind.chat.service.ChatThreadService;
import com.orgmind.chat.service.MessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 对话线程接口：创建、列表、消息分页。
 */
@RestController
@RequestMapping("/api/graphs/{graphId}/chat/threads")
@Tag(name = "Chat Threads", description = "图谱对话线程管理接口")
public class ChatThreadController {

    private static final Logger log = LoggerFactory.getLogger(ChatThreadController.class);

    static final int DEFAULT_PAGE_LIMIT = 50;
    static final int MAX_PAGE_LIMIT = 200;

    private final ChatThreadService chatThreadService;
    private final MessageService messageService;
    private final ChatAccessGuard chatAccessGuard;

    public ChatThreadController(ChatThreadService chatThreadService,
            MessageService messageService,
            ChatAccessGuard chatAccessGuard) {
        this.chatThreadService = chatThreadService;
        this.messageService = messageService;
        this.chatAccessGuard = chatAccessGuard;
    }

    @PostMapping
    @Operation(summary = "创建线程", description = "在图谱下创建一个新的对话线程，调用者必须是图谱成员")
    public ResponseEntity<ChatThreadResponse> create(
            @Parameter(description = "图谱 ID", required = true)
            @PathVariable String graphId,
            @Parameter(description = "调用者用户 ID（网关注入）", required = true)
            @RequestHeader(value = ChatHeaders.HEADER_USER_ID, required = false) String userIdHeader) {
        String userId = ChatHeaders.requireUserId(userIdHeader);
        requireMember(graphId, userId);

        ChatThread thread = chatThreadService.createThread(graphId, userId);
        log.info("Chat thread created: thread={}, graph={}, user={}", thread.getId(), graphId, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ChatThreadResponse.from(thread));
    }

    @GetMapping
    @Operation(summary = "线程列表", description = "列出图谱下的对话线程（数组），按更新时间倒序")
    public ResponseEntity<List<ChatThreadResponse>> list(
            @Parameter(description = "图谱 ID", required = true)
            @PathVariable String graphId,
            @Parameter(description = "调用者用户 ID（网关注入）", required = true)
            @RequestHeader(value = ChatHeaders.HEADER_USER_ID, required = false) String userIdHeader) {
        String userId = ChatHeaders.requireUserId(userIdHeader);
        requireMember(graphId, userId);

        return ResponseEntity.ok(chatThreadService.listByGraph(graphId).stream()
                .map(ChatThreadResponse::from)
                .toList());
    }

    @GetMapping("/{threadId}/messages")
    @Operation(summary = "线程消息", description = "按时间正序分页获取线程消息；limit 默认 50，范围 1~200")
    public ResponseEntity<MessagesPageResponse> messages(
            @Parameter(description = "图谱 ID", required = true)
            @PathVariable String graphId,
            @Parameter(description = "线程 ID", required = true)
            @PathVariable String threadId,
            @Parameter(description = "调用者用户 ID（网关注入）", required = true)
            @RequestHeader(value = ChatHeaders.HEADER_USER_ID, required = false) String userIdHeader,
            @Parameter(description = "分页大小，默认 50，最大 200")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "偏移量，默认 0")
            @RequestParam(defaultValue = "0") int offset) {
        String userId = ChatHeaders.requireUserId(userIdHeader);
        chatAccessGuard.checkRead(graphId, threadId, userId).requireAllowed();

        int size = clampLimit(limit);
        int from = Math.max(0, offset);
        List<ChatMessage> page = messageService.listPage(threadId, size, from);
        long total = messageService.countByThread(threadId);

        return ResponseEntity.ok(MessagesPageResponse.builder()
                .messages(page.stream().map(ChatMessageResponse::from).toList())
                .total(total)
                .hasMore(from + page.size() < total)
                .build());
    }

    static int clampLimit(int limit) {
        return Math.min(Math.max(1, limit), MAX_PAGE_LIMIT);
    }

    private void requireMember(String graphId, String userId) {
        if (!chatAccessGuard.isGraphMember(graphId, userId)) {
            throw new ChatGuardException(GuardFailure.NOT_MEMBER);
        }
    }
}
