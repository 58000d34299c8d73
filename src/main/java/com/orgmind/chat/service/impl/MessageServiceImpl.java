package com.orgmind.chat.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.orgmind.chat.mapper.ChatMessageMapper;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.model.entity.MessageRole;
import com.orgmind.chat.policy.MessageContentPolicy;
import com.orgmind.chat.service.ChatThreadService;
import com.orgmind.chat.service.MessageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Service
public class MessageServiceImpl extends ServiceImpl<ChatMessageMapper, ChatMessage> implements MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageServiceImpl.class);

    private final ChatThreadService chatThreadService;
    private final Clock clock;

    public MessageServiceImpl(ChatThreadService chatThreadService, Clock clock) {
        this.chatThreadService = chatThreadService;
        this.clock = clock;
    }

    @Override
    @Transactional
    public String save(String threadId, MessageRole role, String content) {
        return insert(threadId, role, content).getId();
    }

    @Override
    public ChatMessage get(String threadId, String messageId) {
        if (threadId == null || messageId == null) {
            return null;
        }
        ChatMessage message = getById(messageId);
        if (message == null || !threadId.equals(message.getThreadId())) {
            return null;
        }
        return message;
    }

    @Override
    @Transactional
    public ChatMessage saveUserMessage(ChatThread thread, String content) {
        ChatMessage message = insert(thread.getId(), MessageRole.USER, content);
        if (thread.getSummary() == null) {
            thread.setSummary(MessageContentPolicy.summarize(content));
            thread.setUpdatedAt(message.getCreatedAt());
            if (!chatThreadService.updateById(thread)) {
                log.warn("Failed to update summary of thread {}", thread.getId());
            }
        }
        return message;
    }

    @Override
    public List<ChatMessage> listPage(String threadId, int limit, int offset) {
        return lambdaQuery()
                .eq(ChatMessage::getThreadId, threadId)
                .orderByAsc(ChatMessage::getCreatedAt)
                .orderByAsc(ChatMessage::getId)
                .last("LIMIT " + limit + " OFFSET " + offset)
                .list();
    }

    @Override
    public long countByThread(String threadId) {
        return lambdaQuery().eq(ChatMessage::getThreadId, threadId).count();
    }

    @Override
    public List<ChatMessage> listRecentBefore(String threadId, LocalDateTime before, int limit) {
        List<ChatMessage> newestFirst = lambdaQuery()
                .eq(ChatMessage::getThreadId, threadId)
                .lt(ChatMessage::getCreatedAt, before)
                .orderByDesc(ChatMessage::getCreatedAt)
                .last("LIMIT " + limit)
                .list();
        List<ChatMessage> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    private ChatMessage insert(String threadId, MessageRole role, String content) {
        if (MessageContentPolicy.isBlank(content)) {
            throw new IllegalArgumentException("message content is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        ChatMessage message = new ChatMessage();
        message.setId("msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        message.setThreadId(threadId);
        message.setRole(role.value());
        message.setContent(MessageContentPolicy.sanitize(content));
        message.setCreatedAt(now);
        save(message);
        chatThreadService.touch(threadId, now);
        return message;
    }
}
