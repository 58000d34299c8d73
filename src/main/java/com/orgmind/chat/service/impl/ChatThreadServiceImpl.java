package com.orgmind.chat.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.orgmind.chat.mapper.ChatThreadMapper;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.service.ChatThreadService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class ChatThreadServiceImpl extends ServiceImpl<ChatThreadMapper, ChatThread> implements ChatThreadService {

    private final Clock clock;

    public ChatThreadServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ChatThread createThread(String graphId, String userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        ChatThread thread = new ChatThread();
        thread.setId("th_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        thread.setGraphId(graphId);
        thread.setUserId(userId);
        thread.setCreatedAt(now);
        thread.setUpdatedAt(now);
        save(thread);
        return thread;
    }

    @Override
    public List<ChatThread> listByGraph(String graphId) {
        return lambdaQuery()
                .eq(ChatThread::getGraphId, graphId)
                .orderByDesc(ChatThread::getUpdatedAt)
                .orderByDesc(ChatThread::getId)
                .list();
    }

    @Override
    public void touch(String threadId, LocalDateTime updatedAt) {
        lambdaUpdate()
                .eq(ChatThread::getId, threadId)
                .set(ChatThread::getUpdatedAt, updatedAt)
                .update();
    }
}
