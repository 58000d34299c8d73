package com.orgmind.chat.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.orgmind.chat.model.entity.ChatThread;

import java.time.LocalDateTime;
import java.util.List;

public interface ChatThreadService extends IService<ChatThread> {

    ChatThread createThread(String graphId, String userId);

    /** 图谱下全部线程，最近更新的在前 */
    List<ChatThread> listByGraph(String graphId);

    void touch(String threadId, LocalDateTime updatedAt);
}
