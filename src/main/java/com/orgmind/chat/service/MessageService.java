package com.orgmind.chat.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.ChatThread;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 消息服务，用于加载/保存线程消息。
 */
public interface MessageService extends IService<ChatMessage>, MessageStore {

    /**
     * 保存用户消息；若线程尚无摘要，用本条消息生成摘要。
     */
    ChatMessage saveUserMessage(ChatThread thread, String content);

    /** 按时间正序分页 */
    List<ChatMessage> listPage(String threadId, int limit, int offset);

    long countByThread(String threadId);

    /** 取某时间点之前最近的 limit 条消息，按时间正序返回 */
    List<ChatMessage> listRecentBefore(String threadId, LocalDateTime before, int limit);
}
