package com.orgmind.chat.service;

import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.MessageRole;

/**
 * 流式核心依赖的消息存储接口。同步调用，失败以异常形式抛出。
 */
public interface MessageStore {

    /**
     * 追加一条消息并刷新所属线程的 updated_at。
     *
     * @return 新消息ID
     */
    String save(String threadId, MessageRole role, String content);

    /**
     * 读取线程内的一条消息；不存在或不属于该线程时返回 null。
     */
    ChatMessage get(String threadId, String messageId);
}
