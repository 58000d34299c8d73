package com.orgmind.chat.ai.orchestrator;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 活跃会话登记：同一 (线程, 用户消息) 同时只允许一个会话。
 * 会话在后台工作（含落库）结束时移除，客户端断开后重连也不会触发第二次生成。
 */
@Component
public class StreamingSessionRegistry {

    private final Map<String, StreamingSession> active = new ConcurrentHashMap<>();

    /** @return false 表示已有同键会话在运行 */
    boolean register(StreamingSession session) {
        return active.putIfAbsent(session.key(), session) == null;
    }

    void release(StreamingSession session) {
        active.remove(session.key(), session);
    }

    boolean isActive(String threadId, String userMessageId) {
        return active.containsKey(StreamingSession.key(threadId, userMessageId));
    }

    int activeCount() {
        return active.size();
    }
}
