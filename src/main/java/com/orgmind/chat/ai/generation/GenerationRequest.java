package com.orgmind.chat.ai.generation;

import com.orgmind.chat.model.entity.ChatMessage;

import java.util.List;

/**
 * 一次生成调用的输入。
 *
 * @param graphId   图谱ID，用于检索范围与日志
 * @param threadId  线程ID
 * @param question  用户问题（已还原转义）
 * @param history   按时间正序的历史消息（不含本次问题）
 * @param documents 检索到的参考片段，可为空
 */
public record GenerationRequest(String graphId,
        String threadId,
        String question,
        List<ChatMessage> history,
        List<String> documents) {

    public GenerationRequest {
        history = history == null ? List.of() : List.copyOf(history);
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
