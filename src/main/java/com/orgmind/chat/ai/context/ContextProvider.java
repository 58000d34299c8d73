package com.orgmind.chat.ai.context;

import com.orgmind.chat.ai.generation.GenerationRequest;
import com.orgmind.chat.model.entity.ChatMessage;

/**
 * 为生成调用准备上下文：线程历史 + 图谱检索结果。
 */
public interface ContextProvider {

    GenerationRequest build(String graphId, ChatMessage userMessage);
}
