package com.orgmind.chat.ai.generation;

import reactor.core.publisher.Flux;

/**
 * 外部逐 token 流式生成 API。
 * <p>
 * 终止信号有歧义：流正常耗尽时也可能以 error 结束，调用方不能据此判断失败，
 * 统一经 {@link GenerationAdapter} 归一化。
 */
public interface GenerationClient {

    Flux<String> stream(GenerationRequest request);
}
