package com.orgmind.chat.ai.stream;

import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

/**
 * 已通过校验并启动生成的流：连接状态 + 待写出的事件序列。
 */
public record OpenedStream(StreamConnection connection, Flux<ServerSentEvent<String>> events) {
}
