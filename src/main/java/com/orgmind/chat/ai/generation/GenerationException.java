package com.orgmind.chat.ai.generation;

/**
 * 生成失败（未产出任何片段）。消息内容会直接作为 error 事件下发给客户端。
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
