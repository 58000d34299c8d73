package com.orgmind.chat.ai.orchestrator;

import org.springframework.http.HttpStatus;

/**
 * 流式请求在启动前被拒绝（消息不存在、不是用户消息、重复请求）。
 */
public class StreamRejectedException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public StreamRejectedException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
