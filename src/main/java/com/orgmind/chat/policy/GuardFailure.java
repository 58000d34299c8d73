package com.orgmind.chat.policy;

import org.springframework.http.HttpStatus;

/**
 * 前置校验失败类型及其 HTTP 映射。
 */
public enum GuardFailure {

    NOT_MEMBER(HttpStatus.FORBIDDEN, "forbidden", "You don't have access to this graph"),
    THREAD_NOT_FOUND(HttpStatus.NOT_FOUND, "not_found", "Chat thread not found"),
    THREAD_GRAPH_MISMATCH(HttpStatus.BAD_REQUEST, "invalid_argument", "Thread does not belong to this graph"),
    CONTENT_TOO_LONG(HttpStatus.BAD_REQUEST, "invalid_argument",
            "Message content exceeds " + MessageContentPolicy.MAX_CONTENT_CHARS + " characters"),
    CONTENT_EMPTY(HttpStatus.BAD_REQUEST, "invalid_argument", "Message content is required"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", "Rate limit exceeded");

    private final HttpStatus status;
    private final String code;
    private final String message;

    GuardFailure(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
