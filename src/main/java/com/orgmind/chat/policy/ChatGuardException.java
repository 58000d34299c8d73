package com.orgmind.chat.policy;

/**
 * 前置校验未通过。在任何流式工作启动之前抛出，由全局异常处理转换为普通 HTTP 错误。
 */
public class ChatGuardException extends RuntimeException {

    private final GuardFailure failure;

    public ChatGuardException(GuardFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public GuardFailure getFailure() {
        return failure;
    }
}
