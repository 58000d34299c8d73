package com.orgmind.chat.policy;

import com.orgmind.chat.model.entity.ChatThread;

/**
 * 前置校验结果：通过时携带已加载的线程，失败时携带失败类型。
 */
public record AuthorizationResult(boolean allowed, GuardFailure failure, ChatThread thread) {

    public static AuthorizationResult allow(ChatThread thread) {
        return new AuthorizationResult(true, null, thread);
    }

    public static AuthorizationResult deny(GuardFailure failure) {
        return new AuthorizationResult(false, failure, null);
    }

    /** 通过则返回线程，否则抛出 {@link ChatGuardException} */
    public ChatThread requireAllowed() {
        if (!allowed) {
            throw new ChatGuardException(failure);
        }
        return thread;
    }
}
