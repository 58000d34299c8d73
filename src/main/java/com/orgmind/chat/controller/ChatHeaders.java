package com.orgmind.chat.controller;

final class ChatHeaders {

    /** 由上游认证网关注入的调用者ID */
    static final String HEADER_USER_ID = "X-User-Id";

    private ChatHeaders() {
    }

    static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new MissingUserIdentityException();
        }
        return userId.trim();
    }
}
