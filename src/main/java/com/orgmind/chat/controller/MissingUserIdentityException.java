package com.orgmind.chat.controller;

/**
 * 请求未携带网关注入的 X-User-Id。
 */
public class MissingUserIdentityException extends RuntimeException {

    public MissingUserIdentityException() {
        super("User ID not found in request");
    }
}
