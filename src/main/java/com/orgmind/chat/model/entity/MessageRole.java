package com.orgmind.chat.model.entity;

/**
 * 消息角色，库中以小写字符串保存。
 */
public enum MessageRole {

    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
