package com.orgmind.chat.policy;

import org.springframework.web.util.HtmlUtils;

/**
 * 消息内容约束：长度上限、线程摘要生成、落库前转义。
 */
public final class MessageContentPolicy {

    /** 单条消息最大字符数 */
    public static final int MAX_CONTENT_CHARS = 4_000;

    /** 线程摘要最大长度 */
    public static final int SUMMARY_MAX_CHARS = 100;

    private static final String ELLIPSIS = "...";

    private MessageContentPolicy() {}

    public static boolean isBlank(String content) {
        return content == null || content.isBlank();
    }

    public static boolean isTooLong(String content) {
        return content != null && content.length() > MAX_CONTENT_CHARS;
    }

    /**
     * 由首条用户消息生成线程摘要：去首尾空白，超过 100 字符截成 97 + "..."。
     */
    public static String summarize(String firstMessage) {
        String trimmed = firstMessage == null ? "" : firstMessage.trim();
        if (trimmed.length() > SUMMARY_MAX_CHARS) {
            return trimmed.substring(0, SUMMARY_MAX_CHARS - ELLIPSIS.length()) + ELLIPSIS;
        }
        return trimmed;
    }

    /** 落库前做 HTML 转义，防止前端渲染时 XSS */
    public static String sanitize(String content) {
        return content == null ? "" : HtmlUtils.htmlEscape(content);
    }
}
