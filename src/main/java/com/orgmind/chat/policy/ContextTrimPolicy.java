package com.orgmind.chat.policy;

/**
 * 上下文裁剪策略：最近 N 轮 + 最大字符。
 */
public final class ContextTrimPolicy {

    /** 默认最近对话轮数（每轮 = 1 user + 1 assistant） */
    public static final int DEFAULT_MAX_ROUNDS = 8;

    /** 历史消息条数上限 */
    public static final int DEFAULT_MAX_HISTORY_MESSAGES = DEFAULT_MAX_ROUNDS * 2;

    /** 上下文最大字符数（超长时从最早的消息开始丢弃） */
    public static final int DEFAULT_MAX_CONTEXT_CHARS = 12_000;

    private ContextTrimPolicy() {}
}
