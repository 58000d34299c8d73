package com.orgmind.chat.ai.stream;

/**
 * 单个连接的传输状态。DONE / FAILED / ABANDONED 为终态。
 */
public enum TransportState {

    /** 响应头已发出，等待片段 */
    OPEN,
    /** 已转发至少一个片段 */
    STREAMING,
    /** 已发送唯一的 done 事件 */
    DONE,
    /** 已发送唯一的 error 事件 */
    FAILED,
    /** 客户端在终止事件前断开，不再写出任何事件 */
    ABANDONED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == ABANDONED;
    }
}
