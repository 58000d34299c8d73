package com.orgmind.chat.ai.stream;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 连接级状态机。终态只能进入一次，后续迁移一律失败。
 */
public final class StreamConnection {

    private final String sessionKey;
    private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.OPEN);

    StreamConnection(String sessionKey) {
        this.sessionKey = sessionKey;
    }

    public String sessionKey() {
        return sessionKey;
    }

    public TransportState state() {
        return state.get();
    }

    void markStreaming() {
        state.compareAndSet(TransportState.OPEN, TransportState.STREAMING);
    }

    /**
     * @return true 表示本次调用完成了向终态的迁移
     */
    boolean finish(TransportState terminal) {
        while (true) {
            TransportState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                return true;
            }
        }
    }
}
