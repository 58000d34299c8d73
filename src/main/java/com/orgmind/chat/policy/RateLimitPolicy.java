package com.orgmind.chat.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流策略：按 userId + 动作（scope）固定窗口计数，默认 20 次 / 1 分钟。
 */
@Component
public class RateLimitPolicy {

    private static final Logger log = LoggerFactory.getLogger(RateLimitPolicy.class);

    /** 提交消息 */
    public static final String SCOPE_MESSAGE = "message";

    /** 打开流式回答 */
    public static final String SCOPE_STREAM = "stream";

    private final Map<String, Window> keyToWindow = new ConcurrentHashMap<>();
    private final int maxRequestsPerWindow;
    private final long windowMs;
    private final Clock clock;

    public RateLimitPolicy(@Value("${app.chat.rate-limit.max-requests:20}") int maxRequestsPerWindow,
            @Value("${app.chat.rate-limit.window:PT1M}") Duration window,
            Clock clock) {
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.windowMs = window.toMillis();
        this.clock = clock;
    }

    /**
     * 检查是否允许请求；若允许则记录一次。
     *
     * @param userId 调用者
     * @param scope  {@link #SCOPE_MESSAGE} 或 {@link #SCOPE_STREAM}
     * @return true 允许，false 应返回 429
     */
    public boolean allow(String userId, String scope) {
        String key = (userId != null ? userId : "") + "|" + (scope != null ? scope : "");
        long now = clock.millis();
        Window w = keyToWindow.compute(key, (k, old) -> {
            if (old == null || now - old.startMs >= windowMs) {
                return new Window(now, 1);
            }
            if (old.count > maxRequestsPerWindow) {
                return old;
            }
            return new Window(old.startMs, old.count + 1);
        });
        return w.count <= maxRequestsPerWindow;
    }

    /** 定期清理已过期窗口，避免 key 无限增长 */
    @Scheduled(fixedDelayString = "${app.chat.rate-limit.cleanup-interval-ms:300000}")
    public void evictExpired() {
        long now = clock.millis();
        int before = keyToWindow.size();
        keyToWindow.entrySet().removeIf(e -> now - e.getValue().startMs >= windowMs);
        int evicted = before - keyToWindow.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate-limit windows", evicted);
        }
    }

    int trackedKeys() {
        return keyToWindow.size();
    }

    private record Window(long startMs, int count) {}
}
