package com.orgmind.chat.ai.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次流式生成的内存态会话，对应一个 (线程, 用户消息)。不落库。
 * <p>
 * 两条独立通道：
 * <ul>
 *   <li>片段通道：单生产者（编排器工作线程）、单消费者（传输层），unicast，第二个订阅者会被拒绝；</li>
 *   <li>完成通道：一次性写入 assistant 消息ID 或错误。</li>
 * </ul>
 * 片段通道关闭只表示"不会再有数据"，结论只看完成通道。
 */
public final class StreamingSession {

    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    public enum Status { PENDING, DONE, ERROR }

    private final String threadId;
    private final String userMessageId;
    private final String provisionalMessageId;

    private final Sinks.Many<String> fragmentSink = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.One<String> completionSink = Sinks.one();

    /** 仅由生产者线程读写 */
    private final StringBuilder text = new StringBuilder();
    private final AtomicInteger fragmentCount = new AtomicInteger();
    private final AtomicReference<Status> status = new AtomicReference<>(Status.PENDING);
    private volatile boolean consumerGone;
    private volatile String messageId;

    StreamingSession(String threadId, String userMessageId, String provisionalMessageId) {
        this.threadId = threadId;
        this.userMessageId = userMessageId;
        this.provisionalMessageId = provisionalMessageId;
    }

    static String key(String threadId, String userMessageId) {
        return threadId + ":" + userMessageId;
    }

    public String key() {
        return key(threadId, userMessageId);
    }

    public String getThreadId() {
        return threadId;
    }

    public String getUserMessageId() {
        return userMessageId;
    }

    /** 本地预分配的 assistant 消息ID，落库失败时作为 done 的兜底ID */
    public String getProvisionalMessageId() {
        return provisionalMessageId;
    }

    /** 片段通道；只能订阅一次 */
    public Flux<String> fragments() {
        return fragmentSink.asFlux();
    }

    /** 完成通道：assistant 消息ID 或错误，恰好一次 */
    public Mono<String> completion() {
        return completionSink.asMono();
    }

    public int fragmentCount() {
        return fragmentCount.get();
    }

    public String text() {
        return text.toString();
    }

    public Status status() {
        return status.get();
    }

    String messageId() {
        return messageId;
    }

    void appendFragment(String fragment) {
        text.append(fragment);
        fragmentCount.incrementAndGet();
        Sinks.EmitResult result = fragmentSink.tryEmitNext(fragment);
        if (result == Sinks.EmitResult.FAIL_CANCELLED) {
            if (!consumerGone) {
                consumerGone = true;
                log.debug("Consumer of session {} is gone, accumulating without relay", key());
            }
        } else if (result.isFailure()) {
            log.warn("Failed to relay fragment of session {}: {}", key(), result);
        }
    }

    /** 关闭片段通道，必须在生成适配器完全返回之后调用 */
    void closeFragments() {
        fragmentSink.tryEmitComplete();
    }

    void complete(String assistantMessageId) {
        if (!status.compareAndSet(Status.PENDING, Status.DONE)) {
            throw new IllegalStateException("Session " + key() + " already finished as " + status.get());
        }
        this.messageId = assistantMessageId;
        completionSink.tryEmitValue(assistantMessageId);
    }

    void fail(Throwable cause) {
        if (!status.compareAndSet(Status.PENDING, Status.ERROR)) {
            throw new IllegalStateException("Session " + key() + " already finished as " + status.get());
        }
        completionSink.tryEmitError(cause);
    }
}
