package com.orgmind.chat.ai.orchestrator;

import com.orgmind.chat.ai.context.ContextProvider;
import com.orgmind.chat.ai.generation.GenerationAdapter;
import com.orgmind.chat.ai.generation.GenerationException;
import com.orgmind.chat.ai.generation.GenerationOutcome;
import com.orgmind.chat.ai.generation.GenerationRequest;
import com.orgmind.chat.ai.generation.GenerationTimeoutException;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.MessageRole;
import com.orgmind.chat.service.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 回答生成编排器，终止结论的唯一裁决者。
 * <p>
 * 职责：校验用户消息 → 在独立工作线程上驱动 {@link GenerationAdapter} → 片段写入会话 →
 * 适配器返回后关闭片段通道 → 落库 assistant 消息 → 写入唯一的完成结论。
 * <p>
 * 工作线程的生命周期与客户端连接无关：客户端断开后仍会跑完并落库，
 * 时长受生成超时（含上下文准备）加一次落库约束。工作线程上任何异常或错误都会写入完成通道。
 */
@Service
public class ResponseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResponseOrchestrator.class);

    static final String FAILED_MESSAGE = "Failed to generate response";

    private final GenerationAdapter generationAdapter;
    private final ContextProvider contextProvider;
    private final MessageStore messageStore;
    private final StreamingSessionRegistry registry;
    private final Scheduler generationScheduler;
    private final Scheduler contextScheduler = Schedulers.boundedElastic();

    public ResponseOrchestrator(GenerationAdapter generationAdapter,
            ContextProvider contextProvider,
            MessageStore messageStore,
            StreamingSessionRegistry registry,
            @Qualifier("generationScheduler") Scheduler generationScheduler) {
        this.generationAdapter = generationAdapter;
        this.contextProvider = contextProvider;
        this.messageStore = messageStore;
        this.registry = registry;
        this.generationScheduler = generationScheduler;
    }

    /**
     * 启动一次生成并立即返回会话；调用方并发读取片段，随后在完成通道上等待结论。
     *
     * @throws StreamRejectedException 用户消息不存在/不是用户消息/已有同一消息的生成在进行
     */
    public StreamingSession generate(String graphId, String threadId, String userMessageId) {
        StreamingSession session = new StreamingSession(threadId, userMessageId, newMessageId());
        if (!registry.register(session)) {
            throw new StreamRejectedException(HttpStatus.CONFLICT, "stream_in_progress",
                    "A response is already being generated for this message");
        }

        ChatMessage userMessage;
        try {
            userMessage = loadUserMessage(threadId, userMessageId);
        } catch (RuntimeException e) {
            registry.release(session);
            throw e;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            generationScheduler.schedule(() -> runWithMdc(mdc, () -> run(session, graphId, userMessage)));
        } catch (RejectedExecutionException e) {
            registry.release(session);
            log.warn("Generation capacity exhausted, rejecting session {}", session.key());
            throw new StreamRejectedException(HttpStatus.SERVICE_UNAVAILABLE, "unavailable",
                    "Too many responses are being generated, please retry later");
        }
        log.info("Generation scheduled: session={}, graph={}", session.key(), graphId);
        return session;
    }

    private ChatMessage loadUserMessage(String threadId, String userMessageId) {
        ChatMessage userMessage = messageStore.get(threadId, userMessageId);
        if (userMessage == null) {
            throw new StreamRejectedException(HttpStatus.NOT_FOUND, "not_found", "Message not found");
        }
        if (!userMessage.hasRole(MessageRole.USER)) {
            throw new StreamRejectedException(HttpStatus.BAD_REQUEST, "invalid_argument",
                    "Message is not a user message");
        }
        return userMessage;
    }

    // ==================== 工作线程 ====================

    void run(StreamingSession session, String graphId, ChatMessage userMessage) {
        try {
            GenerationOutcome outcome = drive(session, graphId, userMessage);
            if (!outcome.succeeded()) {
                log.warn("Generation failed: session={}, error={}", session.key(), outcome.error().getMessage());
                session.fail(outcome.error());
                return;
            }
            if (session.text().isBlank()) {
                log.warn("Generation produced only whitespace: session={}, fragments={}",
                        session.key(), session.fragmentCount());
                session.fail(new GenerationException(GenerationAdapter.EMPTY_RESPONSE_MESSAGE));
                return;
            }
            session.complete(persistAssistantMessage(session));
        } catch (Throwable e) {
            log.error("Unexpected failure in generation worker: session={}", session.key(), e);
            if (session.status() == StreamingSession.Status.PENDING) {
                session.closeFragments();
                session.fail(new GenerationException(FAILED_MESSAGE, e));
            }
            Exceptions.throwIfJvmFatal(e);
        } finally {
            registry.release(session);
        }
    }

    /**
     * 运行适配器；无论如何返回，片段通道都在此之后才关闭。
     * 截止时间从准备上下文之前开始计算，检索与生成共用同一个超时。
     */
    private GenerationOutcome drive(StreamingSession session, String graphId, ChatMessage userMessage) {
        long deadline = System.nanoTime() + generationAdapter.timeout().toNanos();
        try {
            GenerationRequest request = buildContext(graphId, userMessage, deadline);
            return generationAdapter.generate(request, session::appendFragment, deadline);
        } catch (GenerationException e) {
            log.warn("Context for session {} failed: {}", session.key(), e.getMessage());
            return GenerationOutcome.failure(0, e);
        } catch (RuntimeException e) {
            if (session.fragmentCount() > 0) {
                log.info("Generation for session {} aborted after {} fragments, keeping partial output: {}",
                        session.key(), session.fragmentCount(), e.toString());
                return GenerationOutcome.success(session.fragmentCount(), e);
            }
            log.warn("Failed to prepare generation for session {}: {}", session.key(), e.toString());
            return GenerationOutcome.failure(0, new GenerationException(FAILED_MESSAGE, e));
        } finally {
            session.closeFragments();
        }
    }

    /**
     * 上下文准备（历史查询、向量检索）在独立线程上执行，超过截止时间即按生成超时处理；
     * 超时后遗留的检索调用自行结束，结果被丢弃。
     */
    private GenerationRequest buildContext(String graphId, ChatMessage userMessage, long deadlineNanos) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            return Mono.fromCallable(() -> callWithMdc(mdc, () -> contextProvider.build(graphId, userMessage)))
                    .subscribeOn(contextScheduler)
                    .timeout(GenerationAdapter.remaining(deadlineNanos))
                    .block();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new GenerationTimeoutException(generationAdapter.timeout());
            }
            throw e;
        }
    }

    /**
     * 生成已成功时落库失败不改变结论：客户端已收到内容，只记录日志并返回本地ID。
     */
    private String persistAssistantMessage(StreamingSession session) {
        String content = session.text();
        try {
            String messageId = messageStore.save(session.getThreadId(), MessageRole.ASSISTANT, content);
            log.info("Assistant message saved: session={}, messageId={}, fragments={}, chars={}",
                    session.key(), messageId, session.fragmentCount(), content.length());
            return messageId;
        } catch (RuntimeException e) {
            log.error("Failed to save assistant message: session={}, chars={}, completing with provisional id {}",
                    session.key(), content.length(), session.getProvisionalMessageId(), e);
            return session.getProvisionalMessageId();
        }
    }

    private static void runWithMdc(Map<String, String> mdc, Runnable task) {
        callWithMdc(mdc, () -> {
            task.run();
            return null;
        });
    }

    private static <T> T callWithMdc(Map<String, String> mdc, Supplier<T> task) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return task.get();
        } finally {
            MDC.clear();
        }
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
