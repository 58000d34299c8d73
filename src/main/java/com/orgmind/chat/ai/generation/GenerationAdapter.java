package com.orgmind.chat.ai.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 包装一次外部流式生成调用，把歧义的终止信号归一化为 (片段数, 错误或无)。
 * <p>
 * 以拉取方式阻塞消费上游，必须运行在允许阻塞的线程上。
 * 规则：
 * <ul>
 *   <li>先把收到的每个片段写入 sink，再判断终止条件；</li>
 *   <li>已产出片段后出现的终止错误视为正常结束，仅记录日志；</li>
 *   <li>零片段 + 错误是真正的失败；零片段 + 无错误按空回答失败处理；</li>
 *   <li>整体超时在流内部以错误抛出，与其它终止错误走同一规则。</li>
 * </ul>
 */
@Component
public class GenerationAdapter {

    private static final Logger log = LoggerFactory.getLogger(GenerationAdapter.class);

    public static final String EMPTY_RESPONSE_MESSAGE = "Model returned an empty response";

    private final GenerationClient generationClient;
    private final Duration timeout;

    public GenerationAdapter(GenerationClient generationClient,
            @Value("${app.chat.generation.timeout:PT60S}") Duration timeout) {
        this.generationClient = generationClient;
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    /** 截止时间从本次调用开始计算 */
    public GenerationOutcome generate(GenerationRequest request, Consumer<String> sink) {
        return generate(request, sink, System.nanoTime() + timeout.toNanos());
    }

    /**
     * 在调用方给定的截止时间内生成；调用方在准备上下文前就已开始计时。
     *
     * @param deadlineNanos {@link System#nanoTime()} 基准下的截止时刻
     */
    public GenerationOutcome generate(GenerationRequest request, Consumer<String> sink, long deadlineNanos) {
        log.info("Generation started: graph={}, thread={}, history={}, documents={}",
                request.graphId(), request.threadId(), request.history().size(), request.documents().size());

        int emitted = 0;
        Throwable terminalError = null;
        try {
            for (String fragment : withDeadline(generationClient.stream(request), deadlineNanos).toIterable()) {
                if (fragment == null || fragment.isEmpty()) {
                    continue;
                }
                sink.accept(fragment);
                emitted++;
            }
        } catch (RuntimeException e) {
            terminalError = Exceptions.unwrap(e);
        }
        return normalize(request, emitted, terminalError);
    }

    private GenerationOutcome normalize(GenerationRequest request, int emitted, Throwable terminalError) {
        if (emitted > 0) {
            if (terminalError != null) {
                log.info("Generation stream for thread {} ended with error after {} fragments, treated as end of stream: {}",
                        request.threadId(), emitted, terminalError.toString());
            }
            log.info("Generation completed: thread={}, fragments={}", request.threadId(), emitted);
            return GenerationOutcome.success(emitted, terminalError);
        }
        if (terminalError != null) {
            log.warn("Generation failed without output: thread={}, error={}", request.threadId(), terminalError.toString());
            return GenerationOutcome.failure(0, toGenerationException(terminalError));
        }
        log.warn("Generation produced no output: thread={}", request.threadId());
        return GenerationOutcome.failure(0, new GenerationException(EMPTY_RESPONSE_MESSAGE));
    }

    private Flux<String> withDeadline(Flux<String> source, long deadlineNanos) {
        return Flux.defer(() -> source.timeout(Mono.delay(remaining(deadlineNanos)),
                        fragment -> Mono.delay(remaining(deadlineNanos))))
                .onErrorMap(TimeoutException.class, e -> new GenerationTimeoutException(timeout));
    }

    public static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static GenerationException toGenerationException(Throwable error) {
        if (error instanceof GenerationException generationException) {
            return generationException;
        }
        String message = error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : "Failed to generate response";
        return new GenerationException(message, error);
    }
}
