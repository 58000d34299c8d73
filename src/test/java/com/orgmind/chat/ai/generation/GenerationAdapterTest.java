package com.orgmind.chat.ai.generation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationAdapterTest {

    private static final GenerationRequest REQUEST =
            new GenerationRequest("g_1", "th_1", "What is OrgMind?", List.of(), List.of());

    private static GenerationAdapter adapter(Flux<String> upstream) {
        return new GenerationAdapter(request -> upstream, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Clean stream: every fragment reaches the sink in order and the outcome succeeds")
    void cleanStreamSucceeds() {
        List<String> received = new ArrayList<>();

        GenerationOutcome outcome = adapter(Flux.just("Hel", "lo", " world")).generate(REQUEST, received::add);

        assertTrue(outcome.succeeded());
        assertEquals(3, outcome.fragmentsEmitted());
        assertNull(outcome.suppressedError());
        assertEquals(List.of("Hel", "lo", " world"), received);
    }

    @Test
    @DisplayName("Terminal error after output is downgraded to success and kept as suppressed error")
    void errorAfterFragmentsIsSuppressed() {
        List<String> received = new ArrayList<>();
        RuntimeException endOfStream = new IllegalStateException("iterator done");
        Flux<String> upstream = Flux.concat(Flux.just("Partial", " answer"), Flux.error(endOfStream));

        GenerationOutcome outcome = adapter(upstream).generate(REQUEST, received::add);

        assertTrue(outcome.succeeded());
        assertEquals(2, outcome.fragmentsEmitted());
        assertSame(endOfStream, outcome.suppressedError());
        assertEquals(List.of("Partial", " answer"), received);
    }

    @Test
    @DisplayName("Swallowed terminal error is recorded at INFO")
    void suppressedErrorIsLogged() {
        Logger logger = (Logger) LoggerFactory.getLogger(GenerationAdapter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            adapter(Flux.concat(Flux.just("Partial"), Flux.error(new IllegalStateException("iterator done"))))
                    .generate(REQUEST, f -> { });
        } finally {
            logger.detachAppender(appender);
        }

        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.INFO
                        && e.getFormattedMessage().contains("treated as end of stream")
                        && e.getFormattedMessage().contains("iterator done")),
                "expected an INFO record for the swallowed error");
    }

    @Test
    @DisplayName("Terminal error before any output is a failure carrying the upstream message")
    void errorWithoutOutputFails() {
        List<String> received = new ArrayList<>();

        GenerationOutcome outcome = adapter(Flux.error(new IllegalStateException("upstream unavailable")))
                .generate(REQUEST, received::add);

        assertFalse(outcome.succeeded());
        assertEquals(0, outcome.fragmentsEmitted());
        assertEquals("upstream unavailable", outcome.error().getMessage());
        assertInstanceOf(IllegalStateException.class, outcome.error().getCause());
        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("A GenerationException from upstream is passed through unchanged")
    void generationExceptionIsReused() {
        GenerationException upstreamFailure = new GenerationException("quota exceeded");

        GenerationOutcome outcome = adapter(Flux.error(upstreamFailure)).generate(REQUEST, f -> { });

        assertSame(upstreamFailure, outcome.error());
    }

    @Test
    @DisplayName("No output and no error is reported as an empty response failure")
    void emptyStreamFails() {
        GenerationOutcome outcome = adapter(Flux.empty()).generate(REQUEST, f -> { });

        assertFalse(outcome.succeeded());
        assertEquals(GenerationAdapter.EMPTY_RESPONSE_MESSAGE, outcome.error().getMessage());
    }

    @Test
    @DisplayName("Empty fragments are skipped and not counted")
    void emptyFragmentsAreSkipped() {
        List<String> received = new ArrayList<>();

        GenerationOutcome outcome = adapter(Flux.just("", "a", "", "b")).generate(REQUEST, received::add);

        assertEquals(2, outcome.fragmentsEmitted());
        assertEquals(List.of("a", "b"), received);
    }

    @Test
    @DisplayName("Deadline without output fails with a timeout")
    void timeoutWithoutOutputFails() {
        GenerationAdapter adapter = new GenerationAdapter(request -> Flux.never(), Duration.ofMillis(100));

        GenerationOutcome outcome = adapter.generate(REQUEST, f -> { });

        assertFalse(outcome.succeeded());
        assertInstanceOf(GenerationTimeoutException.class, outcome.error());
    }

    @Test
    @DisplayName("Deadline after partial output keeps the partial answer")
    void timeoutAfterOutputKeepsPartialAnswer() {
        List<String> received = new ArrayList<>();
        GenerationAdapter adapter = new GenerationAdapter(
                request -> Flux.concat(Flux.just("partial"), Flux.never()), Duration.ofMillis(100));

        GenerationOutcome outcome = adapter.generate(REQUEST, received::add);

        assertTrue(outcome.succeeded());
        assertEquals(List.of("partial"), received);
        assertInstanceOf(GenerationTimeoutException.class, outcome.suppressedError());
    }

    @Test
    @DisplayName("A deadline started by the caller is honoured even if already spent")
    void callerDeadlineAlreadyPassed() {
        GenerationAdapter adapter = new GenerationAdapter(request -> Flux.never(), Duration.ofSeconds(30));

        GenerationOutcome outcome = adapter.generate(REQUEST, f -> { }, System.nanoTime() - 1_000_000L);

        assertInstanceOf(GenerationTimeoutException.class, outcome.error());
        assertEquals("Generation timed out after 30s", outcome.error().getMessage());
    }

    @Test
    @DisplayName("Deadline covers the whole stream, not the gap between fragments")
    void deadlineIsOverall() {
        Flux<String> slowTrickle = Flux.interval(Duration.ofMillis(40)).map(i -> "t" + i);
        GenerationAdapter adapter = new GenerationAdapter(request -> slowTrickle, Duration.ofMillis(300));
        List<String> received = new ArrayList<>();

        GenerationOutcome outcome = adapter.generate(REQUEST, received::add);

        assertTrue(outcome.succeeded());
        assertInstanceOf(GenerationTimeoutException.class, outcome.suppressedError());
        assertTrue(received.size() < 20, "stream should be cut by the overall deadline, got " + received.size());
    }
}
