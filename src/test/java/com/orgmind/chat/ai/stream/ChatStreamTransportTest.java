package com.orgmind.chat.ai.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgmind.chat.ai.context.ContextProvider;
import com.orgmind.chat.ai.generation.GenerationAdapter;
import com.orgmind.chat.ai.generation.GenerationClient;
import com.orgmind.chat.ai.generation.GenerationException;
import com.orgmind.chat.ai.generation.GenerationRequest;
import com.orgmind.chat.ai.orchestrator.ResponseOrchestrator;
import com.orgmind.chat.ai.orchestrator.StreamingSessionRegistry;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.ChatThread;
import com.orgmind.chat.model.entity.MessageRole;
import com.orgmind.chat.policy.AuthorizationResult;
import com.orgmind.chat.policy.ChatAccessGuard;
import com.orgmind.chat.policy.ChatGuardException;
import com.orgmind.chat.policy.GuardFailure;
import com.orgmind.chat.service.MessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatStreamTransportTest {

    private static final String GRAPH_ID = "g_1";
    private static final String THREAD_ID = "th_1";
    private static final String USER_MESSAGE_ID = "msg_user";
    private static final String USER_ID = "u_1";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private ChatAccessGuard guard;
    private MessageStore messageStore;
    private ContextProvider contextProvider;
    private Scheduler worker;

    @BeforeEach
    void setUp() {
        guard = mock(ChatAccessGuard.class);
        messageStore = mock(MessageStore.class);
        contextProvider = mock(ContextProvider.class);
        worker = Schedulers.newBoundedElastic(4, 16, "test-generation");

        ChatThread thread = new ChatThread(THREAD_ID, GRAPH_ID, USER_ID, null, null, null);
        when(guard.checkStream(GRAPH_ID, THREAD_ID, USER_ID)).thenReturn(AuthorizationResult.allow(thread));
        when(messageStore.get(THREAD_ID, USER_MESSAGE_ID)).thenReturn(new ChatMessage(USER_MESSAGE_ID, THREAD_ID,
                MessageRole.USER.value(), "question", LocalDateTime.of(2026, 1, 1, 12, 0)));
        when(messageStore.save(eq(THREAD_ID), eq(MessageRole.ASSISTANT), anyString())).thenReturn("msg_assistant");
        when(contextProvider.build(eq(GRAPH_ID), any()))
                .thenReturn(new GenerationRequest(GRAPH_ID, THREAD_ID, "question", List.of(), List.of()));
    }

    @AfterEach
    void tearDown() {
        worker.dispose();
    }

    private ChatStreamTransport transport(GenerationClient client, Scheduler scheduler) {
        ResponseOrchestrator orchestrator = new ResponseOrchestrator(
                new GenerationAdapter(client, Duration.ofSeconds(5)),
                contextProvider, messageStore, new StreamingSessionRegistry(), scheduler);
        return new ChatStreamTransport(guard, orchestrator, new ObjectMapper());
    }

    private OpenedStream open(ChatStreamTransport transport) {
        return transport.open(GRAPH_ID, THREAD_ID, USER_MESSAGE_ID, USER_ID);
    }

    private static boolean isEvent(ServerSentEvent<String> event, String name, String data) {
        return name.equals(event.event()) && data.equals(event.data());
    }

    @Test
    @DisplayName("Clean stream: chunks in order, then a single done with the assistant message id")
    void cleanStream() {
        OpenedStream opened = open(transport(request -> Flux.just("Hel", "lo"), Schedulers.immediate()));

        StepVerifier.create(opened.events())
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\"Hel\"}"))
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\"lo\"}"))
                .expectNextMatches(e -> isEvent(e, "done", "{\"content\":\"msg_assistant\"}"))
                .verifyComplete();
        assertEquals(TransportState.DONE, opened.connection().state());
    }

    @Test
    @DisplayName("Failure before any output: a single error event and no chunks")
    void failureWithoutOutput() {
        OpenedStream opened = open(transport(
                request -> Flux.error(new IllegalStateException("upstream unavailable")), Schedulers.immediate()));

        StepVerifier.create(opened.events())
                .expectNextMatches(e -> isEvent(e, "error", "{\"error\":\"upstream unavailable\"}"))
                .verifyComplete();
        assertEquals(TransportState.FAILED, opened.connection().state());
        verify(messageStore, never()).save(any(), any(), any());
    }

    @Test
    @DisplayName("Error after partial output ends with done, never with error")
    void partialOutputThenError() {
        Flux<String> upstream = Flux.concat(Flux.just("Partial", " answer"),
                Flux.error(new IllegalStateException("iterator done")));
        OpenedStream opened = open(transport(request -> upstream, Schedulers.immediate()));

        StepVerifier.create(opened.events())
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\"Partial\"}"))
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\" answer\"}"))
                .expectNextMatches(e -> isEvent(e, "done", "{\"content\":\"msg_assistant\"}"))
                .verifyComplete();
        verify(messageStore).save(THREAD_ID, MessageRole.ASSISTANT, "Partial answer");
    }

    @Test
    @DisplayName("Terminal event waits for persistence to finish")
    void terminalEventWaitsForCompletion() throws InterruptedException {
        CountDownLatch persisted = new CountDownLatch(1);
        when(messageStore.save(eq(THREAD_ID), eq(MessageRole.ASSISTANT), anyString())).thenAnswer(invocation -> {
            assertTrue(persisted.await(5, TimeUnit.SECONDS));
            return "msg_assistant";
        });
        Sinks.Many<String> upstream = Sinks.many().unicast().onBackpressureBuffer();
        OpenedStream opened = open(transport(request -> upstream.asFlux(), worker));

        StepVerifier.create(opened.events())
                .then(() -> {
                    upstream.tryEmitNext("answer");
                    upstream.tryEmitComplete();
                })
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\"answer\"}"))
                .expectNoEvent(Duration.ofMillis(200))
                .then(persisted::countDown)
                .expectNextMatches(e -> isEvent(e, "done", "{\"content\":\"msg_assistant\"}"))
                .expectComplete()
                .verify(WAIT);
    }

    @Test
    @DisplayName("Persistence failure is invisible to the client")
    void persistenceFailureStillEndsWithDone() {
        when(messageStore.save(eq(THREAD_ID), eq(MessageRole.ASSISTANT), anyString()))
                .thenThrow(new IllegalStateException("insert failed"));
        OpenedStream opened = open(transport(request -> Flux.just("answer"), Schedulers.immediate()));

        StepVerifier.create(opened.events())
                .expectNextMatches(e -> "chunk".equals(e.event()))
                .expectNextMatches(e -> "done".equals(e.event()) && e.data().contains("msg_"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Guard rejection short-circuits before the orchestrator is touched")
    void guardRejectionStartsNothing() {
        when(guard.checkStream(GRAPH_ID, THREAD_ID, USER_ID))
                .thenReturn(AuthorizationResult.deny(GuardFailure.RATE_LIMITED));
        ResponseOrchestrator orchestrator = mock(ResponseOrchestrator.class);
        ChatStreamTransport transport = new ChatStreamTransport(guard, orchestrator, new ObjectMapper());

        ChatGuardException ex = assertThrows(ChatGuardException.class,
                () -> transport.open(GRAPH_ID, THREAD_ID, USER_MESSAGE_ID, USER_ID));

        assertEquals(GuardFailure.RATE_LIMITED, ex.getFailure());
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Client disconnect abandons the connection while generation still persists")
    void disconnectAbandonsConnection() {
        Sinks.Many<String> upstream = Sinks.many().unicast().onBackpressureBuffer();
        OpenedStream opened = open(transport(request -> upstream.asFlux(), worker));

        StepVerifier.create(opened.events())
                .then(() -> upstream.tryEmitNext("first"))
                .expectNextMatches(e -> isEvent(e, "chunk", "{\"content\":\"first\"}"))
                .thenCancel()
                .verify(WAIT);
        assertEquals(TransportState.ABANDONED, opened.connection().state());

        upstream.tryEmitNext(" rest");
        upstream.tryEmitComplete();

        verify(messageStore, timeout(WAIT.toMillis())).save(THREAD_ID, MessageRole.ASSISTANT, "first rest");
        assertEquals(TransportState.ABANDONED, opened.connection().state());
    }

    @Test
    @DisplayName("An Error on the generation worker ends the stream with a single error event")
    void workerErrorEndsWithErrorEvent() {
        GenerationClient client = request -> {
            throw new StackOverflowError("deep recursion");
        };
        OpenedStream opened = open(transport(client, worker));

        StepVerifier.create(opened.events())
                .expectNextMatches(e -> isEvent(e, "error", "{\"error\":\"Failed to generate response\"}"))
                .expectComplete()
                .verify(WAIT);
        assertEquals(TransportState.FAILED, opened.connection().state());
    }

    @Test
    void describeUsesGenerationMessageOnly() {
        assertEquals("Generation timed out after 60s",
                ChatStreamTransport.describe(new GenerationException("Generation timed out after 60s")));
        assertEquals(ChatStreamTransport.GENERIC_ERROR_MESSAGE,
                ChatStreamTransport.describe(new IllegalStateException("NullPointer in mapper")));
    }
}
