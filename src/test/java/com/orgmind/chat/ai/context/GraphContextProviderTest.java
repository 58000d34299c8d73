package com.orgmind.chat.ai.context;

import com.orgmind.chat.ai.generation.GenerationRequest;
import com.orgmind.chat.model.entity.ChatMessage;
import com.orgmind.chat.model.entity.MessageRole;
import com.orgmind.chat.service.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GraphContextProviderTest {

    private static final LocalDateTime ASKED_AT = LocalDateTime.of(2026, 1, 1, 12, 0);

    private MessageService messageService;
    private ChatMessage userMessage;

    @BeforeEach
    void setUp() {
        messageService = mock(MessageService.class);
        userMessage = message("msg_u", MessageRole.USER, "Who owns the &lt;billing&gt; service?");
        userMessage.setCreatedAt(ASKED_AT);
    }

    private static ChatMessage message(String id, MessageRole role, String content) {
        return new ChatMessage(id, "th_1", role.value(), content, ASKED_AT.minusMinutes(5));
    }

    @Test
    void questionIsUnescapedAndHistoryLoadedBeforeTheQuestion() {
        List<ChatMessage> history = List.of(
                message("m1", MessageRole.USER, "hi"),
                message("m2", MessageRole.ASSISTANT, "hello"));
        when(messageService.listRecentBefore("th_1", ASKED_AT, 16)).thenReturn(history);

        GenerationRequest request = new GraphContextProvider(messageService, null).build("g_1", userMessage);

        assertEquals("Who owns the <billing> service?", request.question());
        assertEquals(history, request.history());
        assertTrue(request.documents().isEmpty());
        assertEquals("g_1", request.graphId());
        assertEquals("th_1", request.threadId());
    }

    @Test
    void trimDropsOldestMessagesFirst() {
        List<ChatMessage> history = List.of(
                message("m1", MessageRole.USER, "a".repeat(50)),
                message("m2", MessageRole.ASSISTANT, "b".repeat(50)),
                message("m3", MessageRole.USER, "c".repeat(50)));

        List<ChatMessage> kept = GraphContextProvider.trimToBudget(history, 120);

        assertEquals(List.of("m2", "m3"), kept.stream().map(ChatMessage::getId).toList());
    }

    @Test
    void retrievalIsScopedToGraph() {
        VectorStore vectorStore = mock(VectorStore.class);
        when(messageService.listRecentBefore(eq("th_1"), any(), anyInt())).thenReturn(List.of());
        when(vectorStore.similaritySearch(any(SearchRequest.class)))
                .thenReturn(List.of(new Document("Billing is owned by the payments team.")));

        GenerationRequest request = new GraphContextProvider(messageService, vectorStore).build("g_1", userMessage);

        assertEquals(List.of("Billing is owned by the payments team."), request.documents());
        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(captor.capture());
        assertEquals(8, captor.getValue().getTopK());
        assertNotNull(captor.getValue().getFilterExpression());
        assertTrue(captor.getValue().getFilterExpression().toString().contains("g_1"));
    }

    @Test
    void retrievalFailureDegradesToNoDocuments() {
        VectorStore vectorStore = mock(VectorStore.class);
        when(messageService.listRecentBefore(eq("th_1"), any(), anyInt())).thenReturn(List.of());
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenThrow(new IllegalStateException("qdrant down"));

        GenerationRequest request = new GraphContextProvider(messageService, vectorStore).build("g_1", userMessage);

        assertTrue(request.documents().isEmpty());
    }
}
