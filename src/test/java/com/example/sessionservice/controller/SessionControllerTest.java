package com.example.sessionservice.controller;

import com.example.sessionservice.kv.StoreUnavailableException;
import com.example.sessionservice.model.Message;
import com.example.sessionservice.model.Session;
import com.example.sessionservice.model.SessionPatch;
import com.example.sessionservice.model.SessionSearchResult;
import com.example.sessionservice.service.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private SessionManager sessionManager;

    @Captor
    private ArgumentCaptor<Map<String, Object>> metadata;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new SessionController(sessionManager, 180))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private Session session(String sessionId, String userId) {
        return Session.builder()
                .sessionId(sessionId)
                .userId(userId)
                .createdAt(NOW)
                .updatedAt(NOW)
                .lastActivityAt(NOW)
                .build();
    }

    @Test
    void testCreate_MergesSessionTypeAndTimeoutIntoMetadata() {
        // Given
        when(sessionManager.create(eq("u1"), eq("client-abc"), anyMap())).thenReturn(session("s-1", "u1"));

        // When / Then
        client.post().uri("/api/v1/sessions")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"client_id\":\"client-abc\",\"metadata\":{\"team\":\"sre\"}}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.session_id").isEqualTo("s-1")
                .jsonPath("$.status").isEqualTo("active")
                .jsonPath("$.message_count").isEqualTo(0);

        verify(sessionManager).create(eq("u1"), eq("client-abc"), metadata.capture());
        assertEquals("sre", metadata.getValue().get("team"));
        assertEquals("troubleshooting", metadata.getValue().get("session_type"));
        assertEquals(180, metadata.getValue().get("timeout_minutes"));
    }

    @Test
    void testCreate_TimeoutOutOfRangeIsBadRequest() {
        client.post().uri("/api/v1/sessions")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"timeout_minutes\":5}")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(sessionManager);
    }

    @Test
    void testCreate_RejectedUserIdIsBadRequest() {
        when(sessionManager.create(eq("u1"), any(), anyMap())).thenThrow(new IllegalArgumentException("user_id is required"));

        client.post().uri("/api/v1/sessions")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("user_id is required");
    }

    @Test
    void testMissingUserHeader_Unauthorized() {
        client.get().uri("/api/v1/sessions/s-1")
                .exchange()
                .expectStatus().isUnauthorized();

        verifyNoInteractions(sessionManager);
    }

    @Test
    void testGet_OtherUsersSessionForbidden() {
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "someone-else")));

        client.get().uri("/api/v1/sessions/s-1")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void testGet_MissingSessionNotFound() {
        when(sessionManager.get("s-1")).thenReturn(Optional.empty());

        client.get().uri("/api/v1/sessions/s-1")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.path").isEqualTo("/api/v1/sessions/s-1");
    }

    @Test
    void testUpdate_IgnoresUnknownFieldsAndPassesPatch() {
        Session stored = session("s-1", "u1");
        Session updated = session("s-1", "u1");
        updated.setStatus("archived");
        when(sessionManager.get("s-1")).thenReturn(Optional.of(stored));
        when(sessionManager.update(eq("s-1"), any(SessionPatch.class))).thenReturn(Optional.of(updated));

        client.put().uri("/api/v1/sessions/s-1")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"status\":\"archived\",\"messages\":[],\"user_id\":\"hijack\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("archived")
                .jsonPath("$.user_id").isEqualTo("u1");

        ArgumentCaptor<SessionPatch> patch = ArgumentCaptor.forClass(SessionPatch.class);
        verify(sessionManager).update(eq("s-1"), patch.capture());
        assertEquals("archived", patch.getValue().getStatus());
        assertNull(patch.getValue().getTitle());
        assertNull(patch.getValue().getContext());
    }

    @Test
    void testUpdate_StoreFailureHidesDetails() {
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "u1")));
        when(sessionManager.update(eq("s-1"), any(SessionPatch.class)))
                .thenThrow(new StoreUnavailableException("Redis command failed: SET session:s-1",
                        new RuntimeException("redis://secret@10.0.0.5:6379 refused")));

        String body = client.put().uri("/api/v1/sessions/s-1")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"title\":\"x\"}")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertFalse(body.contains("secret"));
        assertFalse(body.contains("Redis command failed"));
    }

    @Test
    void testDelete_NoContent() {
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "u1")));
        when(sessionManager.delete("s-1")).thenReturn(true);

        client.delete().uri("/api/v1/sessions/s-1")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void testHeartbeat_ReturnsActivityTimestamp() {
        Session beat = session("s-1", "u1");
        beat.setLastActivityAt(NOW.plusSeconds(30));
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "u1")));
        when(sessionManager.heartbeat("s-1")).thenReturn(Optional.of(beat));

        client.post().uri("/api/v1/sessions/s-1/heartbeat")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.session_id").isEqualTo("s-1")
                .jsonPath("$.last_activity_at").isEqualTo("2024-05-01T10:00:30Z")
                .jsonPath("$.message").isEqualTo("Heartbeat updated");
    }

    @Test
    void testList_ReturnsPageAndTotal() {
        when(sessionManager.list("u1", 10, 0)).thenReturn(List.of(session("s-1", "u1"), session("s-2", "u1")));
        when(sessionManager.count("u1")).thenReturn(5L);

        client.get().uri("/api/v1/sessions?limit=10")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessions.length()").isEqualTo(2)
                .jsonPath("$.total").isEqualTo(5)
                .jsonPath("$.limit").isEqualTo(10)
                .jsonPath("$.offset").isEqualTo(0);
    }

    @Test
    void testList_LimitOutOfRangeIsBadRequest() {
        client.get().uri("/api/v1/sessions?limit=500")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(sessionManager);
    }

    @Test
    void testAddMessage_ReturnsAppendedMessage() {
        Session withMessage = session("s-1", "u1");
        withMessage.getMessages().add(Message.builder()
                .messageId("m-1").role("user").content("disk full").timestamp(NOW).build());
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "u1")));
        when(sessionManager.appendMessage("s-1", "user", "disk full", null)).thenReturn(Optional.of(withMessage));

        client.post().uri("/api/v1/sessions/s-1/messages")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"role\":\"user\",\"content\":\"disk full\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message.message_id").isEqualTo("m-1")
                .jsonPath("$.total_messages").isEqualTo(1);
    }

    @Test
    void testMessages_TailAndTotalFromOneRead() {
        Session stored = session("s-1", "u1");
        for (int i = 1; i <= 3; i++) {
            stored.getMessages().add(Message.builder()
                    .messageId("m-" + i).role("user").content("line " + i).timestamp(NOW).build());
        }
        when(sessionManager.get("s-1")).thenReturn(Optional.of(stored));

        client.get().uri("/api/v1/sessions/s-1/messages?limit=2")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.messages.length()").isEqualTo(2)
                .jsonPath("$.messages[0].message_id").isEqualTo("m-2")
                .jsonPath("$.total").isEqualTo(3)
                .jsonPath("$.returned").isEqualTo(2);

        verify(sessionManager, times(1)).get("s-1");
        verify(sessionManager, never()).messages(anyString(), anyInt());
    }

    @Test
    void testArchive_ReturnsNewStatus() {
        Session archived = session("s-1", "u1");
        archived.setStatus("archived");
        when(sessionManager.get("s-1")).thenReturn(Optional.of(session("s-1", "u1")));
        when(sessionManager.archive("s-1")).thenReturn(Optional.of(archived));

        client.post().uri("/api/v1/sessions/s-1/archive")
                .header("X-User-ID", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("archived");
    }

    @Test
    void testSearch_UsesDefaultLimit() {
        when(sessionManager.search("u1", "active", "disk", 50))
                .thenReturn(new SessionSearchResult(List.of(session("s-1", "u1")), 1));

        client.post().uri("/api/v1/sessions/search")
                .header("X-User-ID", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new LinkedHashMap<>(Map.of("status", "active", "query", "disk")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(1)
                .jsonPath("$.sessions[0].session_id").isEqualTo("s-1");
    }
}
