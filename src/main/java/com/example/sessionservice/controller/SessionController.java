package com.example.sessionservice.controller;

import com.example.sessionservice.model.Message;
import com.example.sessionservice.model.Session;
import com.example.sessionservice.model.SessionSearchResult;
import com.example.sessionservice.model.SessionStats;
import com.example.sessionservice.model.dto.HeartbeatResponse;
import com.example.sessionservice.model.dto.MessageRequest;
import com.example.sessionservice.model.dto.SessionCreateRequest;
import com.example.sessionservice.model.dto.SessionListResponse;
import com.example.sessionservice.model.dto.SessionResponse;
import com.example.sessionservice.model.dto.SessionSearchRequest;
import com.example.sessionservice.model.dto.SessionUpdateRequest;
import com.example.sessionservice.service.SessionManager;
import com.example.sessionservice.service.SessionNotFoundException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * REST surface for sessions. The caller's identity comes from the X-User-ID header set by the
 * API gateway and is trusted as-is; every per-session route checks that the session belongs to
 * that user. Store calls are blocking and run on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    static final String USER_HEADER = "X-User-ID";
    static final String DEFAULT_SESSION_TYPE = "troubleshooting";

    private final SessionManager sessionManager;
    private final int defaultTimeoutMinutes;

    public SessionController(SessionManager sessionManager,
                             @Value("${app.session.default-timeout-minutes:180}") int defaultTimeoutMinutes) {
        this.sessionManager = sessionManager;
        this.defaultTimeoutMinutes = defaultTimeoutMinutes;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SessionResponse> create(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                        @Valid @RequestBody(required = false) SessionCreateRequest request) {
        return blocking(() -> {
            String owner = requireUser(userId);
            SessionCreateRequest body = request != null ? request : new SessionCreateRequest();

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (body.getMetadata() != null) {
                metadata.putAll(body.getMetadata());
            }
            metadata.put("session_type", body.getSessionType() != null ? body.getSessionType() : DEFAULT_SESSION_TYPE);
            metadata.put("timeout_minutes", body.getTimeoutMinutes() != null ? body.getTimeoutMinutes() : defaultTimeoutMinutes);

            Session session = sessionManager.create(owner, body.getClientId(), metadata);
            logger.info("Created session {} for user {} (client_id={})", session.getSessionId(), owner, body.getClientId());
            return SessionResponse.from(session);
        });
    }

    @GetMapping
    public Mono<SessionListResponse> list(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                          @RequestParam(defaultValue = "50") int limit,
                                          @RequestParam(defaultValue = "0") int offset) {
        return blocking(() -> {
            String owner = requireUser(userId);
            if (limit < 1 || limit > 100) {
                throw new IllegalArgumentException("limit must be between 1 and 100");
            }
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            List<SessionResponse> sessions = sessionManager.list(owner, limit, offset).stream()
                    .map(SessionResponse::from)
                    .toList();
            long total = sessionManager.count(owner);
            logger.debug("Listed {} sessions for user {} (total: {})", sessions.size(), owner, total);
            return new SessionListResponse(sessions, total, limit, offset);
        });
    }

    @GetMapping("/{sessionId}")
    public Mono<SessionResponse> get(@PathVariable String sessionId,
                                     @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> SessionResponse.from(owned(sessionId, userId)));
    }

    @PutMapping("/{sessionId}")
    public Mono<SessionResponse> update(@PathVariable String sessionId,
                                        @RequestHeader(value = USER_HEADER, required = false) String userId,
                                        @RequestBody SessionUpdateRequest request) {
        return blocking(() -> {
            owned(sessionId, userId);
            Session session = sessionManager.update(sessionId, request.toPatch())
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            logger.info("Updated session {} for user {}", sessionId, userId);
            return SessionResponse.from(session);
        });
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@PathVariable String sessionId,
                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> {
            owned(sessionId, userId);
            if (!sessionManager.delete(sessionId)) {
                throw new IllegalStateException("Failed to delete session " + sessionId);
            }
            logger.info("Deleted session {} for user {}", sessionId, userId);
            return Boolean.TRUE;
        }).then();
    }

    @PostMapping("/{sessionId}/heartbeat")
    public Mono<HeartbeatResponse> heartbeat(@PathVariable String sessionId,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> {
            owned(sessionId, userId);
            Session session = sessionManager.heartbeat(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            return new HeartbeatResponse(session.getSessionId(), session.getLastActivityAt(), session.getStatus());
        });
    }

    @GetMapping("/{sessionId}/stats")
    public Mono<SessionStats> stats(@PathVariable String sessionId,
                                    @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> {
            owned(sessionId, userId);
            return sessionManager.stats(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        });
    }

    @PostMapping("/{sessionId}/messages")
    public Mono<Map<String, Object>> addMessage(@PathVariable String sessionId,
                                                @RequestHeader(value = USER_HEADER, required = false) String userId,
                                                @RequestBody MessageRequest request) {
        return blocking(() -> {
            owned(sessionId, userId);
            Session session = sessionManager.appendMessage(sessionId, request.getRole(), request.getContent(), request.getMetadata())
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            List<Message> messages = session.getMessages();

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("session_id", sessionId);
            result.put("message", messages.get(messages.size() - 1));
            result.put("total_messages", messages.size());
            return result;
        });
    }

    @GetMapping("/{sessionId}/messages")
    public Mono<Map<String, Object>> messages(@PathVariable String sessionId,
                                              @RequestHeader(value = USER_HEADER, required = false) String userId,
                                              @RequestParam(defaultValue = "100") int limit) {
        return blocking(() -> {
            if (limit < 1 || limit > 500) {
                throw new IllegalArgumentException("limit must be between 1 and 500");
            }
            Session session = owned(sessionId, userId);
            List<Message> recent = SessionManager.recentMessages(session, limit);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("session_id", sessionId);
            result.put("messages", recent);
            result.put("total", session.getMessages().size());
            result.put("returned", recent.size());
            return result;
        });
    }

    @PostMapping("/search")
    public Mono<Map<String, Object>> search(@RequestHeader(value = USER_HEADER, required = false) String userId,
                                            @RequestBody SessionSearchRequest request) {
        return blocking(() -> {
            String owner = requireUser(userId);
            int limit = request.getLimit() != null ? request.getLimit() : 50;
            SessionSearchResult result = sessionManager.search(owner, request.getStatus(), request.getQuery(), limit);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("sessions", result.getSessions().stream().map(SessionResponse::from).toList());
            body.put("total", result.getTotal());
            return body;
        });
    }

    @PostMapping("/{sessionId}/archive")
    public Mono<Map<String, Object>> archive(@PathVariable String sessionId,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> {
            owned(sessionId, userId);
            Session session = sessionManager.archive(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
            return Map.of("session_id", sessionId, "status", session.getStatus());
        });
    }

    @PostMapping("/{sessionId}/restore")
    public Mono<Map<String, Object>> restore(@PathVariable String sessionId,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return blocking(() -> {
            owned(sessionId, userId);
            Session session = sessionManager.restore(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
            return Map.of("session_id", sessionId, "status", session.getStatus());
        });
    }

    private Session owned(String sessionId, String userId) {
        String owner = requireUser(userId);
        Session session = sessionManager.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!owner.equals(session.getUserId())) {
            throw new SessionAccessDeniedException("Not authorized to access this session");
        }
        return session;
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isEmpty()) {
            throw new MissingUserIdException();
        }
        return userId;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
