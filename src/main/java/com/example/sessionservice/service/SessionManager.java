package com.example.sessionservice.service;

import com.example.sessionservice.kv.KvClient;
import com.example.sessionservice.kv.StoreUnavailableException;
import com.example.sessionservice.model.Message;
import com.example.sessionservice.model.Session;
import com.example.sessionservice.model.SessionPatch;
import com.example.sessionservice.model.SessionSearchResult;
import com.example.sessionservice.model.SessionStats;
import com.example.sessionservice.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns session records and the per-user index in the key-value store.
 *
 * <p>Keys: {@code session:{sessionId}} holds the JSON record, {@code user_sessions:{userId}} is a
 * set of the user's session ids. Both carry the configured TTL. Writes are not transactional:
 * the record is written first, then the index, then the index expiry. A failure in between
 * leaves a record that is reachable by id but not listed, which is tolerated.
 */
@Service
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    static final String SESSION_PREFIX = "session:";
    static final String USER_INDEX_PREFIX = "user_sessions:";
    static final int SEARCH_SCAN_LIMIT = 1000;

    private static final Comparator<Session> OLDEST_ACTIVITY_FIRST =
            Comparator.comparing(Session::getLastActivityAt).thenComparing(Session::getSessionId);

    private final KvClient kvClient;
    private final SessionCodec codec;
    private final Clock clock;
    private final Duration ttl;
    private final int maxSessionsPerUser;

    public SessionManager(KvClient kvClient,
                          SessionCodec codec,
                          Clock clock,
                          @Value("${app.session.ttl-seconds:604800}") long ttlSeconds,
                          @Value("${app.session.max-per-user:50}") int maxSessionsPerUser) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("app.session.ttl-seconds must be positive");
        }
        if (maxSessionsPerUser <= 0) {
            throw new IllegalArgumentException("app.session.max-per-user must be positive");
        }
        this.kvClient = kvClient;
        this.codec = codec;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.maxSessionsPerUser = maxSessionsPerUser;
    }

    /**
     * Creates and indexes a new active session, then evicts the user's least recently active
     * sessions if the user is over the limit.
     *
     * @throws IllegalArgumentException if {@code userId} is blank
     * @throws StoreUnavailableException if the record or index write fails
     */
    public Session create(String userId, String clientId, Map<String, Object> metadata) {
        if (isBlank(userId)) {
            throw new IllegalArgumentException("user_id is required");
        }

        Instant now = clock.instant();
        Session session = Session.builder()
                .sessionId(UUID.randomUUID().toString())
                .userId(userId)
                .clientId(clientId)
                .createdAt(now)
                .updatedAt(now)
                .lastActivityAt(now)
                .status(SessionStatus.ACTIVE)
                .context(new LinkedHashMap<>())
                .messages(new ArrayList<>())
                .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                .build();

        write(session, true);
        enforceSessionLimit(userId);

        logger.info("Created session {} for user {}", session.getSessionId(), userId);
        return session;
    }

    /**
     * Reads a session without touching its TTL. Missing, expired, corrupt and unreachable
     * records all come back empty.
     */
    public Optional<Session> get(String sessionId) {
        try {
            return load(sessionId);
        } catch (StoreUnavailableException e) {
            logger.error("Error getting session {}", sessionId, e);
            return Optional.empty();
        }
    }

    public Optional<Session> update(String sessionId, SessionPatch patch) {
        Optional<Session> found = load(sessionId);
        if (found.isEmpty()) {
            return found;
        }
        Session session = found.get();
        if (patch != null) {
            if (patch.getTitle() != null) session.setTitle(patch.getTitle());
            if (patch.getStatus() != null) session.setStatus(patch.getStatus());
            if (patch.getContext() != null) session.getContext().putAll(patch.getContext());
            if (patch.getMetadata() != null) session.getMetadata().putAll(patch.getMetadata());
        }
        session.setUpdatedAt(clock.instant());

        write(session, false);
        logger.debug("Updated session {}", sessionId);
        return Optional.of(session);
    }

    /**
     * Marks the session as in use and pushes its expiry out by a full TTL.
     */
    public Optional<Session> heartbeat(String sessionId) {
        Optional<Session> found = load(sessionId);
        if (found.isEmpty()) {
            return found;
        }
        Session session = found.get();
        Instant now = clock.instant();
        session.setLastActivityAt(now);
        session.setUpdatedAt(now);

        write(session, false);
        logger.debug("Heartbeat updated for session {}", sessionId);
        return Optional.of(session);
    }

    public Optional<Session> archive(String sessionId) {
        return update(sessionId, SessionPatch.status(SessionStatus.ARCHIVED));
    }

    public Optional<Session> restore(String sessionId) {
        return update(sessionId, SessionPatch.status(SessionStatus.ACTIVE));
    }

    /**
     * Removes the session from its owner's index and deletes the record.
     *
     * @return true only if the record key was actually removed
     */
    public boolean delete(String sessionId) {
        try {
            Optional<Session> found = load(sessionId);
            if (found.isEmpty()) {
                return false;
            }
            Session session = found.get();
            kvClient.srem(indexKey(session.getUserId()), sessionId);
            long removed = kvClient.del(sessionKey(sessionId));

            logger.info("Deleted session {}", sessionId);
            return removed > 0;
        } catch (StoreUnavailableException e) {
            logger.error("Error deleting session {}", sessionId, e);
            return false;
        }
    }

    /**
     * Returns a page of the user's live sessions, most recently active first. Index entries
     * whose record is gone or unreadable are skipped before the page is cut.
     */
    public List<Session> list(String userId, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        List<Session> sessions = liveSessions(userId);
        sessions.sort(OLDEST_ACTIVITY_FIRST.reversed());

        int from = Math.min(offset, sessions.size());
        int to = (int) Math.min((long) from + limit, sessions.size());
        logger.debug("Listed {} of {} sessions for user {}", to - from, sessions.size(), userId);
        return new ArrayList<>(sessions.subList(from, to));
    }

    /**
     * Size of the user's index. May count sessions that already expired, since the index is
     * only pruned by {@link #delete}.
     */
    public long count(String userId) {
        try {
            return kvClient.scard(indexKey(userId));
        } catch (StoreUnavailableException e) {
            logger.error("Error counting sessions for user {}", userId, e);
            return 0L;
        }
    }

    public Optional<Session> appendMessage(String sessionId, String role, String content, Map<String, Object> metadata) {
        Optional<Session> found = load(sessionId);
        if (found.isEmpty()) {
            return found;
        }
        Session session = found.get();
        Instant now = clock.instant();
        Message message = Message.builder()
                .messageId(UUID.randomUUID().toString())
                .role(isBlank(role) ? "user" : role)
                .content(content == null ? "" : content)
                .timestamp(now)
                .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                .build();
        session.getMessages().add(message);
        session.setLastActivityAt(now);
        session.setUpdatedAt(now);

        write(session, false);
        logger.debug("Appended message {} to session {}", message.getMessageId(), sessionId);
        return Optional.of(session);
    }

    /**
     * The most recent {@code limit} messages, oldest first.
     */
    public Optional<List<Message>> messages(String sessionId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return get(sessionId).map(session -> recentMessages(session, limit));
    }

    public static List<Message> recentMessages(Session session, int limit) {
        List<Message> all = session.getMessages();
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public Optional<SessionStats> stats(String sessionId) {
        return get(sessionId).map(session -> SessionStats.builder()
                .sessionId(session.getSessionId())
                .messageCount(session.getMessages().size())
                .durationSeconds(Duration.between(session.getCreatedAt(), session.getLastActivityAt()).getSeconds())
                .status(session.getStatus())
                .createdAt(session.getCreatedAt())
                .lastActivityAt(session.getLastActivityAt())
                .build());
    }

    /**
     * Filters the user's sessions in memory: exact match on status, case-insensitive substring
     * match on title. Both filters are optional.
     */
    public SessionSearchResult search(String userId, String status, String query, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String needle = isBlank(query) ? null : query.toLowerCase(Locale.ROOT);
        List<Session> matches = list(userId, SEARCH_SCAN_LIMIT, 0).stream()
                .filter(s -> status == null || status.equals(s.getStatus()))
                .filter(s -> needle == null
                        || (s.getTitle() != null && s.getTitle().toLowerCase(Locale.ROOT).contains(needle)))
                .collect(Collectors.toList());

        return new SessionSearchResult(
                new ArrayList<>(matches.subList(0, Math.min(limit, matches.size()))),
                matches.size());
    }

    // Internal helpers

    /**
     * Reads and decodes a record. Store failures propagate; an unreadable payload is logged and
     * reported as absent.
     */
    private Optional<Session> load(String sessionId) {
        if (isBlank(sessionId)) {
            return Optional.empty();
        }
        Optional<String> raw = kvClient.get(sessionKey(sessionId));
        if (raw.isEmpty() || raw.get().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(raw.get()));
        } catch (SessionCodec.SessionDecodeException e) {
            logger.warn("Discarding unreadable payload for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Record, then index membership (new sessions only), then index expiry. Each step is a
     * separate store call and earlier steps are not undone when a later one fails.
     */
    private void write(Session session, boolean addToIndex) {
        String indexKey = indexKey(session.getUserId());
        kvClient.set(sessionKey(session.getSessionId()), codec.encode(session), ttl);
        if (addToIndex) {
            kvClient.sadd(indexKey, session.getSessionId());
        }
        kvClient.expire(indexKey, ttl);
    }

    private List<Session> liveSessions(String userId) {
        Set<String> ids;
        try {
            ids = kvClient.smembers(indexKey(userId));
        } catch (StoreUnavailableException e) {
            logger.error("Error reading session index for user {}", userId, e);
            return new ArrayList<>();
        }

        List<Session> sessions = new ArrayList<>(ids.size());
        for (String id : ids) {
            get(id).ifPresent(sessions::add);
        }
        return sessions;
    }

    private void enforceSessionLimit(String userId) {
        try {
            long count = kvClient.scard(indexKey(userId));
            if (count <= maxSessionsPerUser) {
                return;
            }

            List<Session> sessions = liveSessions(userId);
            sessions.sort(OLDEST_ACTIVITY_FIRST);

            long toDelete = Math.min(count - maxSessionsPerUser, sessions.size());
            for (Session session : sessions.subList(0, (int) toDelete)) {
                delete(session.getSessionId());
                logger.info("Deleted session {} for user {} (limit enforcement)", session.getSessionId(), userId);
            }
        } catch (RuntimeException e) {
            logger.error("Session limit enforcement failed for user {}", userId, e);
        }
    }

    private static String sessionKey(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    private static String indexKey(String userId) {
        return USER_INDEX_PREFIX + userId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
