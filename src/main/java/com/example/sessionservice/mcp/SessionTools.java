package com.example.sessionservice.mcp;

import com.example.sessionservice.model.Session;
import com.example.sessionservice.model.SessionPatch;
import com.example.sessionservice.model.dto.SessionResponse;
import com.example.sessionservice.service.SessionManager;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session operations published as MCP tools. The calling agent is trusted to pass the user id
 * it acts for; no ownership check is made here.
 */
@Service
public class SessionTools {

    private final SessionManager sessionManager;

    public SessionTools(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Tool(description = "Create a new troubleshooting session for a user")
    public Map<String,Object> session_create(String userId,
                                             @ToolParam(required = false) String clientId,
                                             @ToolParam(required = false) Map<String,Object> metadata) {
        Session session = sessionManager.create(userId, clientId, metadata);
        return found(session);
    }

    @Tool(description = "Get a session by id")
    public Map<String,Object> session_get(String sessionId) {
        return result(sessionId, sessionManager.get(sessionId));
    }

    @Tool(description = "Update title/status (replaced) and context/metadata (merged) of a session")
    public Map<String,Object> session_update(String sessionId,
                                             @ToolParam(required = false) String title,
                                             @ToolParam(required = false) String status,
                                             @ToolParam(required = false) Map<String,Object> context,
                                             @ToolParam(required = false) Map<String,Object> metadata) {
        SessionPatch patch = SessionPatch.builder()
                .title(title)
                .status(status)
                .context(context)
                .metadata(metadata)
                .build();
        return result(sessionId, sessionManager.update(sessionId, patch));
    }

    @Tool(description = "Record activity on a session and extend its expiry")
    public Map<String,Object> session_heartbeat(String sessionId) {
        return result(sessionId, sessionManager.heartbeat(sessionId));
    }

    @Tool(description = "Delete a session")
    public Map<String,Object> session_delete(String sessionId) {
        return Map.of("sessionId", sessionId, "deleted", sessionManager.delete(sessionId));
    }

    @Tool(description = "List a user's sessions, most recently active first (limit 1-100)")
    public Map<String,Object> session_list(String userId,
                                           @ToolParam(required = false) Integer limit,
                                           @ToolParam(required = false) Integer offset) {
        int lim = (limit == null || limit <= 0) ? 50 : Math.min(limit, 100);
        int off = (offset == null || offset < 0) ? 0 : offset;
        List<SessionResponse> sessions = sessionManager.list(userId, lim, off).stream()
                .map(SessionResponse::from)
                .toList();
        return Map.of("sessions", sessions, "total", sessionManager.count(userId), "limit", lim, "offset", off);
    }

    @Tool(description = "Append a message (role user/assistant/system) to a session")
    public Map<String,Object> session_append_message(String sessionId,
                                                     @ToolParam(required = false, description = "user, assistant or system") String role,
                                                     String content) {
        return result(sessionId, sessionManager.appendMessage(sessionId, role, content, null));
    }

    private static Map<String,Object> result(String sessionId, Optional<Session> session) {
        if (session.isEmpty()) {
            Map<String,Object> missing = new LinkedHashMap<>();
            missing.put("found", false);
            missing.put("sessionId", sessionId);
            return missing;
        }
        return found(session.get());
    }

    private static Map<String,Object> found(Session session) {
        Map<String,Object> result = new LinkedHashMap<>();
        result.put("found", true);
        result.put("session", SessionResponse.from(session));
        return result;
    }
}
