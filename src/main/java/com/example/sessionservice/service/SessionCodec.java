package com.example.sessionservice.service;

import com.example.sessionservice.model.Message;
import com.example.sessionservice.model.Session;
import com.example.sessionservice.model.SessionStatus;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * JSON form of a {@link Session} as stored in Redis. Timestamps are written as ISO-8601 with an
 * explicit {@code +00:00} offset; both {@code Z} and numeric offsets are accepted on read.
 *
 * <p>{@code context} and {@code metadata} values come back as JSON-native types: integral numbers
 * as {@code Integer} or {@code Long} by magnitude, decimals as {@code Double}, objects as maps and
 * arrays as lists. A map holding, say, a small {@code Long} or a {@code Float} therefore decodes
 * to an equal-looking but not {@code equals} value.
 */
@Component
public class SessionCodec {

    static final DateTimeFormatter WRITE_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HH:MM", "+00:00")
            .toFormatter();

    private final ObjectMapper mapper;

    public SessionCodec() {
        SimpleModule timestamps = new SimpleModule("session-timestamps");
        timestamps.addSerializer(Instant.class, new InstantWriter());
        timestamps.addDeserializer(Instant.class, new InstantReader());

        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(timestamps)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Session session) {
        try {
            return mapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session " + session.getSessionId(), e);
        }
    }

    /**
     * @throws SessionDecodeException if the payload is not a readable session
     */
    public Session decode(String json) {
        Session session;
        try {
            session = mapper.readValue(json, Session.class);
        } catch (IOException e) {
            throw new SessionDecodeException("Unreadable session payload", e);
        }
        if (session == null || session.getSessionId() == null || session.getUserId() == null
                || session.getCreatedAt() == null || session.getUpdatedAt() == null
                || session.getLastActivityAt() == null) {
            throw new SessionDecodeException("Session payload is missing required fields", null);
        }
        normalize(session);
        return session;
    }

    private static void normalize(Session session) {
        if (session.getMessages() != null && session.getMessages().contains(null)) {
            throw new SessionDecodeException("Session payload has a null message entry", null);
        }
        if (session.getStatus() == null) session.setStatus(SessionStatus.ACTIVE);
        if (session.getContext() == null) session.setContext(new LinkedHashMap<>());
        if (session.getMetadata() == null) session.setMetadata(new LinkedHashMap<>());
        if (session.getMessages() == null) {
            session.setMessages(new ArrayList<>());
        }
        for (Message m : session.getMessages()) {
            if (m.getMetadata() == null) m.setMetadata(new LinkedHashMap<>());
        }
    }

    static String format(Instant instant) {
        return WRITE_FORMAT.format(instant.atOffset(ZoneOffset.UTC));
    }

    static Instant parse(String text) {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    private static final class InstantWriter extends JsonSerializer<Instant> {
        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }

    private static final class InstantReader extends JsonDeserializer<Instant> {
        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            if (text == null) {
                return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
            }
            try {
                return parse(text);
            } catch (DateTimeParseException e) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "not an ISO-8601 timestamp with offset");
            }
        }
    }

    public static class SessionDecodeException extends RuntimeException {
        public SessionDecodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
