package com.orchestrator.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.exception.SessionNotFoundException;
import com.orchestrator.exception.SessionStorageException;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.service.api.SessionStorage;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link SessionStorage} that keeps sessions in memory. Nothing survives a restart.
 * <p>
 * Sessions are stored as copies made through Jackson, so callers can never change stored state
 * without saving, exactly as with the file-based storage.
 */
@Slf4j
public class InMemorySessionStorage implements SessionStorage {

    private final ObjectMapper objectMapper;
    private final Map<String, ExecutionSession> sessions = new ConcurrentHashMap<>();

    public InMemorySessionStorage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void saveSession(ExecutionSession session) {
        sessions.put(session.getId(), copy(session));
    }

    @Override
    public Optional<ExecutionSession> loadSession(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get).map(this::copy);
    }

    @Override
    public ExecutionSession updateSession(String sessionId, Consumer<ExecutionSession> mutator) {
        ExecutionSession updated = sessions.compute(sessionId, (id, stored) -> {
            if (stored == null) {
                throw new SessionNotFoundException(sessionId);
            }
            ExecutionSession session = copy(stored);
            mutator.accept(session);
            session.setUpdatedAt(Instant.now());
            return session;
        });
        return copy(updated);
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @Override
    public List<ExecutionSession> listSessions(SessionQuery query) {
        return query.apply(sessions.values()).stream().map(this::copy).toList();
    }

    @Override
    public ExecutionStats getExecutionStats(String planId) {
        return ExecutionStats.of(planId, sessions.values());
    }

    private ExecutionSession copy(ExecutionSession session) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(session), ExecutionSession.class);
        } catch (IOException e) {
            throw new SessionStorageException("Failed to copy session " + session.getId(), e);
        }
    }
}
