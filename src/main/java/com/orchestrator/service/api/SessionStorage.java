package com.orchestrator.service.api;

import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.SessionQuery;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persists execution sessions.
 * <p>
 * Implementations must make every write for a single id atomic: a concurrent reader sees either
 * the previous or the new version of a session, never a partial one. Writes to distinct ids may
 * proceed concurrently.
 */
public interface SessionStorage {

    /**
     * Saves or replaces a session.
     */
    void saveSession(ExecutionSession session);

    Optional<ExecutionSession> loadSession(String sessionId);

    /**
     * Loads a session, applies the mutator and saves it again while holding the lock for that id.
     * {@code updatedAt} is stamped after the mutator runs.
     *
     * @return The saved session.
     * @throws com.orchestrator.exception.SessionNotFoundException if no session has that id.
     */
    ExecutionSession updateSession(String sessionId, Consumer<ExecutionSession> mutator);

    /**
     * @return {@code true} if a session was deleted.
     */
    boolean deleteSession(String sessionId);

    /**
     * Lists matching sessions, newest first, windowed by the query's offset and limit.
     */
    List<ExecutionSession> listSessions(SessionQuery query);

    /**
     * Aggregates all sessions whose plan id or base plan id equals {@code planId}.
     */
    ExecutionStats getExecutionStats(String planId);
}
