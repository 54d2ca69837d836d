package com.orchestrator.service.api;

import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.Platform;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.model.session.SessionStatus;
import java.util.List;
import java.util.Map;

/**
 * Drives execution sessions through their lifecycle:
 * {@code pending -> running -> (waiting_input <-> running) -> completed | failed}.
 * Every transition and every recorded step is persisted before the next one starts.
 */
public interface SessionManager {

    /**
     * Creates and persists a new {@code pending} session for the plan.
     *
     * @throws com.orchestrator.exception.PlanValidationException if the plan is invalid.
     */
    ExecutionSession createSession(ExecutionPlan plan, Platform platform);

    /**
     * Runs a {@code pending} session (or a {@code running} one left behind by a crash) until it
     * completes, fails or needs user input.
     *
     * @return The session as persisted at the end of the run.
     */
    ExecutionSession executeSession(String sessionId);

    /**
     * Supplies the values a {@code waiting_input} session is waiting for and continues the run.
     *
     * @param values Raw values keyed by field id; converted according to the pending schema.
     * @throws com.orchestrator.exception.InputValidationException if a required value is missing or
     *         a value cannot be converted.
     */
    ExecutionSession resumeSession(String sessionId, Map<String, Object> values);

    /**
     * Creates a new {@code pending} session from a {@code failed} one, ready for
     * {@link #executeSession(String)}. The original is left untouched.
     *
     * @param fromStepId Successful results of steps before this id, and the variables they wrote,
     *                   are carried over; when {@code null} the new session starts from scratch.
     */
    ExecutionSession retrySession(String sessionId, Integer fromStepId);

    /**
     * Marks a non-terminal session as failed.
     */
    ExecutionSession cancelSession(String sessionId);

    ExecutionSession getSession(String sessionId);

    SessionStatus getSessionStatus(String sessionId);

    List<ExecutionSession> listSessions(SessionQuery query);

    boolean deleteSession(String sessionId);

    ExecutionStats getExecutionStats(String planId);
}
