package com.orchestrator.model.session;

import java.util.Collection;
import java.util.List;

/**
 * Aggregate outcome of all sessions of one plan.
 *
 * @param averageDuration Mean wall-clock duration of successful sessions in milliseconds.
 */
public record ExecutionStats(int totalExecutions, int successCount, int failureCount, long averageDuration) {

    /**
     * Aggregates the sessions whose plan id, or base plan id, equals {@code planId}.
     * Sessions still in progress count towards the total only.
     */
    public static ExecutionStats of(String planId, Collection<ExecutionSession> sessions) {
        List<ExecutionSession> matching = sessions.stream()
                .filter(session -> planId.equals(session.getPlanId()) || planId.equals(session.getBasePlanId()))
                .toList();
        List<ExecutionSession> successful = matching.stream().filter(ExecutionSession::isSuccessful).toList();
        int failures = (int) matching.stream().filter(ExecutionSession::isUnsuccessful).count();
        long average = successful.isEmpty() ? 0 : Math.round(successful.stream()
                .mapToLong(session -> session.getDuration().toMillis())
                .average()
                .orElse(0));
        return new ExecutionStats(matching.size(), successful.size(), failures, average);
    }
}
