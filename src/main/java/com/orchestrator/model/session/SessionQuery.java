package com.orchestrator.model.session;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import lombok.Builder;

/**
 * Filters for listing sessions. Unset filters match everything; results are ordered newest first
 * and then windowed by {@code offset} and {@code limit}.
 */
@Builder
public record SessionQuery(String planId, String basePlanId, SessionStatus status, Platform platform,
                           Integer offset, Integer limit) {

    private static final Comparator<ExecutionSession> NEWEST_FIRST = Comparator
            .comparing(ExecutionSession::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(ExecutionSession::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public static SessionQuery all() {
        return SessionQuery.builder().build();
    }

    public boolean matches(ExecutionSession session) {
        return (planId == null || planId.equals(session.getPlanId()))
                && (basePlanId == null || basePlanId.equals(session.getBasePlanId()))
                && (status == null || status == session.getStatus())
                && (platform == null || platform == session.getPlatform());
    }

    public List<ExecutionSession> apply(Collection<ExecutionSession> sessions) {
        Stream<ExecutionSession> selected = sessions.stream()
                .filter(this::matches)
                .sorted(NEWEST_FIRST)
                .skip(offset == null ? 0 : Math.max(0, offset));
        if (limit != null && limit >= 0) {
            selected = selected.limit(limit);
        }
        return selected.toList();
    }
}
