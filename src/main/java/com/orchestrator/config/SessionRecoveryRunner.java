package com.orchestrator.config;

import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.model.session.SessionStatus;
import com.orchestrator.service.api.SessionManager;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Reports, on startup, the sessions a previous process left unfinished.
 * <p>
 * Sessions waiting for input are listed so they can be resumed. Sessions left {@code running}
 * were interrupted mid-step; with {@code orchestrator.recovery.auto-resume=true} they are driven
 * again from their last persisted step.
 */
@Component
@Profile("!test")
@Slf4j
public class SessionRecoveryRunner implements CommandLineRunner {

    @Value("${orchestrator.recovery.auto-resume:false}")
    private boolean autoResume;

    private final SessionManager sessionManager;

    public SessionRecoveryRunner(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void run(String... args) {
        List<ExecutionSession> waiting = sessionManager.listSessions(
                SessionQuery.builder().status(SessionStatus.WAITING_INPUT).build());
        List<ExecutionSession> interrupted = sessionManager.listSessions(
                SessionQuery.builder().status(SessionStatus.RUNNING).build());

        if (!waiting.isEmpty()) {
            System.out.println("Sessions waiting for input: " + waiting.size()
                    + " (use 'session <id>' to inspect, 'resume <id>' to continue)");
        }
        if (interrupted.isEmpty()) {
            return;
        }
        System.out.println("Sessions interrupted while running: " + interrupted.size());
        for (ExecutionSession session : interrupted) {
            if (!autoResume) {
                System.out.println("  " + session.getId() + " (plan '" + session.getPlanId() + "', step "
                        + session.getCurrentStepId() + ")");
                continue;
            }
            try {
                ExecutionSession recovered = sessionManager.executeSession(session.getId());
                System.out.println("  [RECOVER] " + session.getId() + " -> " + recovered.getStatus().getValue());
            } catch (RuntimeException e) {
                log.error("Could not recover session {}", session.getId(), e);
                System.err.println("  [RECOVER] FAILED: " + session.getId() + ". Error: " + e.getMessage());
            }
        }
    }
}
