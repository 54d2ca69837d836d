package com.orchestrator.cli;

import com.orchestrator.cli.ui.ResultFormatter;
import com.orchestrator.dto.response.CommandResponse;
import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.model.session.Platform;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.model.session.SessionStatus;
import com.orchestrator.service.api.SessionManager;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for inspecting stored sessions.
 */
@ShellComponent
public class SessionsCommand {

    private final SessionManager sessionManager;
    private final ResultFormatter formatter;

    public SessionsCommand(SessionManager sessionManager, ResultFormatter formatter) {
        this.sessionManager = sessionManager;
        this.formatter = formatter;
    }

    @ShellMethod(key = "sessions", value = "Lists sessions, newest first.")
    public String sessions(
            @ShellOption(value = "--plan", defaultValue = ShellOption.NULL, help = "Only sessions of this plan id.") String planId,
            @ShellOption(value = "--base-plan", defaultValue = ShellOption.NULL, help = "Only sessions of any version of this plan.") String basePlanId,
            @ShellOption(value = "--status", defaultValue = ShellOption.NULL, help = "Only sessions in this status.") String status,
            @ShellOption(value = "--platform", defaultValue = ShellOption.NULL, help = "Only sessions from this platform.") String platform,
            @ShellOption(value = "--offset", defaultValue = "0") int offset,
            @ShellOption(value = "--limit", defaultValue = "20") int limit
    ) {
        try {
            SessionQuery query = SessionQuery.builder()
                    .planId(planId)
                    .basePlanId(basePlanId)
                    .status(status != null ? SessionStatus.fromValue(status) : null)
                    .platform(platform != null ? Platform.fromValue(platform) : null)
                    .offset(offset)
                    .limit(limit)
                    .build();
            return formatter.formatSessionTable(sessionManager.listSessions(query));
        } catch (IllegalArgumentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "session", value = "Shows a session with its step results.")
    public String session(@ShellOption(help = "The session id.") String sessionId) {
        try {
            return formatter.formatSession(sessionManager.getSession(sessionId));
        } catch (OrchestratorException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "stats", value = "Shows execution statistics of a plan (any version when given a base id).")
    public String stats(@ShellOption(help = "The plan id or base plan id.") String planId) {
        return formatter.formatStats(planId, sessionManager.getExecutionStats(planId));
    }

    @ShellMethod(key = "session-delete", value = "Deletes a stored session.")
    public String delete(@ShellOption(help = "The session id.") String sessionId) {
        if (sessionManager.deleteSession(sessionId)) {
            return CommandResponse.ok("Session " + sessionId + " deleted.").toAnsiString();
        }
        return CommandResponse.error("Session not found: " + sessionId).toAnsiString();
    }
}
