package com.orchestrator.cli;

import com.orchestrator.cli.ui.ResultFormatter;
import com.orchestrator.cli.ui.VerboseLogging;
import com.orchestrator.dto.response.CommandResponse;
import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.PendingInput;
import com.orchestrator.model.session.Platform;
import com.orchestrator.model.step.InputField;
import com.orchestrator.service.api.PlanLoader;
import com.orchestrator.service.api.SessionManager;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands that start and drive execution sessions: {@code execute}, {@code resume},
 * {@code retry} and {@code cancel}.
 * <p>
 * A session pauses at every user-input step. {@code resume} takes the values as
 * {@code --input field=value} pairs, or prompts for each pending field when none are given.
 */
@ShellComponent
public class ExecuteCommand {

    private final PlanLoader planLoader;
    private final SessionManager sessionManager;
    private final ConsoleInputRequester consoleInputRequester;
    private final ResultFormatter formatter;

    public ExecuteCommand(PlanLoader planLoader, SessionManager sessionManager,
                          ConsoleInputRequester consoleInputRequester, ResultFormatter formatter) {
        this.planLoader = planLoader;
        this.sessionManager = sessionManager;
        this.consoleInputRequester = consoleInputRequester;
        this.formatter = formatter;
    }

    @ShellMethod(key = "execute", value = "Creates a session for a plan file and runs it until it completes or needs input.")
    public String execute(
            @ShellOption(value = {"--plan", "-p"}, help = "Path to the plan JSON file.") String planFile,
            @ShellOption(value = "--platform", help = "Platform recorded on the session (cli or web).", defaultValue = "cli") String platform,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return VerboseLogging.around(verbose, () -> {
            try {
                ExecutionPlan plan = planLoader.load(Path.of(planFile));
                ExecutionSession session = sessionManager.createSession(plan, Platform.fromValue(platform));
                return formatter.formatSession(sessionManager.executeSession(session.getId()));
            } catch (OrchestratorException | IllegalArgumentException e) {
                return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
            }
        });
    }

    @ShellMethod(key = "resume", value = "Supplies the input a waiting session needs and continues it.")
    public String resume(
            @ShellOption(help = "The session id.") String sessionId,
            @ShellOption(value = {"--input", "-i"}, arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL,
                    help = "Values as field=value pairs; prompts for each field when omitted.") String[] input,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return VerboseLogging.around(verbose, () -> {
            try {
                Map<String, Object> values = input == null || input.length == 0
                        ? promptForPendingInput(sessionId)
                        : parseInput(input);
                return formatter.formatSession(sessionManager.resumeSession(sessionId, values));
            } catch (OrchestratorException | IllegalArgumentException e) {
                return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
            }
        });
    }

    @ShellMethod(key = "retry", value = "Retries a failed session as a new session and runs it.")
    public String retry(
            @ShellOption(help = "The failed session id.") String sessionId,
            @ShellOption(value = "--from-step", defaultValue = ShellOption.NULL,
                    help = "Keep successful results of steps before this one.") Integer fromStepId
    ) {
        try {
            ExecutionSession retry = sessionManager.retrySession(sessionId, fromStepId);
            return formatter.formatSession(sessionManager.executeSession(retry.getId()));
        } catch (OrchestratorException e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "cancel", value = "Cancels a session that has not finished.")
    public String cancel(@ShellOption(help = "The session id.") String sessionId) {
        try {
            sessionManager.cancelSession(sessionId);
            return CommandResponse.ok("Session " + sessionId + " cancelled.").toAnsiString();
        } catch (OrchestratorException e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    private Map<String, Object> promptForPendingInput(String sessionId) {
        PendingInput pending = sessionManager.getSession(sessionId).getPendingInput();
        Map<String, Object> values = new LinkedHashMap<>();
        if (pending == null) {
            return values;
        }
        for (InputField field : pending.schema().fields()) {
            Object value = consoleInputRequester.requestInput(pending.surfaceId(), "field-" + field.id(), field);
            if (value != null) {
                values.put(field.id(), value);
            }
        }
        return values;
    }

    static Map<String, Object> parseInput(String[] pairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String pair : pairs) {
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Expected field=value but got '" + pair + "'");
            }
            values.put(pair.substring(0, separator).trim(), pair.substring(separator + 1));
        }
        return values;
    }
}
