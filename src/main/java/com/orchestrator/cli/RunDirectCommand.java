package com.orchestrator.cli;

import com.orchestrator.cli.ui.ResultFormatter;
import com.orchestrator.cli.ui.VerboseLogging;
import com.orchestrator.dto.response.CommandResponse;
import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.execution.ExecutionOptions;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.service.api.PlanLoader;
import com.orchestrator.service.impl.StepExecutorSelector;
import java.nio.file.Path;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Runs a plan without a session, prompting on the console for user input as it goes.
 * Nothing is persisted.
 */
@ShellComponent
public class RunDirectCommand {

    private final PlanLoader planLoader;
    private final StepExecutorSelector executorSelector;
    private final ConsoleInputRequester consoleInputRequester;
    private final ResultFormatter formatter;

    public RunDirectCommand(PlanLoader planLoader, StepExecutorSelector executorSelector,
                            ConsoleInputRequester consoleInputRequester, ResultFormatter formatter) {
        this.planLoader = planLoader;
        this.executorSelector = executorSelector;
        this.consoleInputRequester = consoleInputRequester;
        this.formatter = formatter;
    }

    @ShellMethod(key = "run-direct", value = "Runs a plan file interactively without creating a session.")
    public String runDirect(
            @ShellOption(value = {"--plan", "-p"}, help = "Path to the plan JSON file.") String planFile,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return VerboseLogging.around(verbose, () -> {
            try {
                ExecutionPlan plan = planLoader.load(Path.of(planFile));
                ExecutionResult result = executorSelector.select(plan).execute(plan, ExecutionOptions.builder()
                        .inputRequester(consoleInputRequester)
                        .build());
                return formatter.formatExecutionResult(result);
            } catch (OrchestratorException e) {
                return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
            }
        });
    }
}
