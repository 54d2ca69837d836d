package com.orchestrator.execution;

import com.orchestrator.model.result.StepResult;
import com.orchestrator.service.api.InputRequester;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Per-run settings for a {@link com.orchestrator.service.api.StepExecutor}.
 *
 * @param previousResults Results from earlier runs of the same plan. Steps with a successful
 *                        previous result are not executed again and their values are reachable
 *                        through references.
 * @param variables       Initial variables, e.g. a session's context.
 * @param inputRequester  Overrides the executor's default input requester when set.
 * @param stepListener    Notified after every recorded step.
 */
@Builder
public record ExecutionOptions(List<StepResult> previousResults, Map<String, Object> variables,
                               InputRequester inputRequester, StepListener stepListener) {

    public ExecutionOptions {
        previousResults = previousResults == null ? List.of() : List.copyOf(previousResults);
        variables = variables == null ? Map.of() : variables;
        stepListener = stepListener == null ? StepListener.NONE : stepListener;
    }

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
