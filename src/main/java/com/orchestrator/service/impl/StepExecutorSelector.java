package com.orchestrator.service.impl;

import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.service.api.StepExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Picks the executor for a plan: plans containing a condition step need the conditional one,
 * all others run on the plain executor.
 */
@Component
@Slf4j
public class StepExecutorSelector {

    private final StepExecutor stepExecutor;
    private final StepExecutor conditionalStepExecutor;

    public StepExecutorSelector(@Qualifier("stepExecutor") StepExecutor stepExecutor,
                                @Qualifier("conditionalStepExecutor") StepExecutor conditionalStepExecutor) {
        this.stepExecutor = stepExecutor;
        this.conditionalStepExecutor = conditionalStepExecutor;
    }

    public StepExecutor select(ExecutionPlan plan) {
        if (plan.hasConditionSteps()) {
            log.debug("Plan '{}' contains condition steps, using the conditional executor", plan.getId());
            return conditionalStepExecutor;
        }
        return stepExecutor;
    }
}
