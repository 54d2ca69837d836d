package com.orchestrator.service.api;

import com.orchestrator.model.step.PlanStep;
import java.time.Duration;

/**
 * Decides how long a step may run. {@link Duration#ZERO} means no limit.
 */
public interface StepTimeoutPolicy {

    Duration timeoutFor(PlanStep step);
}
