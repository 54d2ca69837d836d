package com.orchestrator.service.api;

import com.orchestrator.model.ExecutionPlan;
import java.nio.file.Path;

public interface PlanLoader {

    /**
     * Reads and validates a plan from a JSON file.
     *
     * @throws com.orchestrator.exception.PlanValidationException if the file cannot be read or parsed.
     */
    ExecutionPlan load(Path file);
}
