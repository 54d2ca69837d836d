package com.orchestrator.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.service.api.PlanLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads execution plans from JSON files and validates them with the executor that will run them.
 */
@Service
@Slf4j
public class JsonPlanLoader implements PlanLoader {

    private final ObjectMapper objectMapper;
    private final StepExecutorSelector executorSelector;

    public JsonPlanLoader(ObjectMapper objectMapper, StepExecutorSelector executorSelector) {
        this.objectMapper = objectMapper;
        this.executorSelector = executorSelector;
    }

    @Override
    public ExecutionPlan load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new PlanValidationException("Plan file not found: " + file);
        }
        ExecutionPlan plan;
        try {
            plan = objectMapper.readValue(file.toFile(), ExecutionPlan.class);
        } catch (IOException e) {
            throw new PlanValidationException("Could not parse plan file " + file + ": " + e.getMessage(), e);
        }
        executorSelector.select(plan).validate(plan);
        log.info("Loaded plan '{}' with {} steps from {}", plan.getId(), plan.getSteps().size(), file);
        return plan;
    }
}
