package com.orchestrator.service.impl;

import com.orchestrator.model.step.FunctionCallStep;
import com.orchestrator.model.step.PlanStep;
import com.orchestrator.service.api.StepTimeoutPolicy;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Timeouts from configuration: one default for function calls and optional per-function
 * overrides. User-input and condition steps are never limited.
 */
@Component
@Slf4j
public class ConfiguredStepTimeoutPolicy implements StepTimeoutPolicy {

    private final Duration defaultTimeout;
    private final Map<String, Long> functionTimeouts;

    public ConfiguredStepTimeoutPolicy(
            @Value("${orchestrator.executor.step-timeout-ms:30000}") long defaultTimeoutMs,
            @Value("#{${orchestrator.executor.function-timeouts:{:}}}") Map<String, Long> functionTimeouts) {
        this.defaultTimeout = Duration.ofMillis(Math.max(0, defaultTimeoutMs));
        this.functionTimeouts = functionTimeouts == null ? Map.of() : Map.copyOf(functionTimeouts);
        log.debug("Step timeout {}ms, overrides {}", defaultTimeoutMs, this.functionTimeouts);
    }

    public static ConfiguredStepTimeoutPolicy fixed(Duration timeout) {
        return new ConfiguredStepTimeoutPolicy(timeout.toMillis(), Map.of());
    }

    @Override
    public Duration timeoutFor(PlanStep step) {
        if (!(step instanceof FunctionCallStep functionCall)) {
            return Duration.ZERO;
        }
        Long override = functionTimeouts.get(functionCall.functionName());
        return override != null ? Duration.ofMillis(Math.max(0, override)) : defaultTimeout;
    }
}
