package com.orchestrator.execution;

import com.orchestrator.exception.ParameterResolutionException;
import com.orchestrator.exception.StepResultNotFoundException;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.result.UserInputResult;
import com.orchestrator.model.step.ParameterValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the results recorded during one execution run and resolves parameter values against them.
 * <p>
 * A reference has the form {@code step.<stepId>.<path>}:
 * <ul>
 *   <li>{@code step.3.result} yields the whole value recorded for step 3;</li>
 *   <li>{@code step.3.result.a.b} walks {@code a.b} inside that value;</li>
 *   <li>{@code step.3.a.0} walks {@code a.0} directly, which is how user-input fields are addressed.</li>
 * </ul>
 * Path segments are map keys or, for lists, zero-based indices.
 * <p>
 * A resolver is scoped to a single run and is never shared between sessions. A resumed run builds
 * its resolver with {@link #fromStepResults(List)} so that every earlier result is reachable again.
 */
@Slf4j
public class ParameterResolver {

    public static final String REFERENCE_FORMAT =
            "step.{stepId}.result, step.{stepId}.result.{path} or step.{stepId}.{path}";

    private static final Pattern REFERENCE = Pattern.compile("^step\\.([1-9]\\d*)\\.(.+)$");
    private static final String RESULT_SEGMENT = "result";

    // HashMap, because a recorded null is still a recorded result.
    private final Map<Integer, Object> results = new HashMap<>();

    /**
     * Builds a resolver holding the outputs of every successful function-call and user-input result.
     */
    public static ParameterResolver fromStepResults(List<? extends StepResult> stepResults) {
        ParameterResolver resolver = new ParameterResolver();
        if (stepResults != null) {
            stepResults.forEach(resolver::record);
        }
        return resolver;
    }

    /**
     * Feeds a step result into the resolver. Failed results and condition results carry no value
     * and are ignored.
     */
    public void record(StepResult stepResult) {
        if (!stepResult.success()) {
            return;
        }
        if (stepResult instanceof FunctionCallResult functionCall) {
            setResult(functionCall.stepId(), functionCall.result());
        } else if (stepResult instanceof UserInputResult userInput) {
            setResult(userInput.stepId(), userInput.values());
        }
    }

    public void setResult(int stepId, Object value) {
        results.put(stepId, value);
    }

    public Optional<StepValue> getResult(int stepId) {
        if (!results.containsKey(stepId)) {
            return Optional.empty();
        }
        return Optional.of(new StepValue(results.get(stepId)));
    }

    public boolean hasResult(int stepId) {
        return results.containsKey(stepId);
    }

    public List<Integer> availableStepIds() {
        List<Integer> ids = new ArrayList<>(results.keySet());
        ids.sort(Integer::compareTo);
        return ids;
    }

    public void reset() {
        results.clear();
    }

    public Object resolve(ParameterValue parameter) {
        if (parameter instanceof ParameterValue.Literal literal) {
            return literal.value();
        }
        if (parameter instanceof ParameterValue.Reference reference) {
            return resolveReference(reference.value());
        }
        if (parameter instanceof ParameterValue.Composite composite) {
            return resolveAll(composite.value());
        }
        throw new IllegalArgumentException("Unsupported parameter value: " + parameter);
    }

    /**
     * Resolves every entry of the map. The first failure propagates; no partially resolved map
     * is ever returned.
     */
    public Map<String, Object> resolveAll(Map<String, ParameterValue> parameters) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (parameters == null) {
            return resolved;
        }
        for (Map.Entry<String, ParameterValue> entry : parameters.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue()));
        }
        return resolved;
    }

    public Object resolveReference(String reference) {
        if (reference == null) {
            throw ParameterResolutionException.invalidFormat("null", REFERENCE_FORMAT);
        }
        Matcher matcher = REFERENCE.matcher(reference);
        if (!matcher.matches()) {
            throw ParameterResolutionException.invalidFormat(reference, REFERENCE_FORMAT);
        }
        int stepId = Integer.parseInt(matcher.group(1));
        String path = matcher.group(2);
        if (!results.containsKey(stepId)) {
            throw new StepResultNotFoundException(stepId, availableStepIds());
        }

        Object value = results.get(stepId);
        if (path.equals(RESULT_SEGMENT)) {
            return value;
        }
        if (path.startsWith(RESULT_SEGMENT + ".")) {
            path = path.substring(RESULT_SEGMENT.length() + 1);
        }
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw ParameterResolutionException.invalidFormat(reference, REFERENCE_FORMAT);
            }
        }

        Object current = value;
        for (String segment : segments) {
            current = step(reference, stepId, current, segment);
        }
        log.debug("Resolved reference '{}' to {}", reference, current);
        return current;
    }

    private Object step(String reference, int stepId, Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            if (!map.containsKey(segment)) {
                throw ParameterResolutionException.fieldNotFound(reference, segment, stepId);
            }
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            int index;
            try {
                index = Integer.parseInt(segment);
            } catch (NumberFormatException e) {
                throw ParameterResolutionException.fieldNotFound(reference, segment, stepId);
            }
            if (index < 0 || index >= list.size()) {
                throw ParameterResolutionException.fieldNotFound(reference, segment, stepId);
            }
            return list.get(index);
        }
        throw ParameterResolutionException.cannotAccessField(reference, segment, current);
    }

    /**
     * A recorded step value. Wrapping it lets a recorded {@code null} be told apart from a
     * missing result.
     */
    public record StepValue(Object value) {
    }
}
