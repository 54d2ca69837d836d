package com.orchestrator.service.impl;

import com.orchestrator.model.DispatchResult;
import com.orchestrator.service.api.FunctionDispatcher;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * An in-process {@link FunctionDispatcher}. Functions are registered by name and receive the
 * resolved parameter map.
 * <p>
 * The registry starts with a handful of arithmetic built-ins ({@code add}, {@code subtract},
 * {@code multiply}, {@code divide}) taking parameters {@code a} and {@code b}, plus {@code echo},
 * which returns its parameters unchanged.
 */
@Component
@Slf4j
public class LocalFunctionRegistry implements FunctionDispatcher {

    private final Map<String, Function<Map<String, Object>, Object>> functions = new ConcurrentHashMap<>();

    public LocalFunctionRegistry() {
        register("add", params -> number(params, "a").add(number(params, "b")));
        register("subtract", params -> number(params, "a").subtract(number(params, "b")));
        register("multiply", params -> number(params, "a").multiply(number(params, "b")));
        register("divide", params -> {
            BigDecimal divisor = number(params, "b");
            if (divisor.signum() == 0) {
                throw new IllegalArgumentException("Division by zero");
            }
            return number(params, "a").divide(divisor, MathContext.DECIMAL64);
        });
        register("echo", params -> params);
    }

    public void register(String name, Function<Map<String, Object>, Object> function) {
        functions.put(name, function);
        log.debug("Registered local function '{}'", name);
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }

    @Override
    public boolean has(String functionName) {
        return functions.containsKey(functionName);
    }

    @Override
    public DispatchResult execute(String functionName, Map<String, Object> parameters) {
        Function<Map<String, Object>, Object> function = functions.get(functionName);
        if (function == null) {
            return DispatchResult.error("Function not found: " + functionName);
        }
        try {
            return DispatchResult.ok(simplify(function.apply(parameters)));
        } catch (RuntimeException e) {
            log.debug("Local function '{}' failed: {}", functionName, e.getMessage());
            return DispatchResult.error(e.getMessage());
        }
    }

    private static BigDecimal number(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing numeric parameter '" + name + "'");
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not a number: " + value);
        }
    }

    // Whole numbers come back as Long, everything else as Double, matching what Jackson reads from JSON.
    private static Object simplify(Object value) {
        if (value instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                try {
                    return stripped.longValueExact();
                } catch (ArithmeticException e) {
                    return decimal.doubleValue();
                }
            }
            return decimal.doubleValue();
        }
        return value;
    }
}
