package com.orchestrator.service.impl;

import com.orchestrator.model.DispatchResult;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocalFunctionRegistryTest {

    private final LocalFunctionRegistry registry = new LocalFunctionRegistry();

    @Test
    void builtInArithmetic() {
        assertThat(registry.execute("add", Map.of("a", 2, "b", 3)).result()).isEqualTo(5L);
        assertThat(registry.execute("subtract", Map.of("a", "10", "b", 2.5)).result()).isEqualTo(7.5);
        assertThat(registry.execute("multiply", Map.of("a", 2000, "b", 1.08)).result()).isEqualTo(2160L);
        assertThat(registry.execute("divide", Map.of("a", 1, "b", 4)).result()).isEqualTo(0.25);
    }

    @Test
    void failuresAreReportedAsErrors() {
        DispatchResult divideByZero = registry.execute("divide", Map.of("a", 1, "b", 0));
        DispatchResult notANumber = registry.execute("add", Map.of("a", "one", "b", 1));
        DispatchResult missing = registry.execute("add", Map.of("a", 1));

        assertThat(divideByZero.success()).isFalse();
        assertThat(divideByZero.error()).isEqualTo("Division by zero");
        assertThat(notANumber.error()).isEqualTo("Parameter 'a' is not a number: one");
        assertThat(missing.error()).isEqualTo("Missing numeric parameter 'b'");
    }

    @Test
    void unknownFunction() {
        assertThat(registry.has("teleport")).isFalse();
        assertThat(registry.execute("teleport", Map.of()).error()).isEqualTo("Function not found: teleport");
    }

    @Test
    void registeredFunctionsAreDispatched() {
        registry.register("greet", params -> "Hello, " + params.get("name"));

        assertThat(registry.has("greet")).isTrue();
        assertThat(registry.names()).contains("greet", "add", "echo");
        assertThat(registry.execute("greet", Map.of("name", "Ada")).result()).isEqualTo("Hello, Ada");
        assertThat(registry.execute("echo", Map.of("x", 1)).result()).isEqualTo(Map.of("x", 1));
    }
}
