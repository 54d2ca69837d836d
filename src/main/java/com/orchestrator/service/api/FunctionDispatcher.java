package com.orchestrator.service.api;

import com.orchestrator.model.DispatchResult;
import java.util.Map;

/**
 * Invokes named functions on behalf of function-call steps. Implementations may be local or
 * remote; the executor only relies on this contract.
 */
public interface FunctionDispatcher {

    boolean has(String functionName);

    /**
     * Calls a function with already resolved arguments.
     *
     * @return The outcome. Implementations report expected failures through
     *         {@link DispatchResult#error(String)}; any exception thrown is treated as a failure too.
     */
    DispatchResult execute(String functionName, Map<String, Object> parameters);
}
