package com.orchestrator.config;

import com.orchestrator.service.api.ConditionEvaluator;
import com.orchestrator.service.api.FunctionDispatcher;
import com.orchestrator.service.api.InputRequester;
import com.orchestrator.service.api.StepExecutor;
import com.orchestrator.service.api.StepTimeoutPolicy;
import com.orchestrator.service.impl.ConditionalStepExecutor;
import com.orchestrator.service.impl.InputValueConverter;
import com.orchestrator.service.impl.StepExecutorImpl;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two step executors and the worker pool their function calls run on.
 * <p>
 * Both executors default to {@link InputRequester#deferred()}; callers that can prompt pass their
 * own requester per run.
 */
@Configuration
public class ExecutorConfiguration {

    /**
     * Daemon threads, so that a function call abandoned after a timeout never keeps the JVM alive.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stepDispatchPool() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "step-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public StepExecutor stepExecutor(FunctionDispatcher dispatcher, StepTimeoutPolicy timeoutPolicy,
                                     InputValueConverter inputValueConverter, ExecutorService stepDispatchPool) {
        return new StepExecutorImpl(dispatcher, InputRequester.deferred(), timeoutPolicy, inputValueConverter,
                stepDispatchPool);
    }

    @Bean
    public StepExecutor conditionalStepExecutor(FunctionDispatcher dispatcher, StepTimeoutPolicy timeoutPolicy,
                                                InputValueConverter inputValueConverter,
                                                ExecutorService stepDispatchPool,
                                                ConditionEvaluator conditionEvaluator) {
        return new ConditionalStepExecutor(dispatcher, InputRequester.deferred(), timeoutPolicy, inputValueConverter,
                stepDispatchPool, conditionEvaluator);
    }
}
