package com.orchestrator.service.impl;

import com.orchestrator.exception.ConditionEvaluationException;
import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.execution.ConditionContext;
import com.orchestrator.service.api.ConditionEvaluator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Evaluates conditions written in the Spring Expression Language.
 * <p>
 * Before parsing, every {@code step.<id>.<path>} reference in the expression is resolved through
 * the run's {@link com.orchestrator.execution.ParameterResolver} and replaced by a variable, so
 * {@code step.3.result.warranty == true} works as written. Run variables are available both as
 * {@code #name} and as bare identifiers. {@code ===} and {@code !==} are accepted as aliases of
 * {@code ==} and {@code !=}.
 * <p>
 * Evaluation happens in a read-only {@link SimpleEvaluationContext}: no type references, no
 * constructors, no bean references and no assignment.
 */
@Component
@Slf4j
public class SpelConditionEvaluator implements ConditionEvaluator {

    private static final Pattern STEP_REFERENCE = Pattern.compile("\\bstep\\.(\\d+)((?:\\.[A-Za-z0-9_]+)+)");
    private static final String REFERENCE_VARIABLE = "__ref";

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public boolean evaluate(String condition, ConditionContext context) {
        Map<String, Object> references = new LinkedHashMap<>();
        String rewritten;
        try {
            rewritten = rewrite(condition, context, references);
        } catch (OrchestratorException e) {
            throw new ConditionEvaluationException(condition, e.getMessage(), e);
        }

        SimpleEvaluationContext evaluationContext = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withRootObject(context.variables())
                .build();
        context.variables().forEach(evaluationContext::setVariable);
        references.forEach(evaluationContext::setVariable);

        Object value;
        try {
            Expression expression = parser.parseExpression(rewritten);
            value = expression.getValue(evaluationContext);
        } catch (ParseException | EvaluationException e) {
            throw new ConditionEvaluationException(condition, e.getMessage(), e);
        }
        log.debug("Condition '{}' (as '{}') evaluated to {}", condition, rewritten, value);
        if (!(value instanceof Boolean result)) {
            throw new ConditionEvaluationException(condition,
                    "expression did not evaluate to a boolean but to " + value, null);
        }
        return result;
    }

    @Override
    public boolean supports(String condition) {
        if (condition == null || condition.isBlank()) {
            return false;
        }
        try {
            parser.parseExpression(normalizeOperators(STEP_REFERENCE.matcher(condition).replaceAll("#" + REFERENCE_VARIABLE)));
            return true;
        } catch (ParseException e) {
            log.debug("Unsupported condition '{}': {}", condition, e.getMessage());
            return false;
        }
    }

    private String rewrite(String condition, ConditionContext context, Map<String, Object> references) {
        Matcher matcher = STEP_REFERENCE.matcher(condition);
        StringBuilder rewritten = new StringBuilder();
        while (matcher.find()) {
            String name = REFERENCE_VARIABLE + references.size();
            references.put(name, context.resolver().resolveReference(matcher.group()));
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement("#" + name));
        }
        matcher.appendTail(rewritten);
        return normalizeOperators(rewritten.toString());
    }

    private static String normalizeOperators(String expression) {
        return expression.replace("===", "==").replace("!==", "!=");
    }
}
