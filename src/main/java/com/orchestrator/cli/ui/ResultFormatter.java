package com.orchestrator.cli.ui;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orchestrator.model.result.ConditionResult;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.result.UserInputResult;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.PendingInput;
import com.orchestrator.model.step.InputField;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders sessions, step results and values for the console.
 */
@Component
public class ResultFormatter {

    private final ObjectMapper objectMapper;

    public ResultFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A session summary: status, step results and, depending on the state, the pending fields
     * or the final result.
     */
    public String formatSession(ExecutionSession session) {
        StringBuilder sb = new StringBuilder();
        sb.append(Ansi.color(Ansi.CYAN, "Session " + session.getId()))
                .append(" (plan '").append(session.getPlanId()).append("')\n");
        sb.append("  Status: ").append(formatStatus(session)).append("\n");
        sb.append("  Current step: ").append(session.getCurrentStepId()).append("\n");
        if (session.getParentSessionId() != null) {
            sb.append("  Retry #").append(session.getRetryCount()).append(" of ")
                    .append(session.getParentSessionId()).append("\n");
        }
        for (StepResult result : session.getStepResults()) {
            sb.append("  ").append(formatStepResult(result)).append("\n");
        }

        PendingInput pending = session.getPendingInput();
        if (pending != null) {
            sb.append(Ansi.color(Ansi.YELLOW, "  Waiting for input at step " + pending.stepId() + ":")).append("\n");
            for (InputField field : pending.schema().fields()) {
                sb.append("    --input ").append(field.id()).append("=<").append(field.type()).append(">")
                        .append(field.required() ? " (required)" : "")
                        .append(field.label() != null ? "  " + field.label() : "")
                        .append("\n");
            }
        }
        ExecutionResult result = session.getResult();
        if (result != null) {
            if (result.success()) {
                sb.append("  Final result:\n").append(formatValue(result.finalResult()));
            } else {
                sb.append(Ansi.color(Ansi.RED, "  Error: " + result.error()));
            }
        }
        return sb.toString().stripTrailing();
    }

    public String formatSessionTable(List<ExecutionSession> sessions) {
        if (sessions.isEmpty()) {
            return "No sessions found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-18s %-24s %-14s %-6s %s%n", "ID", "PLAN", "STATUS", "STEP", "CREATED"));
        for (ExecutionSession session : sessions) {
            sb.append(String.format("%-18s %-24s %-14s %-6d %s%n", session.getId(), session.getPlanId(),
                    session.getStatus().getValue(), session.getCurrentStepId(), session.getCreatedAt()));
        }
        return sb.toString().stripTrailing();
    }

    public String formatStats(String planId, ExecutionStats stats) {
        return "Executions of '" + planId + "': " + stats.totalExecutions()
                + "\n  Succeeded: " + Ansi.color(Ansi.GREEN, String.valueOf(stats.successCount()))
                + "\n  Failed: " + Ansi.color(Ansi.RED, String.valueOf(stats.failureCount()))
                + "\n  Average duration: " + stats.averageDuration() + "ms";
    }

    public String formatExecutionResult(ExecutionResult result) {
        StringBuilder sb = new StringBuilder();
        for (StepResult stepResult : result.stepResults()) {
            sb.append("  ").append(formatStepResult(stepResult)).append("\n");
        }
        if (result.isWaitingForInput()) {
            sb.append(Ansi.color(Ansi.YELLOW, "Stopped: step " + result.pendingInput().stepId() + " needs input"));
        } else if (result.success()) {
            sb.append("Final result:\n").append(formatValue(result.finalResult()));
        } else {
            sb.append(Ansi.color(Ansi.RED, "Execution failed: " + result.error()));
        }
        return sb.toString();
    }

    public String formatStepResult(StepResult result) {
        String marker = result.success() ? Ansi.color(Ansi.GREEN, "[ok]") : Ansi.color(Ansi.RED, "[failed]");
        String detail;
        if (result instanceof FunctionCallResult functionCall) {
            detail = functionCall.functionName() + " -> " + (result.success() ? compact(functionCall.result()) : result.error());
        } else if (result instanceof UserInputResult userInput) {
            detail = "input " + (result.success() ? compact(userInput.values()) : result.error());
        } else {
            ConditionResult condition = (ConditionResult) result;
            detail = result.success()
                    ? "condition '" + condition.condition() + "' = " + condition.evaluatedResult()
                        + (condition.skippedSteps().isEmpty() ? "" : ", skipped " + condition.skippedSteps())
                    : "condition '" + condition.condition() + "': " + result.error();
        }
        return marker + " Step " + result.stepId() + ": " + detail;
    }

    private String formatStatus(ExecutionSession session) {
        String value = session.getStatus().getValue();
        return switch (session.getStatus()) {
            case COMPLETED -> Ansi.color(Ansi.GREEN, value);
            case FAILED -> Ansi.color(Ansi.RED, value);
            case WAITING_INPUT -> Ansi.color(Ansi.YELLOW, value);
            default -> Ansi.color(Ansi.BLUE, value);
        };
    }

    private String compact(Object value) {
        JsonNode node = objectMapper.valueToTree(value);
        return node == null ? "null" : node.toString();
    }

    /**
     * Pretty-prints a value as colorized JSON.
     */
    public String formatValue(Object value) {
        JsonNode node = objectMapper.valueToTree(value);
        if (node == null || node.isNull()) {
            return Ansi.color(Ansi.PURPLE, "null");
        }
        StringBuilder sb = new StringBuilder();
        buildColoredJsonString(node, sb, 0);
        return sb.toString();
    }

    private void buildColoredJsonString(JsonNode node, StringBuilder sb, int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        if (node.isObject()) {
            sb.append(Ansi.color(Ansi.WHITE, "{")).append("\n");
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sb.append(indent).append("  ").append(Ansi.color(Ansi.CYAN, "\"" + field.getKey() + "\"")).append(": ");
                buildColoredJsonString(field.getValue(), sb, indentLevel + 1);
                if (fields.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(Ansi.color(Ansi.WHITE, "}"));
        } else if (node.isArray()) {
            sb.append(Ansi.color(Ansi.WHITE, "[")).append("\n");
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                sb.append(indent).append("  ");
                buildColoredJsonString(elements.next(), sb, indentLevel + 1);
                if (elements.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(Ansi.color(Ansi.WHITE, "]"));
        } else if (node.isTextual()) {
            sb.append(Ansi.color(Ansi.GREEN, "\"" + node.asText() + "\""));
        } else if (node.isNumber()) {
            sb.append(Ansi.color(Ansi.YELLOW, node.asText()));
        } else if (node.isBoolean()) {
            sb.append(Ansi.color(Ansi.PURPLE, String.valueOf(node.asBoolean())));
        } else if (node.isNull()) {
            sb.append(Ansi.color(Ansi.RED, "null"));
        } else {
            sb.append(node.asText());
        }
    }
}
