package com.orchestrator.cli;

import com.orchestrator.cli.ui.Ansi;
import com.orchestrator.model.step.InputField;
import com.orchestrator.service.api.InputRequester;
import org.jline.reader.LineReader;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Prompts for user-input fields on the shell's console. An empty answer is returned as
 * {@code null}, which lets the field's default apply.
 */
@Component
public class ConsoleInputRequester implements InputRequester {

    private final LineReader lineReader;

    public ConsoleInputRequester(@Lazy LineReader lineReader) {
        this.lineReader = lineReader;
    }

    @Override
    public Object requestInput(String surfaceId, String componentId, InputField field) {
        String answer = lineReader.readLine(Ansi.color(Ansi.CYAN, prompt(field)));
        return answer == null || answer.isBlank() ? null : answer.trim();
    }

    private static String prompt(InputField field) {
        StringBuilder prompt = new StringBuilder("Please provide a value for '")
                .append(field.label() != null ? field.label() : field.id()).append("'");
        if (field.type() != null && !"text".equals(field.type())) {
            prompt.append(" [").append(field.type()).append("]");
        }
        if (field.defaultValue() != null) {
            prompt.append(" (default: ").append(field.defaultValue()).append(")");
        } else if (!field.required()) {
            prompt.append(" (optional)");
        }
        return prompt.append(": ").toString();
    }
}
