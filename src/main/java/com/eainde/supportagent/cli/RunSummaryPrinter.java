package com.eainde.supportagent.cli;

import com.eainde.supportagent.state.SupportField;
import com.eainde.supportagent.workflow.SupportRunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders a finished run as plain text for the console.
 */
@Component
public class RunSummaryPrinter {

    static final List<SupportField> DISPLAY_FIELDS = List.of(
            SupportField.CUSTOMER_NAME,
            SupportField.EMAIL,
            SupportField.PRIORITY,
            SupportField.TICKET_ID,
            SupportField.INTENT,
            SupportField.SENTIMENT,
            SupportField.ENTITIES,
            SupportField.NORMALIZED,
            SupportField.ENRICHED,
            SupportField.FLAGS,
            SupportField.CUSTOMER_HISTORY,
            SupportField.SOLUTION_SCORE,
            SupportField.ESCALATED,
            SupportField.TICKET_UPDATES,
            SupportField.CLOSED,
            SupportField.DRAFT_RESPONSE,
            SupportField.AI_RESPONSE,
            SupportField.API_ACTIONS,
            SupportField.NOTIFICATIONS
    );

    private static final String RULE = "=".repeat(60);

    private final ObjectMapper prettyMapper;

    public RunSummaryPrinter(ObjectMapper objectMapper) {
        this.prettyMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(SupportRunResult result) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
                .append("Final Structured Payload").append('\n')
                .append(RULE).append('\n');

        Map<String, Object> state = result.state();
        for (SupportField field : DISPLAY_FIELDS) {
            Object value = state.get(field.key());
            if (isEmpty(value)) {
                continue;
            }
            out.append(String.format("%-18s: %s%n", field.key(), format(value)));
        }

        out.append('\n')
                .append(RULE).append('\n')
                .append("Execution Logs").append('\n')
                .append(RULE).append('\n');
        result.logs().forEach(line -> out.append("- ").append(line).append('\n'));
        return out.toString();
    }

    private String format(Object value) {
        if (value instanceof Map || value instanceof Collection) {
            try {
                return prettyMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }
}
