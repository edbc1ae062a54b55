package com.eainde.supportagent.cli;

import com.eainde.supportagent.workflow.SupportRunResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunSummaryPrinterTest {

    private final RunSummaryPrinter printer = new RunSummaryPrinter(new ObjectMapper());

    private static SupportRunResult result(Map<String, Object> state, List<String> logs) {
        return new SupportRunResult("run-1", List.of("INTAKE"), state, state, logs);
    }

    @Test
    @DisplayName("prints the payload section before the execution log")
    void sections() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("customer_name", "Aisha Jain");
        state.put("solution_score", 95);

        String text = printer.render(result(state, List.of("INTAKE complete.", "COMPLETE done.")));

        assertThat(text.indexOf("Final Structured Payload")).isLessThan(text.indexOf("Execution Logs"));
        assertThat(text).contains("customer_name").contains("Aisha Jain");
        assertThat(text).contains("- INTAKE complete.").contains("- COMPLETE done.");
    }

    @Test
    @DisplayName("skips empty and non-display fields")
    void skipsEmpty() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("intent", "");
        state.put("api_actions", List.of());
        state.put("parsed", Map.of("intent", "issue_report"));
        state.put("route", "CREATE");

        String text = printer.render(result(state, List.of()));

        assertThat(text).doesNotContain("intent").doesNotContain("api_actions")
                .doesNotContain("parsed").doesNotContain("route");
    }

    @Test
    @DisplayName("renders maps and lists as indented JSON")
    void prettyJson() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("notifications", List.of("Email sent to customer"));
        state.put("escalated", false);

        String text = printer.render(result(state, List.of()));

        assertThat(text).contains("\"Email sent to customer\"");
        assertThat(text).contains("escalated").contains("false");
    }

    @Test
    @DisplayName("display fields follow the documented order")
    void order() {
        assertThat(RunSummaryPrinter.DISPLAY_FIELDS).first().extracting(f -> f.key()).isEqualTo("customer_name");
        assertThat(RunSummaryPrinter.DISPLAY_FIELDS).last().extracting(f -> f.key()).isEqualTo("notifications");
        assertThat(RunSummaryPrinter.DISPLAY_FIELDS).hasSize(19);
    }
}
