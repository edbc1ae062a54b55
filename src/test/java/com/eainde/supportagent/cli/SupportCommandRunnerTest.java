package com.eainde.supportagent.cli;

import com.eainde.supportagent.workflow.SupportRunResult;
import com.eainde.supportagent.workflow.WorkflowEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SupportCommandRunnerTest {

    @Mock private WorkflowEngine engine;
    @Mock private RunSummaryPrinter printer;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private SupportCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new SupportCommandRunner(engine, printer, new ObjectMapper(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static SupportRunResult someResult() {
        return new SupportRunResult("run-1", List.of(), Map.of(), Map.of(), List.of());
    }

    @Nested
    @DisplayName("run()")
    class Run {

        @Test
        @DisplayName("--demo runs the built-in request and prints the summary")
        void demo() {
            SupportRunResult result = someResult();
            when(engine.run(SupportCommandRunner.DEMO_REQUEST)).thenReturn(result);
            when(printer.render(result)).thenReturn("SUMMARY\n");

            runner.run(new DefaultApplicationArguments("--demo"));

            assertThat(printed()).isEqualTo("SUMMARY\n");
            assertThat(SupportCommandRunner.DEMO_REQUEST).containsEntry("ticket_id", "TCK-1001");
        }

        @Test
        @DisplayName("--input parses the JSON request")
        @SuppressWarnings("unchecked")
        void input() {
            when(engine.run(anyMap())).thenReturn(someResult());
            when(printer.render(any())).thenReturn("");

            runner.run(new DefaultApplicationArguments("--input={\"customer_name\":\"Bo\",\"priority\":\"low\"}"));

            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(engine).run(captor.capture());
            assertThat(captor.getValue()).containsEntry("customer_name", "Bo").containsEntry("priority", "low");
        }

        @Test
        @DisplayName("--input accepts the JSON as a separate argument")
        @SuppressWarnings("unchecked")
        void inputSeparateArgument() {
            when(engine.run(anyMap())).thenReturn(someResult());
            when(printer.render(any())).thenReturn("");

            runner.run(new DefaultApplicationArguments("--input", "{\"customer_name\":\"Bo\",\"ticket_id\":\"T-7\"}"));

            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(engine).run(captor.capture());
            assertThat(captor.getValue()).containsEntry("customer_name", "Bo").containsEntry("ticket_id", "T-7");
        }

        @Test
        @DisplayName("bare --input without JSON is rejected")
        void inputMissingJson() {
            assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--input")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--input requires a JSON object");
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("no option prints the usage line")
        void usage() {
            runner.run(new DefaultApplicationArguments());

            assertThat(printed().trim()).isEqualTo("Use --demo or --input '{...json...}'");
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("malformed --input is rejected")
        void malformedInput() {
            assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--input={oops")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("--input is not a valid JSON object");
            verifyNoInteractions(engine);
        }
    }

    @Test
    @DisplayName("only --demo and --input switch off the web server")
    void commandLineDetection() {
        assertThat(SupportCommandRunner.isCommandLineRun("--demo")).isTrue();
        assertThat(SupportCommandRunner.isCommandLineRun("--input={}")).isTrue();
        assertThat(SupportCommandRunner.isCommandLineRun("--input", "{}")).isTrue();
        assertThat(SupportCommandRunner.isCommandLineRun("--server.port=9000")).isFalse();
        assertThat(SupportCommandRunner.isCommandLineRun()).isFalse();
    }
}
