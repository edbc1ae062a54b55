package com.eainde.supportagent.cli;

import com.eainde.supportagent.workflow.SupportRunResult;
import com.eainde.supportagent.workflow.WorkflowEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --demo                 run the built-in sample request
 *   --input='{"query":..}' run the given request
 *   --input '{"query":..}' same, with the JSON as the next argument
 * </pre>
 */
@Log4j2
@Component
public class SupportCommandRunner implements ApplicationRunner {

    public static final String DEMO_OPTION = "demo";
    public static final String INPUT_OPTION = "input";
    static final String USAGE = "Use --demo or --input '{...json...}'";

    static final Map<String, Object> DEMO_REQUEST = demoRequest();

    private static final TypeReference<Map<String, Object>> INPUT_TYPE = new TypeReference<>() {};

    private final WorkflowEngine engine;
    private final RunSummaryPrinter printer;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public SupportCommandRunner(WorkflowEngine engine, RunSummaryPrinter printer, ObjectMapper objectMapper) {
        this(engine, printer, objectMapper, System.out);
    }

    SupportCommandRunner(WorkflowEngine engine, RunSummaryPrinter printer, ObjectMapper objectMapper, PrintStream out) {
        this.engine = engine;
        this.printer = printer;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    /** True when the arguments ask for a one-shot console run instead of the HTTP service. */
    public static boolean isCommandLineRun(String... args) {
        for (String arg : args) {
            if (arg.equals("--" + DEMO_OPTION)
                    || arg.equals("--" + INPUT_OPTION)
                    || arg.startsWith("--" + INPUT_OPTION + "=")) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        Map<String, Object> request;
        if (args.containsOption(DEMO_OPTION)) {
            request = DEMO_REQUEST;
        } else if (args.containsOption(INPUT_OPTION)) {
            request = parseInput(inputValue(args));
        } else {
            out.println(USAGE);
            return;
        }

        log.debug("Command-line run with fields {}", request.keySet());
        SupportRunResult result = engine.run(request);
        out.print(printer.render(result));
    }

    /** {@code --input=<json>}, or a bare {@code --input} followed by the JSON as a separate argument. */
    private static String inputValue(ApplicationArguments args) {
        List<String> values = args.getOptionValues(INPUT_OPTION);
        if (values != null && !values.isEmpty()) {
            return values.get(0);
        }
        List<String> rest = args.getNonOptionArgs();
        return rest.isEmpty() ? null : rest.get(0);
    }

    private Map<String, Object> parseInput(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--input requires a JSON object");
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(value, INPUT_TYPE);
            if (parsed == null) {
                throw new IllegalArgumentException("--input requires a JSON object");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("--input is not a valid JSON object: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> demoRequest() {
        Map<String, Object> demo = new LinkedHashMap<>();
        demo.put("customer_name", "Aisha Jain");
        demo.put("email", "AISHA@EXAMPLE.COM ");
        demo.put("query", "My order #A123 arrived damaged. Need a replacement ASAP.");
        demo.put("priority", "High");
        demo.put("ticket_id", "TCK-1001");
        demo.put("clarification_answer", "Ship replacement to: 221B Baker Street, London.");
        return Map.copyOf(demo);
    }
}
