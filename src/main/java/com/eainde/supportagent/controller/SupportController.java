package com.eainde.supportagent.controller;

import com.eainde.supportagent.workflow.SupportRunResult;
import com.eainde.supportagent.workflow.WorkflowEngine;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Log4j2
@RestController
@RequestMapping("/support")
public class SupportController {

    private final WorkflowEngine engine;

    public SupportController(WorkflowEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/requests")
    public Map<String, Object> submitRequest(@RequestBody Map<String, Object> input) {
        SupportRunResult result = engine.run(input);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", result.runId());
        response.put("path", result.path());
        response.put("output", result.output());
        response.put("logs", result.logs());
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidInput(IllegalArgumentException e) {
        log.warn("Rejected support request: {}", e.getMessage());
        return Map.of("error", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> unreadableBody(HttpMessageNotReadableException e) {
        return Map.of("error", "Request body must be a JSON object of input fields");
    }
}
