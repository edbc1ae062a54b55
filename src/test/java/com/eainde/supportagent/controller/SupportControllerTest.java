package com.eainde.supportagent.controller;

import com.eainde.supportagent.workflow.SupportRunResult;
import com.eainde.supportagent.workflow.WorkflowEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SupportController.class)
class SupportControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private WorkflowEngine engine;

    @Test
    @DisplayName("POST /support/requests returns the run summary")
    void submit() throws Exception {
        SupportRunResult result = new SupportRunResult(
                "run-42",
                List.of("INTAKE", "COMPLETE"),
                Map.of("ticket_id", "TCK-1001", "solution_score", 95),
                Map.of("ticket_id", "TCK-1001"),
                List.of("INTAKE complete.", "COMPLETE done."));
        when(engine.run(anyMap())).thenReturn(result);

        mockMvc.perform(post("/support/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticket_id\":\"TCK-1001\",\"query\":\"Where is my order?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-42"))
                .andExpect(jsonPath("$.path", contains("INTAKE", "COMPLETE")))
                .andExpect(jsonPath("$.output.ticket_id").value("TCK-1001"))
                .andExpect(jsonPath("$.logs[1]").value("COMPLETE done."))
                .andExpect(jsonPath("$", not(hasKey("state"))));
    }

    @Test
    @DisplayName("invalid input fields map to 400")
    void invalidInput() throws Exception {
        when(engine.run(anyMap())).thenThrow(new IllegalArgumentException("Unknown input field: vip"));

        mockMvc.perform(post("/support/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vip\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown input field: vip"));
    }

    @Test
    @DisplayName("a body that is not a JSON object maps to 400")
    void unreadableBody() throws Exception {
        mockMvc.perform(post("/support/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1,2,3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(engine);
    }
}
