package com.eainde.supportagent.workflow;

import com.eainde.supportagent.state.SupportState;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.ThreadContext;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for running the support workflow.
 * <p>
 * Hides the langgraph4j details (thread ids, run configuration, streaming) behind a
 * single {@link #run(Map)} call. Each run gets its own id, which is also placed in the
 * Log4j2 {@link ThreadContext} under {@value #RUN_ID_KEY} so every log line emitted
 * during the run can be correlated.
 * </p>
 */
@Log4j2
@Service
public class WorkflowEngine {

    public static final String RUN_ID_KEY = "runId";

    private final CompiledGraph<SupportState> supportWorkflow;

    public WorkflowEngine(@Qualifier("supportWorkflow") CompiledGraph<SupportState> supportWorkflow) {
        this.supportWorkflow = supportWorkflow;
    }

    /**
     * Runs one support request through every stage, synchronously on the caller's thread.
     *
     * @param input caller-supplied fields (customer_name, email, query, ...)
     * @return the visited path, the final state and its execution log
     * @throws IllegalArgumentException    if the input contains unknown or non-input keys
     * @throws WorkflowExecutionException  if the graph itself fails
     */
    public SupportRunResult run(Map<String, Object> input) {
        Map<String, Object> initial = SupportState.validateInput(input);

        String runId = UUID.randomUUID().toString();
        ThreadContext.put(RUN_ID_KEY, runId);
        try {
            log.info("Starting support run for ticket {}", initial.getOrDefault("ticket_id", "<none>"));

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            List<String> path = new ArrayList<>();
            SupportState last = null;
            for (NodeOutput<SupportState> output : supportWorkflow.stream(initial, config)) {
                String node = output.node();
                if (!StateGraph.START.equals(node) && !StateGraph.END.equals(node)) {
                    path.add(node);
                }
                last = output.state();
            }
            if (last == null) {
                throw new WorkflowExecutionException("Workflow produced no state for run " + runId);
            }

            Map<String, Object> state = new LinkedHashMap<>(last.data());
            Map<String, Object> output = last.output().orElse(state);
            log.info("Support run finished via {}", path);
            return new SupportRunResult(runId, List.copyOf(path), state, output, last.logs());
        } catch (WorkflowExecutionException e) {
            log.error("Support run failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Support run failed", e);
            throw new WorkflowExecutionException("Workflow run " + runId + " failed", e);
        } finally {
            ThreadContext.remove(RUN_ID_KEY);
        }
    }
}
