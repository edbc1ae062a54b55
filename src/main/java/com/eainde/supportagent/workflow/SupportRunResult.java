package com.eainde.supportagent.workflow;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow run.
 *
 * @param runId  id assigned by the engine, also used as the graph thread id
 * @param path   stages executed, in order
 * @param state  final request state
 * @param output the {@code output} payload of the COMPLETE stage, or the final state
 *               when the provider did not supply one
 * @param logs   execution log accumulated over the run
 */
public record SupportRunResult(
        String runId,
        List<String> path,
        Map<String, Object> state,
        Map<String, Object> output,
        List<String> logs
) {}
