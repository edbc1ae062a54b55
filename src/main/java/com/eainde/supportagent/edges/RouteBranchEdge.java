package com.eainde.supportagent.edges;

import com.eainde.supportagent.state.SupportState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Conditional edge after the router node. Reads the committed {@code route}; only
 * a state that never passed the router falls back to the score itself.
 */
@Component
public class RouteBranchEdge implements AsyncEdgeAction<SupportState> {

    @Override
    public CompletableFuture<String> apply(SupportState state) {
        String branch = state.route()
                .orElseGet(() -> SolutionRouter.selectBranch(state.solutionScore()).name());
        return CompletableFuture.completedFuture(branch);
    }
}
