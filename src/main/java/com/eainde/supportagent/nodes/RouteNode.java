package com.eainde.supportagent.nodes;

import com.eainde.supportagent.edges.SolutionRouter;
import com.eainde.supportagent.state.SupportState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph node hosting the {@link SolutionRouter}.
 *
 * <p>Edge actions cannot write state, so the router's ability calls run here and
 * are committed before the conditional edge reads the chosen route.</p>
 */
@Component
public class RouteNode implements AsyncNodeAction<SupportState> {

    private final SolutionRouter router;

    public RouteNode(SolutionRouter router) {
        this.router = router;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SupportState state) {
        return CompletableFuture.completedFuture(router.route(state).toMap());
    }
}
