package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityResult;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for the workflow stages.
 *
 * <p>A stage reads the state as last committed by the graph, issues its ability
 * calls, and collects the results into one {@link StageUpdate}. Nothing is
 * committed until the stage returns, so a call never sees the results of earlier
 * calls in the same stage.</p>
 */
@Log4j2
public abstract class AbstractStageNode implements AsyncNodeAction<SupportState> {

    private final AbilityDispatcher dispatcher;

    protected AbstractStageNode(AbilityDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /** Node id in the workflow graph. */
    public abstract String stageName();

    protected abstract void process(SupportState state, StageUpdate update);

    protected String completionMessage() {
        return stageName() + " complete.";
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SupportState state) {
        log.debug("{} started", stageName());
        StageUpdate update = new StageUpdate();
        process(state, update);
        update.log(completionMessage());
        return CompletableFuture.completedFuture(update.toMap());
    }

    protected AbilityResult call(String ability, SupportState state) {
        return call(ability, Map.of(), state);
    }

    protected AbilityResult call(String ability, Map<String, Object> payload, SupportState state) {
        return dispatcher.call(ability, payload, state.data());
    }
}
