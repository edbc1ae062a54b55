package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Terminal stage. The provider's {@code output} payload becomes the caller-facing result.
 */
@Component
public class CompleteNode extends AbstractStageNode {

    public CompleteNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.COMPLETE;
    }

    @Override
    protected String completionMessage() {
        return "COMPLETE done.";
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.OUTPUT_PAYLOAD, state));
    }
}
