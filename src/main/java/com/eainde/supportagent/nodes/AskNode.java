package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Produces the clarification question to put to the customer.
 */
@Component
public class AskNode extends AbstractStageNode {

    public AskNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.ASK;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.CLARIFY_QUESTION, state));
    }
}
