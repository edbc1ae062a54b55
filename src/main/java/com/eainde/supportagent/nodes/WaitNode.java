package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Picks up the customer's clarification answer and stores it with the providers.
 */
@Component
public class WaitNode extends AbstractStageNode {

    public WaitNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.WAIT;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.EXTRACT_ANSWER, state));
        update.merge(call(AbilityNames.STORE_ANSWER, state));
    }
}
