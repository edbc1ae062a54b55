package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Hands the raw request to the providers. The acknowledgement is logged, not stored.
 */
@Component
public class IntakeNode extends AbstractStageNode {

    public IntakeNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.INTAKE;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.record(call(AbilityNames.ACCEPT_PAYLOAD, state));
    }
}
