package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Runs downstream actions and notifications; both branches converge here.
 */
@Component
public class DoNode extends AbstractStageNode {

    public DoNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.DO;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.EXECUTE_API_CALLS, state));
        update.merge(call(AbilityNames.TRIGGER_NOTIFICATIONS, state));

        // conversation log is persisted provider-side; the reply is not part of the state
        update.record(call(AbilityNames.STORE_CONVERSATION_LOG, state));
    }
}
