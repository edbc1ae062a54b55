package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.ability.AbilityResult;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

@Component
public class PrepareNode extends AbstractStageNode {

    public PrepareNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.PREPARE;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.NORMALIZE_FIELDS, state));
        update.merge(call(AbilityNames.ENRICH_RECORDS, state));
        update.merge(call(AbilityNames.ADD_FLAGS_CALCULATIONS, state));

        AbilityResult history = call(AbilityNames.GET_CUSTOMER_HISTORY, state);
        if (history.isEmpty()) {
            update.record(history);
        } else {
            update.merge(history);
        }
    }
}
