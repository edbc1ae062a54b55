package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Knowledge-base lookup. Both searches write {@code kb_results}; the second one wins.
 */
@Component
public class RetrieveNode extends AbstractStageNode {

    public RetrieveNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.RETRIEVE;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.KNOWLEDGE_BASE_SEARCH, state));
        update.merge(call(AbilityNames.SEARCH_KNOWLEDGE_BASE, state));
        update.merge(call(AbilityNames.STORE_DATA, state));
    }
}
