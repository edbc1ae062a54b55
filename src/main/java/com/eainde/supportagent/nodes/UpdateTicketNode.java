package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Low-score branch: the ticket needs a human, so it is updated rather than answered.
 * {@code store_ticket} is fire-and-forget; only its log line is kept.
 */
@Component
public class UpdateTicketNode extends AbstractStageNode {

    public UpdateTicketNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.UPDATE;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.UPDATE_TICKET, state));
        update.merge(call(AbilityNames.CLOSE_TICKET, state));
        update.merge(call(AbilityNames.UPDATE_TICKET_STATUS, state));

        update.record(call(AbilityNames.STORE_TICKET, state));
    }
}
