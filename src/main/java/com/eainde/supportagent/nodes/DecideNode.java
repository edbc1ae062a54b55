package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Scores the candidate solution. The score range (nominally 0-100) is not enforced here.
 */
@Component
public class DecideNode extends AbstractStageNode {

    public DecideNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.DECIDE;
    }

    @Override
    protected String completionMessage() {
        return "DECIDE scored solution.";
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.SOLUTION_EVALUATION, state));
    }
}
