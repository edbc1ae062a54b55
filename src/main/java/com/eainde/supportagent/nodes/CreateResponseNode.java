package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.ability.AbilityResult;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportField;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * High-score branch: drafts the customer response.
 *
 * <p>The template response from {@code response_generation} is the fallback. When the
 * language-model backed {@code generate_response} returns a non-blank draft, that
 * draft replaces it. No other field of the second call is kept.</p>
 */
@Component
public class CreateResponseNode extends AbstractStageNode {

    static final String SYSTEM_MESSAGE =
            "You are a professional customer support agent. Generate a helpful, empathetic response.";

    public CreateResponseNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.CREATE;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        update.merge(call(AbilityNames.RESPONSE_GENERATION, state));

        AbilityResult generated = call(AbilityNames.GENERATE_RESPONSE,
                Map.of("system_message", SYSTEM_MESSAGE), state);
        update.record(generated);

        String draft = generated.text(SupportField.DRAFT_RESPONSE.key());
        if (draft != null) {
            update.put(SupportField.DRAFT_RESPONSE, draft);
        }
    }
}
