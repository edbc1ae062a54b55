package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportState;
import org.springframework.stereotype.Component;

/**
 * Parses the free-text query: parsed request, entities, intent and sentiment.
 *
 * <p>All four calls see the same committed state. Sentiment analysis therefore
 * runs without the intent extracted a moment earlier.</p>
 */
@Component
public class UnderstandNode extends AbstractStageNode {

    public UnderstandNode(AbilityDispatcher dispatcher) {
        super(dispatcher);
    }

    @Override
    public String stageName() {
        return StageNames.UNDERSTAND;
    }

    @Override
    protected void process(SupportState state, StageUpdate update) {
        // TODO: evaluate committing per call so sentiment_analysis can use the extracted intent
        update.merge(call(AbilityNames.PARSE_REQUEST_TEXT, state));
        update.merge(call(AbilityNames.EXTRACT_ENTITIES, state));
        update.merge(call(AbilityNames.EXTRACT_INTENT, state));
        update.merge(call(AbilityNames.SENTIMENT_ANALYSIS, state));
    }
}
