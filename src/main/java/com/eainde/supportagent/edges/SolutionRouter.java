package com.eainde.supportagent.edges;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.state.StageUpdate;
import com.eainde.supportagent.state.SupportField;
import com.eainde.supportagent.state.SupportState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides between the UPDATE and CREATE branches after the solution has been scored.
 *
 * <p>Unlike a stage, the router applies each ability result to its working view
 * before the next call: on the low-score branch {@code update_payload} already
 * sees the escalation decision, on the high-score branch it sees
 * {@code escalated=false}.</p>
 *
 * <p>Branch selection depends on the score only. A score of exactly
 * {@value #ESCALATION_THRESHOLD} takes CREATE.</p>
 */
@Log4j2
@Component
public class SolutionRouter {

    public static final int ESCALATION_THRESHOLD = 90;

    private final AbilityDispatcher dispatcher;

    public SolutionRouter(AbilityDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static RouteBranch selectBranch(int solutionScore) {
        return solutionScore < ESCALATION_THRESHOLD ? RouteBranch.UPDATE : RouteBranch.CREATE;
    }

    /**
     * Runs the routing side effects and returns the update to commit, including
     * the chosen {@code route}.
     */
    public StageUpdate route(SupportState state) {
        int score = state.solutionScore();
        RouteBranch branch = selectBranch(score);
        Map<String, Object> snapshot = state.data();
        // logged as the provider reported it, e.g. 89.5 rather than 89
        Object reported = snapshot.getOrDefault(SupportField.SOLUTION_SCORE.key(), score);
        StageUpdate update = new StageUpdate();

        if (branch == RouteBranch.UPDATE) {
            update.merge(dispatcher.call(AbilityNames.ESCALATION_DECISION, Map.of(), snapshot));
            update.merge(dispatcher.call(AbilityNames.UPDATE_PAYLOAD, Map.of(), update.applyTo(snapshot)));
            update.log(String.format("Router: score %s < %d → UPDATE.", reported, ESCALATION_THRESHOLD));
        } else {
            update.put(SupportField.ESCALATED, false);
            update.merge(dispatcher.call(AbilityNames.UPDATE_PAYLOAD, Map.of(), update.applyTo(snapshot)));
            update.log(String.format("Router: score %s ≥ %d → CREATE.", reported, ESCALATION_THRESHOLD));
        }

        update.put(SupportField.ROUTE, branch.name());
        log.info("Solution score {} routed to {}", reported, branch);
        return update;
    }
}
