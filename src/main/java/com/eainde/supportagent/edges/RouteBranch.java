package com.eainde.supportagent.edges;

import com.eainde.supportagent.nodes.StageNames;

/**
 * The two targets of the conditional edge leaving the router.
 */
public enum RouteBranch {

    /** Solution not good enough: update the ticket for a human. */
    UPDATE(StageNames.UPDATE),

    /** Solution good enough: draft a response to the customer. */
    CREATE(StageNames.CREATE);

    private final String targetNode;

    RouteBranch(String targetNode) {
        this.targetNode = targetNode;
    }

    public String targetNode() {
        return targetNode;
    }
}
