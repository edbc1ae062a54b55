package com.eainde.supportagent.nodes;

/**
 * Node ids of the support workflow graph.
 *
 * <pre>
 * INTAKE → UNDERSTAND → PREPARE → ASK → WAIT → RETRIEVE → DECIDE → ROUTE
 *                                                                   │
 *                                              score &lt; 90 ┌────────┴────────┐ score ≥ 90
 *                                                         UPDATE            CREATE
 *                                                           └───────┬───────┘
 *                                                                  DO → COMPLETE
 * </pre>
 */
public final class StageNames {

    private StageNames() {}

    public static final String INTAKE = "INTAKE";
    public static final String UNDERSTAND = "UNDERSTAND";
    public static final String PREPARE = "PREPARE";
    public static final String ASK = "ASK";
    public static final String WAIT = "WAIT";
    public static final String RETRIEVE = "RETRIEVE";
    public static final String DECIDE = "DECIDE";
    public static final String ROUTE = "ROUTE";
    public static final String UPDATE = "UPDATE";
    public static final String CREATE = "CREATE";
    public static final String DO = "DO";
    public static final String COMPLETE = "COMPLETE";
}
