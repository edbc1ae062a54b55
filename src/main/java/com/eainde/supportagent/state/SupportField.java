package com.eainde.supportagent.state;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of keys a {@link SupportState} may hold.
 *
 * <p>Keys are grouped by who is allowed to write them:</p>
 * <ul>
 *   <li>{@link Kind#INPUT} – supplied by the caller, read-only for the workflow</li>
 *   <li>{@link Kind#DERIVED} – written by stages from ability results</li>
 *   <li>{@link Kind#DIAGNOSTIC} – the append-only execution log</li>
 *   <li>{@link Kind#INTERNAL} – bookkeeping owned by the workflow itself</li>
 * </ul>
 */
public enum SupportField {

    // Input
    CUSTOMER_NAME("customer_name", Kind.INPUT),
    EMAIL("email", Kind.INPUT),
    QUERY("query", Kind.INPUT),
    PRIORITY("priority", Kind.INPUT),
    TICKET_ID("ticket_id", Kind.INPUT),
    CLARIFICATION_ANSWER("clarification_answer", Kind.INPUT),

    // Understand / prepare
    PARSED("parsed", Kind.DERIVED),
    ENTITIES("entities", Kind.DERIVED),
    NORMALIZED("normalized", Kind.DERIVED),
    ENRICHED("enriched", Kind.DERIVED),
    FLAGS("flags", Kind.DERIVED),
    INTENT("intent", Kind.DERIVED),
    SENTIMENT("sentiment", Kind.DERIVED),
    AI_RESPONSE("ai_response", Kind.DERIVED),
    CUSTOMER_HISTORY("customer_history", Kind.DERIVED),

    // Ask / retrieve / decide
    CLARIFICATION_QUESTION("clarification_question", Kind.DERIVED),
    KB_RESULTS("kb_results", Kind.DERIVED),
    SOLUTION_SCORE("solution_score", Kind.DERIVED),
    ESCALATED("escalated", Kind.DERIVED),
    DECISION_NOTES("decision_notes", Kind.DERIVED),

    // Ticket / response / actions
    TICKET_UPDATES("ticket_updates", Kind.DERIVED),
    CLOSED("closed", Kind.DERIVED),
    DRAFT_RESPONSE("draft_response", Kind.DERIVED),
    API_ACTIONS("api_actions", Kind.DERIVED),
    NOTIFICATIONS("notifications", Kind.DERIVED),
    OUTPUT("output", Kind.DERIVED),

    LOGS("logs", Kind.DIAGNOSTIC),
    ROUTE("route", Kind.INTERNAL);

    public enum Kind { INPUT, DERIVED, DIAGNOSTIC, INTERNAL }

    private static final Map<String, SupportField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(SupportField::key, Function.identity()));

    private final String key;
    private final Kind kind;

    SupportField(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isInput() {
        return kind == Kind.INPUT;
    }

    public static Optional<SupportField> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
