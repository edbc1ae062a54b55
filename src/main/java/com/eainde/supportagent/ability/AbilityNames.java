package com.eainde.supportagent.ability;

import java.util.List;

/**
 * Remote ability names, as exposed under {@code /abilities/<name>} by the providers.
 *
 * <pre>
 * INTAKE      accept_payload
 * UNDERSTAND  parse_request_text, extract_entities, extract_intent, sentiment_analysis
 * PREPARE     normalize_fields, enrich_records, add_flags_calculations, get_customer_history
 * ASK         clarify_question
 * WAIT        extract_answer, store_answer
 * RETRIEVE    knowledge_base_search, search_knowledge_base, store_data
 * DECIDE      solution_evaluation
 * ROUTE       escalation_decision, update_payload
 * UPDATE      update_ticket, close_ticket, update_ticket_status, store_ticket
 * CREATE      response_generation, generate_response
 * DO          execute_api_calls, trigger_notifications, store_conversation_log
 * COMPLETE    output_payload
 * </pre>
 */
public final class AbilityNames {

    private AbilityNames() {}

    // ── Intake / understand ─────────────────────────────────────────────
    public static final String ACCEPT_PAYLOAD = "accept_payload";
    public static final String PARSE_REQUEST_TEXT = "parse_request_text";
    public static final String EXTRACT_ENTITIES = "extract_entities";
    public static final String EXTRACT_INTENT = "extract_intent";
    public static final String SENTIMENT_ANALYSIS = "sentiment_analysis";

    // ── Prepare ─────────────────────────────────────────────────────────
    public static final String NORMALIZE_FIELDS = "normalize_fields";
    public static final String ENRICH_RECORDS = "enrich_records";
    public static final String ADD_FLAGS_CALCULATIONS = "add_flags_calculations";
    public static final String GET_CUSTOMER_HISTORY = "get_customer_history";

    // ── Ask / wait ──────────────────────────────────────────────────────
    public static final String CLARIFY_QUESTION = "clarify_question";
    public static final String EXTRACT_ANSWER = "extract_answer";
    public static final String STORE_ANSWER = "store_answer";

    // ── Retrieve ────────────────────────────────────────────────────────
    public static final String KNOWLEDGE_BASE_SEARCH = "knowledge_base_search";
    public static final String SEARCH_KNOWLEDGE_BASE = "search_knowledge_base";
    public static final String STORE_DATA = "store_data";

    // ── Decide / route ──────────────────────────────────────────────────
    public static final String SOLUTION_EVALUATION = "solution_evaluation";
    public static final String ESCALATION_DECISION = "escalation_decision";
    public static final String UPDATE_PAYLOAD = "update_payload";

    // ── Update branch ───────────────────────────────────────────────────
    public static final String UPDATE_TICKET = "update_ticket";
    public static final String CLOSE_TICKET = "close_ticket";
    public static final String UPDATE_TICKET_STATUS = "update_ticket_status";
    public static final String STORE_TICKET = "store_ticket";

    // ── Create branch ───────────────────────────────────────────────────
    public static final String RESPONSE_GENERATION = "response_generation";
    /** Richer generation backed by the language-model provider; wins when it answers. */
    public static final String GENERATE_RESPONSE = "generate_response";

    // ── Do / complete ───────────────────────────────────────────────────
    public static final String EXECUTE_API_CALLS = "execute_api_calls";
    public static final String TRIGGER_NOTIFICATIONS = "trigger_notifications";
    public static final String STORE_CONVERSATION_LOG = "store_conversation_log";
    public static final String OUTPUT_PAYLOAD = "output_payload";

    /** Every ability above, in stage order. */
    public static final List<String> ALL = List.of(
            ACCEPT_PAYLOAD,
            PARSE_REQUEST_TEXT, EXTRACT_ENTITIES, EXTRACT_INTENT, SENTIMENT_ANALYSIS,
            NORMALIZE_FIELDS, ENRICH_RECORDS, ADD_FLAGS_CALCULATIONS, GET_CUSTOMER_HISTORY,
            CLARIFY_QUESTION,
            EXTRACT_ANSWER, STORE_ANSWER,
            KNOWLEDGE_BASE_SEARCH, SEARCH_KNOWLEDGE_BASE, STORE_DATA,
            SOLUTION_EVALUATION,
            ESCALATION_DECISION, UPDATE_PAYLOAD,
            UPDATE_TICKET, CLOSE_TICKET, UPDATE_TICKET_STATUS, STORE_TICKET,
            RESPONSE_GENERATION, GENERATE_RESPONSE,
            EXECUTE_API_CALLS, TRIGGER_NOTIFICATIONS, STORE_CONVERSATION_LOG,
            OUTPUT_PAYLOAD);
}
