package com.eainde.supportagent.state;

import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request state threaded through the support workflow.
 *
 * <p>All keys come from {@link SupportField}. {@code logs} is backed by an appender
 * channel, so partial updates append to it instead of replacing it; every other key
 * is last-write-wins.</p>
 */
@Log4j2
public class SupportState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            SupportField.LOGS.key(), Channels.appender(ArrayList::new)
    );

    public SupportState(Map<String, Object> initData) {
        super(initData);
    }

    public Optional<String> customerName() { return text(SupportField.CUSTOMER_NAME); }
    public Optional<String> email() { return text(SupportField.EMAIL); }
    public Optional<String> query() { return text(SupportField.QUERY); }
    public Optional<String> priority() { return text(SupportField.PRIORITY); }
    public Optional<String> ticketId() { return text(SupportField.TICKET_ID); }
    public Optional<String> intent() { return text(SupportField.INTENT); }
    public Optional<String> sentiment() { return text(SupportField.SENTIMENT); }
    public Optional<String> draftResponse() { return text(SupportField.DRAFT_RESPONSE); }
    public Optional<String> route() { return text(SupportField.ROUTE); }

    public boolean escalated() { return flag(SupportField.ESCALATED); }
    public boolean closed() { return flag(SupportField.CLOSED); }

    /**
     * Solution score written by the decide stage. Absent or unreadable scores count as 0.
     */
    public int solutionScore() {
        return readScore(data().get(SupportField.SOLUTION_SCORE.key()));
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> output() {
        Object value = data().get(SupportField.OUTPUT.key());
        return value instanceof Map ? Optional.of((Map<String, Object>) value) : Optional.empty();
    }

    public List<String> logs() {
        Object value = data().get(SupportField.LOGS.key());
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(list.size());
        list.forEach(line -> lines.add(String.valueOf(line)));
        return List.copyOf(lines);
    }

    /** Out-of-range numbers saturate to {@code Integer.MIN_VALUE}/{@code MAX_VALUE}; NaN reads as 0. */
    static int readScore(Object value) {
        if (value instanceof Number number) {
            return (int) number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric solution score '{}'", text);
            }
        }
        return 0;
    }

    private Optional<String> text(SupportField field) {
        Object value = data().get(field.key());
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    private boolean flag(SupportField field) {
        Object value = data().get(field.key());
        if (value instanceof Boolean b) {
            return b;
        }
        return value instanceof String s && Boolean.parseBoolean(s);
    }

    /**
     * Checks caller-supplied input before a run starts.
     *
     * @return the input without {@code null} values
     * @throws IllegalArgumentException if a key is unknown or is not an input field
     */
    public static Map<String, Object> validateInput(Map<String, Object> input) {
        if (input == null) {
            throw new IllegalArgumentException("Request input is required");
        }
        Map<String, Object> accepted = new LinkedHashMap<>();
        input.forEach((key, value) -> {
            SupportField field = SupportField.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown input field: " + key));
            if (!field.isInput()) {
                throw new IllegalArgumentException("Field '" + key + "' cannot be supplied by the caller");
            }
            if (value != null) {
                accepted.put(key, value);
            }
        });
        return accepted;
    }
}
