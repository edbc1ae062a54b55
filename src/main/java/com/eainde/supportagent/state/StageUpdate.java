package com.eainde.supportagent.state;

import com.eainde.supportagent.ability.AbilityResult;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partial state update accumulated by a single stage and committed by the graph
 * once the stage returns.
 *
 * <p>This is the write boundary of {@link SupportState}: keys outside
 * {@link SupportField}, caller input fields, {@code logs}, and {@code null}
 * values coming back from providers are dropped here.</p>
 */
@Log4j2
public final class StageUpdate {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> logs = new ArrayList<>();

    /**
     * Merges the result's accepted fields and records its log line.
     */
    public StageUpdate merge(AbilityResult result) {
        record(result);
        result.update().forEach(this::accept);
        return this;
    }

    /**
     * Records the result's log line only; its fields are discarded.
     */
    public StageUpdate record(AbilityResult result) {
        logs.add(result.logLine());
        return this;
    }

    public StageUpdate put(SupportField field, Object value) {
        if (field == SupportField.LOGS) {
            throw new IllegalArgumentException("logs are appended with log(), not put()");
        }
        if (value != null) {
            values.put(field.key(), value);
        }
        return this;
    }

    public StageUpdate log(String line) {
        logs.add(line);
        return this;
    }

    /**
     * Overlays the pending values and log lines on a state snapshot without committing them.
     */
    public Map<String, Object> applyTo(Map<String, Object> snapshot) {
        Map<String, Object> view = new HashMap<>(snapshot);
        view.putAll(values);
        if (!logs.isEmpty()) {
            List<Object> lines = new ArrayList<>();
            if (snapshot.get(SupportField.LOGS.key()) instanceof List<?> committed) {
                lines.addAll(committed);
            }
            lines.addAll(logs);
            view.put(SupportField.LOGS.key(), lines);
        }
        return view;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> update = new LinkedHashMap<>(values);
        if (!logs.isEmpty()) {
            update.put(SupportField.LOGS.key(), List.copyOf(logs));
        }
        return update;
    }

    private void accept(String key, Object value) {
        Optional<SupportField> field = SupportField.fromKey(key);
        if (field.isEmpty()) {
            log.debug("Dropping unknown state key '{}'", key);
            return;
        }
        SupportField.Kind kind = field.get().kind();
        if (kind != SupportField.Kind.DERIVED) {
            log.debug("Dropping write to {} field '{}'", kind, key);
            return;
        }
        if (value == null) {
            log.debug("Dropping null value for '{}'", key);
            return;
        }
        values.put(key, value);
    }
}
