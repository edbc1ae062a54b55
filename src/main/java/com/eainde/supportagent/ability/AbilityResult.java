package com.eainde.supportagent.ability;

import java.util.Map;

/**
 * Outcome of one ability call: either a partial state update, or a failure that
 * carries an empty update. Provider failures are values, never exceptions.
 *
 * @param providerId    provider that served (or failed to serve) the call
 * @param ability       ability name
 * @param update        partial state update; empty on failure
 * @param failureReason failure description, {@code null} on success
 * @param logLine       human-readable line for the state's execution log
 */
public record AbilityResult(
        String providerId,
        String ability,
        Map<String, Object> update,
        String failureReason,
        String logLine
) {

    public AbilityResult {
        update = update == null ? Map.of() : update;
    }

    public static AbilityResult succeeded(String providerId, String ability,
                                          Map<String, Object> update, String serializedUpdate) {
        String line = String.format("[%s] %s → %s", providerId, ability, serializedUpdate);
        return new AbilityResult(providerId, ability, update, null, line);
    }

    public static AbilityResult failed(String providerId, String ability, String reason) {
        String line = String.format("[%s] %s failed: %s", providerId, ability, reason);
        return new AbilityResult(providerId, ability, Map.of(), reason, line);
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    public boolean isEmpty() {
        return update.isEmpty();
    }

    /**
     * @return the value for {@code key} when it is a non-blank string, otherwise {@code null}
     */
    public String text(String key) {
        return update.get(key) instanceof String text && !text.isBlank() ? text : null;
    }
}
