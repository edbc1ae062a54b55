package com.eainde.supportagent.ability;

import java.util.Map;

/**
 * Synchronous client for one capability provider.
 *
 * <p>Implementations must not throw: every transport or provider failure is
 * reported as {@link AbilityResult#failed(String, String, String)}.</p>
 */
public interface ProviderClient {

    String providerId();

    /**
     * @param ability name of the remote ability
     * @param payload stage-specific arguments, usually empty
     * @param state   snapshot of the request state at call time
     */
    AbilityResult invoke(String ability, Map<String, Object> payload, Map<String, Object> state);
}
