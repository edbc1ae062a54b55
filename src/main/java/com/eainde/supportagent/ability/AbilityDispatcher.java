package com.eainde.supportagent.ability;

import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Routes an ability call to whichever provider the {@link CapabilityRegistry} names.
 * One hop: no retries, no caching. A client that throws is reported as a failed call.
 */
@Log4j2
public class AbilityDispatcher {

    private final CapabilityRegistry registry;
    private final Map<String, ProviderClient> clients;

    public AbilityDispatcher(CapabilityRegistry registry, Map<String, ProviderClient> clients) {
        this.registry = registry;
        this.clients = Map.copyOf(clients);
    }

    public AbilityResult call(String ability, Map<String, Object> payload, Map<String, Object> state) {
        String providerId = registry.resolve(ability);
        ProviderClient client = clients.get(providerId);
        if (client == null) {
            log.error("No client registered for provider '{}' (ability '{}')", providerId, ability);
            return AbilityResult.failed(providerId, ability, "no client registered for provider " + providerId);
        }
        try {
            return client.invoke(ability, payload, state);
        } catch (RuntimeException e) {
            log.error("[{}] {} raised an unexpected error", providerId, ability, e);
            return AbilityResult.failed(providerId, ability, describe(e));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public CapabilityRegistry registry() {
        return registry;
    }
}
