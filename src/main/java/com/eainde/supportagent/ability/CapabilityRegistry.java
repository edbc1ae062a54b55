package com.eainde.supportagent.ability;

import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable ability → provider table, built once at start-up.
 *
 * <p>For each stage binding the ability list is zipped against the provider list.
 * A single configured provider serves every ability of its stage. When several
 * stages declare the same ability the last declaration wins. Abilities nobody
 * declared resolve to the default provider.</p>
 */
@Log4j2
public final class CapabilityRegistry {

    /**
     * Abilities a stage needs and the provider id(s) serving them.
     */
    public record StageBinding(String stage, List<String> abilities, List<String> providers) {
        public StageBinding {
            abilities = abilities == null ? List.of() : List.copyOf(abilities);
            providers = providers == null ? List.of() : List.copyOf(providers);
        }
    }

    private final Map<String, String> bindings;
    private final String defaultProvider;

    private CapabilityRegistry(Map<String, String> bindings, String defaultProvider) {
        this.bindings = Map.copyOf(bindings);
        this.defaultProvider = defaultProvider;
    }

    /**
     * Builds and validates the table.
     *
     * @param stages          stage bindings in declaration order
     * @param defaultProvider provider for undeclared abilities
     * @param knownProviders  provider ids that have a configured client
     * @throws IllegalStateException on an inconsistent binding or an unknown provider id
     */
    public static CapabilityRegistry fromStages(List<StageBinding> stages,
                                                String defaultProvider,
                                                Set<String> knownProviders) {
        Objects.requireNonNull(knownProviders, "knownProviders");
        if (defaultProvider == null || !knownProviders.contains(defaultProvider)) {
            throw new IllegalStateException("Default provider '" + defaultProvider
                    + "' has no configured client; known providers: " + knownProviders);
        }

        Map<String, String> table = new LinkedHashMap<>();
        for (StageBinding stage : stages == null ? List.<StageBinding>of() : stages) {
            bind(stage, table);
        }

        List<String> unknown = table.values().stream()
                .filter(provider -> !knownProviders.contains(provider))
                .distinct()
                .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("Stages reference providers without a configured client: " + unknown);
        }

        log.info("Capability registry built: {} abilities, default provider '{}'", table.size(), defaultProvider);
        return new CapabilityRegistry(table, defaultProvider);
    }

    private static void bind(StageBinding stage, Map<String, String> table) {
        List<String> abilities = stage.abilities();
        List<String> providers = stage.providers();
        if (abilities.isEmpty()) {
            return;
        }
        if (providers.isEmpty()) {
            throw new IllegalStateException("Stage '" + stage.stage() + "' declares abilities but no provider");
        }

        if (providers.size() == 1) {
            abilities.forEach(ability -> table.put(ability, providers.get(0)));
            return;
        }
        if (abilities.size() > providers.size()) {
            throw new IllegalStateException(String.format(
                    "Stage '%s' declares %d abilities but only %d providers",
                    stage.stage(), abilities.size(), providers.size()));
        }
        if (abilities.size() < providers.size()) {
            log.warn("Stage '{}' lists {} providers for {} abilities; extra providers ignored",
                    stage.stage(), providers.size(), abilities.size());
        }
        for (int i = 0; i < abilities.size(); i++) {
            table.put(abilities.get(i), providers.get(i));
        }
    }

    public String resolve(String ability) {
        String provider = bindings.get(ability);
        if (provider == null) {
            log.debug("Ability '{}' not declared by any stage, using default provider '{}'", ability, defaultProvider);
            return defaultProvider;
        }
        return provider;
    }

    public boolean isDeclared(String ability) {
        return bindings.containsKey(ability);
    }

    public String defaultProvider() {
        return defaultProvider;
    }

    public Map<String, String> bindings() {
        return bindings;
    }
}
