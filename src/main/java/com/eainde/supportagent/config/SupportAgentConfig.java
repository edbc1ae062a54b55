package com.eainde.supportagent.config;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.CapabilityRegistry;
import com.eainde.supportagent.ability.CapabilityRegistry.StageBinding;
import com.eainde.supportagent.ability.HttpProviderClient;
import com.eainde.supportagent.ability.ProviderClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires provider clients, the capability registry and the dispatcher from
 * {@link SupportAgentProperties}.
 *
 * <pre>
 *   support.providers ──► HttpProviderClient (one per provider id)
 *   support.stages    ──► CapabilityRegistry (ability → provider id)
 *                              │
 *                              ▼
 *                        AbilityDispatcher ──► stage nodes
 * </pre>
 *
 * Any inconsistency between the two sections fails start-up.
 */
@Log4j2
@Configuration
@EnableConfigurationProperties(SupportAgentProperties.class)
public class SupportAgentConfig {

    // Shared connection pool; each provider client derives its own timeout and auth from it.
    @Bean
    public OkHttpClient supportHttpClient() {
        return new OkHttpClient.Builder().build();
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(SupportAgentProperties properties) {
        List<StageBinding> stages = properties.getStages().stream()
                .map(stage -> new StageBinding(stage.getName(), stage.getAbilities(), stage.getProviders()))
                .toList();
        return CapabilityRegistry.fromStages(
                stages, properties.getDefaultProvider(), properties.getProviders().keySet());
    }

    @Bean
    public AbilityDispatcher abilityDispatcher(CapabilityRegistry capabilityRegistry,
                                               SupportAgentProperties properties,
                                               OkHttpClient supportHttpClient,
                                               ObjectMapper objectMapper) {
        return new AbilityDispatcher(capabilityRegistry, providerClients(properties, supportHttpClient, objectMapper));
    }

    static Map<String, ProviderClient> providerClients(SupportAgentProperties properties,
                                                       OkHttpClient httpClient,
                                                       ObjectMapper objectMapper) {
        Map<String, ProviderClient> clients = new LinkedHashMap<>();
        properties.getProviders().forEach((id, provider) -> {
            if (provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
                throw new IllegalStateException("Provider '" + id + "' has no base-url");
            }
            clients.put(id, HttpProviderClient.builder()
                    .providerId(id)
                    .baseUrl(provider.getBaseUrl())
                    .apiKey(provider.getApiKey())
                    .callTimeout(properties.getCallTimeout())
                    .httpClient(httpClient)
                    .objectMapper(objectMapper)
                    .build());
            log.info("Registered provider '{}' at {}", id, provider.getBaseUrl());
        });
        return clients;
    }
}
