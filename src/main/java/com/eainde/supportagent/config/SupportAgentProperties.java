package com.eainde.supportagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds properties:
 *
 * support.default-provider=common
 * support.call-timeout=30s
 * support.providers.common.base-url=http://localhost:8001
 * support.providers.common.api-key=...
 * support.stages[0].name=UNDERSTAND
 * support.stages[0].abilities=parse_request_text,extract_entities,...
 * support.stages[0].providers=common
 */
@Data
@ConfigurationProperties(prefix = "support")
public class SupportAgentProperties {

    /**
     * Provider used for abilities that no stage declares.
     */
    private String defaultProvider = "common";

    /**
     * Upper bound for a single ability call, connect to last byte.
     */
    private Duration callTimeout = Duration.ofSeconds(30);

    /**
     * Provider connection settings, keyed by provider id.
     */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    /**
     * Stage to ability/provider bindings.
     */
    private List<Stage> stages = new ArrayList<>();

    @Data
    public static class Provider {
        private String baseUrl;
        private String apiKey;
    }

    @Data
    public static class Stage {
        private String name;
        private List<String> abilities = new ArrayList<>();
        private List<String> providers = new ArrayList<>();
    }
}
