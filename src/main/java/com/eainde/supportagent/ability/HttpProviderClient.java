package com.eainde.supportagent.ability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ProviderClient} speaking the ability RPC contract over HTTP.
 *
 * <pre>
 * POST {baseUrl}/abilities/{ability}
 * { "payload": {...}, "state": {...} }
 * </pre>
 *
 * The reply must be a JSON object; its keys form the partial state update.
 * Non-2xx replies, unparseable bodies, I/O errors and timeouts all degrade to
 * an empty update.
 */
@Log4j2
public class HttpProviderClient implements ProviderClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Object>> UPDATE_TYPE = new TypeReference<>() {};

    private final String providerId;
    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpProviderClient(Builder builder) {
        if (builder.providerId == null || builder.baseUrl == null
                || builder.httpClient == null || builder.objectMapper == null) {
            throw new IllegalArgumentException("providerId, baseUrl, httpClient and objectMapper are required");
        }
        this.providerId = builder.providerId;
        this.baseUrl = HttpUrl.get(builder.baseUrl);
        this.objectMapper = builder.objectMapper;

        OkHttpClient.Builder clientBuilder = builder.httpClient.newBuilder();
        if (builder.callTimeout != null) {
            clientBuilder.callTimeout(builder.callTimeout);
        }
        if (builder.apiKey != null && !builder.apiKey.isBlank()) {
            String bearer = "Bearer " + builder.apiKey;
            Interceptor authInterceptor = chain -> chain.proceed(
                    chain.request().newBuilder().header("Authorization", bearer).build());
            clientBuilder.addInterceptor(authInterceptor);
        }
        this.httpClient = clientBuilder.build();
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public AbilityResult invoke(String ability, Map<String, Object> payload, Map<String, Object> state) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("abilities")
                .addPathSegment(ability)
                .build();

        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(payload, state));
        } catch (JsonProcessingException e) {
            return failure(ability, "request not serializable: " + e.getOriginalMessage());
        }

        try {
            Request request = new Request.Builder()
                    .url(url)
                    .header("Content-Type", "application/json")
                    .post(RequestBody.create(body, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    return failure(ability, String.format("HTTP %d from %s", response.code(), url));
                }
                ResponseBody responseBody = response.body();
                String raw = responseBody != null ? responseBody.string() : "";
                return parse(ability, raw);
            }
        } catch (JsonProcessingException e) {
            return failure(ability, "malformed response body: " + e.getOriginalMessage());
        } catch (IOException e) {
            return failure(ability, describe(e));
        } catch (RuntimeException e) {
            log.error("[{}] {} raised an unexpected error", providerId, ability, e);
            return failure(ability, describe(e));
        }
    }

    private AbilityResult parse(String ability, String raw) throws JsonProcessingException {
        if (raw.isBlank()) {
            return failure(ability, "malformed response body: empty");
        }
        JsonNode node = objectMapper.readTree(raw);
        if (node == null || !node.isObject()) {
            return failure(ability, "malformed response body: expected a JSON object");
        }
        Map<String, Object> update = objectMapper.convertValue(node, UPDATE_TYPE);
        String serialized = objectMapper.writeValueAsString(node);
        log.debug("[{}] {} → {}", providerId, ability, serialized);
        return AbilityResult.succeeded(providerId, ability, update, serialized);
    }

    private AbilityResult failure(String ability, String reason) {
        log.warn("[{}] {} failed: {}", providerId, ability, reason);
        return AbilityResult.failed(providerId, ability, reason);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Map<String, Object> requestBody(Map<String, Object> payload, Map<String, Object> state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payload", payload != null ? payload : Map.of());
        body.put("state", state != null ? state : Map.of());
        return body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String providerId;
        private String baseUrl;
        private String apiKey;
        private Duration callTimeout;
        private OkHttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder providerId(String providerId) { this.providerId = providerId; return this; }
        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder callTimeout(Duration callTimeout) { this.callTimeout = callTimeout; return this; }
        public Builder httpClient(OkHttpClient httpClient) { this.httpClient = httpClient; return this; }
        public Builder objectMapper(ObjectMapper objectMapper) { this.objectMapper = objectMapper; return this; }

        public HttpProviderClient build() {
            return new HttpProviderClient(this);
        }
    }
}
