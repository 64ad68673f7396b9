package com.phonepe.triplestore.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.HttpHeaders;
import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.EmbeddingFailure;
import com.phonepe.triplestore.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Embeds text through an OpenAI compatible HTTP endpoint. Batches are sent as a single request.
 */
@Slf4j
public class GatewayTextEmbedder implements TextEmbedder {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    @Value
    static class EmbeddingRequest {
        @JsonProperty("model")
        String model;
        @JsonProperty("input")
        List<String> input;
    }

    @Data
    @NoArgsConstructor
    static class EmbeddingData {
        @JsonProperty("index")
        private int index;
        @JsonProperty("embedding")
        private float[] embedding;
    }

    @Data
    @NoArgsConstructor
    static class EmbeddingResponse {
        @JsonProperty("data")
        private List<EmbeddingData> data;
    }

    private final GatewayEmbedderConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    @Builder
    public GatewayTextEmbedder(@NonNull GatewayEmbedderConfig config, OkHttpClient httpClient, ObjectMapper mapper) {
        this.config = config;
        this.httpClient = Objects.requireNonNullElseGet(httpClient,
                                                        () -> new OkHttpClient.Builder()
                                                                .callTimeout(config.getTimeout())
                                                                .build());
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        final var request = buildRequest(texts);
        try (final var response = httpClient.newCall(request).execute()) {
            final var body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new EmbeddingFailure("gateway returned status %d: %s".formatted(response.code(), body.strip()));
            }
            return parse(body, texts.size());
        }
        catch (IOException e) {
            throw new EmbeddingFailure("error calling embedding gateway at %s: %s".formatted(config.getBaseUrl(),
                                                                                             e.getMessage()), e);
        }
    }

    private Request buildRequest(final List<String> texts) {
        final byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(new EmbeddingRequest(config.getModel(), texts));
        }
        catch (IOException e) {
            throw new EmbeddingFailure("could not serialize embedding request", e);
        }
        final var builder = new Request.Builder()
                .url(config.getBaseUrl() + "/embeddings")
                .post(RequestBody.create(payload, JSON));
        if (config.getApiKey() != null) {
            builder.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private List<float[]> parse(final String body, final int expected) throws IOException {
        final var response = mapper.readValue(body, EmbeddingResponse.class);
        if (response.getData() == null || response.getData().size() != expected) {
            throw new EmbeddingFailure("gateway returned %s embeddings for %d inputs"
                                               .formatted(response.getData() == null ? "no" : response.getData().size(),
                                                          expected));
        }
        log.debug("Received {} embeddings from {}", expected, config.getBaseUrl());
        return response.getData()
                .stream()
                .sorted(Comparator.comparingInt(EmbeddingData::getIndex))
                .map(EmbeddingData::getEmbedding)
                .toList();
    }
}
