package com.phonepe.triplestore.embedding;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.triplestore.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for an OpenAI compatible {@code /embeddings} endpoint
 */
@Value
public class GatewayEmbedderConfig {
    public static final String URL_ENV = "TRIPLESTORE_EMBEDDING_URL";
    public static final String API_KEY_ENV = "TRIPLESTORE_EMBEDDING_API_KEY";
    public static final String MODEL_ENV = "TRIPLESTORE_EMBEDDING_MODEL";
    public static final String TIMEOUT_ENV = "TRIPLESTORE_EMBEDDING_TIMEOUT_SECONDS";

    public static final String DEFAULT_MODEL = "text-embedding-3-small";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Base url, e.g. {@code http://localhost:8080/v1}. {@code /embeddings} is appended.
     */
    String baseUrl;

    /**
     * Sent as a bearer token when present
     */
    String apiKey;

    String model;

    Duration timeout;

    @Builder
    public GatewayEmbedderConfig(String baseUrl, String apiKey, String model, Duration timeout) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(baseUrl) && !baseUrl.isBlank(),
                                    "embedding gateway url is required");
        this.baseUrl = baseUrl.strip().replaceAll("/+$", "");
        this.apiKey = Strings.emptyToNull(apiKey);
        this.model = Objects.requireNonNullElse(Strings.emptyToNull(model), DEFAULT_MODEL);
        this.timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    }

    /**
     * Reads settings from the environment or a {@code .env} file
     *
     * @throws IllegalArgumentException if {@value #URL_ENV} is not set or the timeout is not a number
     */
    public static GatewayEmbedderConfig fromEnv() {
        final var timeout = EnvLoader.readEnv(TIMEOUT_ENV)
                .map(String::strip)
                .map(GatewayEmbedderConfig::parseTimeout)
                .orElse(null);
        return GatewayEmbedderConfig.builder()
                .baseUrl(EnvLoader.readEnv(URL_ENV, null))
                .apiKey(EnvLoader.readEnv(API_KEY_ENV, null))
                .model(EnvLoader.readEnv(MODEL_ENV, null))
                .timeout(timeout)
                .build();
    }

    private static Duration parseTimeout(final String seconds) {
        try {
            final var value = Long.parseLong(seconds);
            Preconditions.checkArgument(value > 0, "%s must be positive", TIMEOUT_ENV);
            return Duration.ofSeconds(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("%s is not a number: %s".formatted(TIMEOUT_ENV, seconds), e);
        }
    }
}
