package com.dynop.routing.hybrid.config;

import com.dynop.routing.hybrid.model.TravelProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable routing configuration consumed by the resolution engine.
 *
 * <p>Produced once by the configuration loader (the {@code routing:} section of the Dropwizard YAML) and
 * passed into every engine component at construction; nothing in the engine reads ambient environment
 * state. {@link Builder#build()} validates all values and throws {@link RoutingConfigurationException}
 * listing every problem found.
 *
 * <p>An absent API key is not an error: routing is then unavailable and every query resolves to a
 * great-circle estimate.
 */
@JsonDeserialize(builder = RoutingConfig.Builder.class)
public final class RoutingConfig {

    public static final String DEFAULT_BASE_URL = "https://api.openrouteservice.org/v2/directions";

    private static final Map<TravelProfile, Double> DEFAULT_SPEEDS_KMH = Map.of(
            TravelProfile.DRIVING, 30.0,
            TravelProfile.WALKING, 5.0,
            TravelProfile.CYCLING, 15.0);

    @Nullable
    private final String apiKey;
    private final URI baseUrl;
    private final boolean enableRouting;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;
    private final Duration fallbackCacheTtl;
    private final int maxCacheEntries;
    private final Duration cacheCleanupInterval;
    private final double straightLineThresholdKm;
    private final int maxRetries;
    private final Duration requestTimeout;
    private final Duration retryBackoffBase;
    private final int batchSize;
    private final Duration interBatchDelay;
    private final int requestsPerMinute;
    private final Map<TravelProfile, Double> estimatedSpeedsKmh;
    @Nullable
    private final String cacheDirectory;

    private RoutingConfig(Builder builder, URI baseUrl, @Nullable String apiKey) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.enableRouting = builder.enableRouting;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheTtl = Duration.ofMillis(Math.round(builder.cacheTtlHours * 3_600_000d));
        this.fallbackCacheTtl = Duration.ofMillis(Math.round(builder.fallbackCacheTtlMinutes * 60_000d));
        this.maxCacheEntries = builder.maxCacheEntries;
        this.cacheCleanupInterval = Duration.ofMillis(Math.round(builder.cacheCleanupIntervalHours * 3_600_000d));
        this.straightLineThresholdKm = builder.straightLineThresholdKm;
        this.maxRetries = builder.maxRetries;
        this.requestTimeout = Duration.ofMillis(builder.requestTimeoutMs);
        this.retryBackoffBase = Duration.ofMillis(builder.retryBackoffBaseMs);
        this.batchSize = builder.batchSize;
        this.interBatchDelay = Duration.ofMillis(builder.interBatchDelayMs);
        this.requestsPerMinute = builder.requestsPerMinute;
        this.estimatedSpeedsKmh = Collections.unmodifiableMap(new EnumMap<>(builder.estimatedSpeedsKmh));
        this.cacheDirectory = builder.cacheDirectory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every default and no API key
     */
    public static RoutingConfig defaults() {
        return builder().build();
    }

    /**
     * @return the provider credential, empty when none is configured
     */
    public Optional<String> getApiKey() {
        return Optional.ofNullable(apiKey);
    }

    public boolean isApiKeyConfigured() {
        return apiKey != null;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public boolean isEnableRouting() {
        return enableRouting;
    }

    /**
     * @return true when routing is switched on and a credential is available
     */
    public boolean isRoutingAvailable() {
        return enableRouting && apiKey != null;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    /**
     * @return time-to-live for cached fallback estimates, shorter than {@link #getCacheTtl()} by default
     */
    public Duration getFallbackCacheTtl() {
        return fallbackCacheTtl;
    }

    public int getMaxCacheEntries() {
        return maxCacheEntries;
    }

    public Duration getCacheCleanupInterval() {
        return cacheCleanupInterval;
    }

    public double getStraightLineThresholdKm() {
        return straightLineThresholdKm;
    }

    /**
     * @return number of additional attempts after the first failed provider call
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getRetryBackoffBase() {
        return retryBackoffBase;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getInterBatchDelay() {
        return interBatchDelay;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public Map<TravelProfile, Double> getEstimatedSpeedsKmh() {
        return estimatedSpeedsKmh;
    }

    /**
     * @param profile travel profile
     * @return assumed average speed for great-circle duration estimates
     */
    public double getEstimatedSpeedKmh(TravelProfile profile) {
        return estimatedSpeedsKmh.get(profile);
    }

    /**
     * @return directory for persisting cache entries across restarts, empty to keep the cache in memory only
     */
    public Optional<String> getCacheDirectory() {
        return Optional.ofNullable(cacheDirectory);
    }

    /**
     * Mutable builder, also used by Jackson to read the {@code routing:} configuration section.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {

        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private boolean enableRouting = true;
        private boolean cacheEnabled = true;
        private double cacheTtlHours = 24;
        private double fallbackCacheTtlMinutes = 15;
        private int maxCacheEntries = 1000;
        private double cacheCleanupIntervalHours = 6;
        private double straightLineThresholdKm = 0.5;
        private int maxRetries = 2;
        private long requestTimeoutMs = 5000;
        private long retryBackoffBaseMs = 1000;
        private int batchSize = 3;
        private long interBatchDelayMs = 250;
        private int requestsPerMinute = 40;
        private final Map<TravelProfile, Double> estimatedSpeedsKmh = new EnumMap<>(DEFAULT_SPEEDS_KMH);
        private String cacheDirectory;

        public Builder() {
        }

        @JsonProperty("apiKey")
        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        @JsonProperty("baseUrl")
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        @JsonProperty("enableRouting")
        public Builder enableRouting(boolean enableRouting) {
            this.enableRouting = enableRouting;
            return this;
        }

        @JsonProperty("cacheEnabled")
        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        @JsonProperty("cacheTtlHours")
        public Builder cacheTtlHours(double cacheTtlHours) {
            this.cacheTtlHours = cacheTtlHours;
            return this;
        }

        @JsonProperty("fallbackCacheTtlMinutes")
        public Builder fallbackCacheTtlMinutes(double fallbackCacheTtlMinutes) {
            this.fallbackCacheTtlMinutes = fallbackCacheTtlMinutes;
            return this;
        }

        @JsonProperty("maxCacheEntries")
        public Builder maxCacheEntries(int maxCacheEntries) {
            this.maxCacheEntries = maxCacheEntries;
            return this;
        }

        @JsonProperty("cacheCleanupIntervalHours")
        public Builder cacheCleanupIntervalHours(double cacheCleanupIntervalHours) {
            this.cacheCleanupIntervalHours = cacheCleanupIntervalHours;
            return this;
        }

        @JsonProperty("straightLineThresholdKm")
        public Builder straightLineThresholdKm(double straightLineThresholdKm) {
            this.straightLineThresholdKm = straightLineThresholdKm;
            return this;
        }

        @JsonProperty("maxRetries")
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        @JsonProperty("requestTimeoutMs")
        public Builder requestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        @JsonProperty("retryBackoffBaseMs")
        public Builder retryBackoffBaseMs(long retryBackoffBaseMs) {
            this.retryBackoffBaseMs = retryBackoffBaseMs;
            return this;
        }

        @JsonProperty("batchSize")
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        @JsonProperty("interBatchDelayMs")
        public Builder interBatchDelayMs(long interBatchDelayMs) {
            this.interBatchDelayMs = interBatchDelayMs;
            return this;
        }

        @JsonProperty("requestsPerMinute")
        public Builder requestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
            return this;
        }

        /**
         * Overrides assumed speeds per profile; profiles not present keep their defaults.
         */
        @JsonProperty("estimatedSpeedsKmh")
        public Builder estimatedSpeedsKmh(Map<TravelProfile, Double> speeds) {
            if (speeds != null) {
                this.estimatedSpeedsKmh.putAll(speeds);
            }
            return this;
        }

        @JsonProperty("cacheDirectory")
        public Builder cacheDirectory(String cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        /**
         * Validates all values and creates the configuration.
         *
         * @throws RoutingConfigurationException if any value is invalid
         */
        public RoutingConfig build() {
            List<String> errors = new ArrayList<>();

            URI uri = parseBaseUrl(baseUrl, errors);
            String key = normalizeApiKey(apiKey, errors);

            if (!(cacheTtlHours > 0)) {
                errors.add("cacheTtlHours must be positive");
            }
            if (!(fallbackCacheTtlMinutes > 0)) {
                errors.add("fallbackCacheTtlMinutes must be positive");
            }
            if (maxCacheEntries <= 0) {
                errors.add("maxCacheEntries must be positive");
            }
            if (!(cacheCleanupIntervalHours > 0)) {
                errors.add("cacheCleanupIntervalHours must be positive");
            }
            if (!(straightLineThresholdKm >= 0) || Double.isInfinite(straightLineThresholdKm)) {
                errors.add("straightLineThresholdKm must be a finite non-negative value");
            }
            if (maxRetries < 0) {
                errors.add("maxRetries must be non-negative");
            }
            if (requestTimeoutMs <= 0) {
                errors.add("requestTimeoutMs must be positive");
            }
            if (retryBackoffBaseMs < 0) {
                errors.add("retryBackoffBaseMs must be non-negative");
            }
            if (batchSize < 1) {
                errors.add("batchSize must be at least 1");
            }
            if (interBatchDelayMs < 0) {
                errors.add("interBatchDelayMs must be non-negative");
            }
            if (requestsPerMinute <= 0) {
                errors.add("requestsPerMinute must be positive");
            }
            for (Map.Entry<TravelProfile, Double> speed : estimatedSpeedsKmh.entrySet()) {
                Double value = speed.getValue();
                if (value == null || !(value > 0) || value.isInfinite()) {
                    errors.add("estimatedSpeedsKmh." + speed.getKey().getId() + " must be positive");
                }
            }
            if (cacheDirectory != null && cacheDirectory.isBlank()) {
                cacheDirectory = null;
            }

            if (!errors.isEmpty()) {
                throw new RoutingConfigurationException(errors);
            }
            return new RoutingConfig(this, uri, key);
        }

        private static URI parseBaseUrl(String value, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add("baseUrl is required");
                return null;
            }
            try {
                URI uri = new URI(value.trim());
                String scheme = uri.getScheme();
                if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                        || uri.getHost() == null) {
                    errors.add("Invalid routing provider base URL: " + value);
                    return null;
                }
                String normalized = uri.toString();
                return normalized.endsWith("/") ? URI.create(normalized.substring(0, normalized.length() - 1)) : uri;
            } catch (URISyntaxException e) {
                errors.add("Invalid routing provider base URL: " + value);
                return null;
            }
        }

        private static String normalizeApiKey(String value, List<String> errors) {
            if (value == null || value.isEmpty()) {
                return null;
            }
            if (value.isBlank()) {
                errors.add("apiKey must not be blank when set");
                return null;
            }
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                    errors.add("apiKey contains whitespace or control characters");
                    return null;
                }
            }
            return value;
        }
    }
}
