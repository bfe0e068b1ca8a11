package io.clientportal.sdk;

import io.clientportal.sdk.internal.TrustAllCertificates;
import io.clientportal.sdk.transport.RetryPolicy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link ClientPortalClient} instances.
 *
 * <p>
 * Every setting is optional; {@link #withDefaults()} fills in the gateway defaults. Use {@link #fromEnvironment(Map)}
 * once at process start to resolve the {@code IB_*} variables into a builder.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://localhost:8765/v1/api";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_AUTH_CHECK_INTERVAL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0;

    public static final String ENV_BASE_URL = "IB_BASE";
    public static final String ENV_AUTH_CHECK_INTERVAL = "IB_AUTH_CHECK_INTERVAL";
    public static final String ENV_KEEP_ALIVE_INTERVAL = "IB_KEEP_ALIVE_INTERVAL";
    public static final String ENV_MAX_RETRIES = "IB_MAX_RETRIES";
    public static final String ENV_RETRY_BASE_DELAY = "IB_RETRY_BASE_DELAY";
    public static final String ENV_RETRY_BACKOFF = "IB_RETRY_BACKOFF";
    public static final String ENV_REQUEST_TIMEOUT = "IB_REQUEST_TIMEOUT";
    public static final String ENV_VERIFY_TLS = "IB_VERIFY_TLS";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Duration authCheckInterval;
    private final Duration keepAliveInterval;
    private final Integer maxRetries;
    private final Duration retryBaseDelay;
    private final Double retryBackoffMultiplier;
    private final boolean verifyTls;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.httpClient = builder.httpClient;
        this.requestTimeout = builder.requestTimeout;
        this.authCheckInterval = builder.authCheckInterval;
        this.keepAliveInterval = builder.keepAliveInterval;
        this.maxRetries = builder.maxRetries;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.retryBackoffMultiplier = builder.retryBackoffMultiplier;
        this.verifyTls = builder.verifyTls;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a builder from the process environment.
     */
    public static Builder fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolves a builder from {@code env}. Durations are given in (possibly fractional) seconds. Unset variables leave
     * the builder field empty so {@link #withDefaults()} applies the default.
     *
     * @throws IllegalArgumentException when a variable is set but cannot be parsed.
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder();
        if (env == null) {
            return builder;
        }
        trimToNull(env.get(ENV_BASE_URL)).ifPresent(builder::baseUrl);
        trimToNull(env.get(ENV_AUTH_CHECK_INTERVAL)).ifPresent(v -> builder.authCheckInterval(seconds(ENV_AUTH_CHECK_INTERVAL, v)));
        trimToNull(env.get(ENV_KEEP_ALIVE_INTERVAL)).ifPresent(v -> builder.keepAliveInterval(seconds(ENV_KEEP_ALIVE_INTERVAL, v)));
        trimToNull(env.get(ENV_RETRY_BASE_DELAY)).ifPresent(v -> builder.retryBaseDelay(seconds(ENV_RETRY_BASE_DELAY, v)));
        trimToNull(env.get(ENV_REQUEST_TIMEOUT)).ifPresent(v -> builder.requestTimeout(seconds(ENV_REQUEST_TIMEOUT, v)));
        trimToNull(env.get(ENV_MAX_RETRIES)).ifPresent(v -> {
            try {
                builder.maxRetries(Integer.parseInt(v));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(ENV_MAX_RETRIES + " must be an integer: " + v, ex);
            }
        });
        trimToNull(env.get(ENV_RETRY_BACKOFF)).ifPresent(v -> {
            try {
                builder.retryBackoffMultiplier(Double.parseDouble(v));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(ENV_RETRY_BACKOFF + " must be a number: " + v, ex);
            }
        });
        trimToNull(env.get(ENV_VERIFY_TLS)).ifPresent(v -> builder.verifyTls(parseBoolean(ENV_VERIFY_TLS, v)));
        return builder;
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        Duration resolvedTimeout = positiveOrDefault(requestTimeout, DEFAULT_REQUEST_TIMEOUT, "RequestTimeout");
        Duration resolvedCheckInterval = positiveOrDefault(authCheckInterval, DEFAULT_AUTH_CHECK_INTERVAL, "AuthCheckInterval");
        Duration resolvedKeepAlive = positiveOrDefault(keepAliveInterval, DEFAULT_KEEP_ALIVE_INTERVAL, "KeepAliveInterval");

        int resolvedRetries = Optional.ofNullable(maxRetries).orElse(DEFAULT_MAX_RETRIES);
        Duration resolvedBaseDelay = Optional.ofNullable(retryBaseDelay).orElse(DEFAULT_RETRY_BASE_DELAY);
        double resolvedMultiplier = Optional.ofNullable(retryBackoffMultiplier).orElse(DEFAULT_RETRY_BACKOFF_MULTIPLIER);
        // validates the retry settings
        new RetryPolicy(resolvedRetries, resolvedBaseDelay, resolvedMultiplier);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            HttpClient.Builder clientBuilder = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout);
            if (!verifyTls) {
                clientBuilder.sslContext(TrustAllCertificates.sslContext());
            }
            resolvedClient = clientBuilder.build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .httpClient(resolvedClient)
            .requestTimeout(resolvedTimeout)
            .authCheckInterval(resolvedCheckInterval)
            .keepAliveInterval(resolvedKeepAlive)
            .maxRetries(resolvedRetries)
            .retryBaseDelay(resolvedBaseDelay)
            .retryBackoffMultiplier(resolvedMultiplier)
            .verifyTls(verifyTls)
            .buildInternal();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Duration seconds(String name, String value) {
        try {
            BigDecimal millis = new BigDecimal(value).movePointRight(3);
            return Duration.ofMillis(millis.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException(name + " must be a number of seconds: " + value, ex);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException(name + " must be true or false: " + value);
        }
    }

    private static Optional<String> trimToNull(String value) {
        return Optional.ofNullable(value).map(String::trim).filter(s -> !s.isEmpty());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getAuthCheckInterval() {
        return authCheckInterval;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Double getRetryBackoffMultiplier() {
        return retryBackoffMultiplier;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    /**
     * Retry policy assembled from the resolved retry settings. Only valid on a config returned by {@link #withDefaults()}.
     */
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, retryBaseDelay, retryBackoffMultiplier);
    }

    public static final class Builder {
        private String baseUrl;
        private HttpClient httpClient;
        private Duration requestTimeout;
        private Duration authCheckInterval;
        private Duration keepAliveInterval;
        private Integer maxRetries;
        private Duration retryBaseDelay;
        private Double retryBackoffMultiplier;
        private boolean verifyTls;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder authCheckInterval(Duration authCheckInterval) {
            this.authCheckInterval = authCheckInterval;
            return this;
        }

        public Builder keepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryBackoffMultiplier(Double retryBackoffMultiplier) {
            this.retryBackoffMultiplier = retryBackoffMultiplier;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
