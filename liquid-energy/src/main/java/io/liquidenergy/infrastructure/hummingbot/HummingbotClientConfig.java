package io.liquidenergy.infrastructure.hummingbot;

import io.liquidenergy.util.Env;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for {@link HummingbotClient}.
 *
 * Validated when built; a bad value raises {@link ValidationException}
 * before any socket is opened.
 *
 * Environment (or system property) keys read by {@link #fromEnv()}:
 * <pre>
 *   HUMMINGBOT_HOST                 gateway host (default localhost)
 *   HUMMINGBOT_PORT                 gateway port (required)
 *   HUMMINGBOT_PATH                 WebSocket path (default /ws)
 *   HUMMINGBOT_API_KEY              API key (required)
 *   HUMMINGBOT_REQUEST_TIMEOUT_MS   per-request timeout (default 5000)
 *   HUMMINGBOT_CONNECT_TIMEOUT_MS   WebSocket handshake timeout (default 10000)
 *   HUMMINGBOT_RETRY_ATTEMPTS       extra connect attempts (default 3)
 *   HUMMINGBOT_RETRY_DELAY_MS       first backoff delay (default 500)
 * </pre>
 */
public final class HummingbotClientConfig {

    public static final String DEFAULT_PATH = "/ws";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_INITIAL_DELAY = Duration.ofMillis(500);
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String host;
    private final int port;
    private final String path;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final int retryAttempts;
    private final Duration retryInitialDelay;
    private final URI uri;

    private HummingbotClientConfig(Builder b, URI uri) {
        this.host = b.host;
        this.port = b.port;
        this.path = b.path;
        this.apiKey = b.apiKey;
        this.requestTimeout = b.requestTimeout;
        this.connectTimeout = b.connectTimeout;
        this.retryAttempts = b.retryAttempts;
        this.retryInitialDelay = b.retryInitialDelay;
        this.uri = uri;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HummingbotClientConfig fromEnv() {
        return builder()
            .host(Env.get("HUMMINGBOT_HOST", "localhost"))
            .port(Env.getInt("HUMMINGBOT_PORT", 0))
            .path(Env.get("HUMMINGBOT_PATH", DEFAULT_PATH))
            .apiKey(Env.get("HUMMINGBOT_API_KEY", null))
            .requestTimeout(Env.getMillis("HUMMINGBOT_REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT))
            .connectTimeout(Env.getMillis("HUMMINGBOT_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT))
            .retryAttempts(Env.getInt("HUMMINGBOT_RETRY_ATTEMPTS", DEFAULT_RETRY_ATTEMPTS))
            .retryInitialDelay(Env.getMillis("HUMMINGBOT_RETRY_DELAY_MS", DEFAULT_RETRY_INITIAL_DELAY))
            .build();
    }

    /**
     * WebSocket endpoint, e.g. {@code ws://localhost:15888/ws}.
     */
    public URI uri() {
        return uri;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPath() {
        return path;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getRetryInitialDelay() {
        return retryInitialDelay;
    }

    @Override
    public String toString() {
        return "HummingbotClientConfig(" + uri()
            + ", apiKey=" + maskKey(apiKey)
            + ", requestTimeout=" + requestTimeout.toMillis() + "ms"
            + ", retryAttempts=" + retryAttempts + ")";
    }

    private static String maskKey(String key) {
        if (key.length() <= 4) return "***";
        return key.substring(0, 2) + "***" + key.substring(key.length() - 2);
    }

    public static final class Builder {
        private String host;
        private int port;
        private String path = DEFAULT_PATH;
        private String apiKey;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private Duration retryInitialDelay = DEFAULT_RETRY_INITIAL_DELAY;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryInitialDelay(Duration retryInitialDelay) {
            this.retryInitialDelay = retryInitialDelay;
            return this;
        }

        public HummingbotClientConfig build() {
            if (host == null || host.isBlank()) {
                throw new ValidationException("API host cannot be empty");
            }
            if (port <= 0 || port > 65535) {
                throw new ValidationException("API port must be a valid port number (1-65535)");
            }
            if (apiKey == null || apiKey.isBlank()) {
                throw new ValidationException("API key cannot be empty");
            }
            if (path == null || !path.startsWith("/")) {
                throw new ValidationException("WebSocket path must start with '/'");
            }
            requirePositive(requestTimeout, "Request timeout");
            requirePositive(connectTimeout, "Connect timeout");
            requirePositive(retryInitialDelay, "Retry delay");
            if (retryAttempts < 0) {
                throw new ValidationException("Retry attempts cannot be negative");
            }
            return new HummingbotClientConfig(this, gatewayUri());
        }

        private URI gatewayUri() {
            String address = "ws://" + host + ":" + port + path;
            URI uri;
            try {
                uri = URI.create(address);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid gateway address " + address + ": " + e.getMessage(), e);
            }
            // a registry-based authority (e.g. "my_host") parses but has no host
            if (uri.getHost() == null) {
                throw new ValidationException("Invalid gateway address " + address + ": not a valid host name");
            }
            return uri;
        }

        private static void requirePositive(Duration d, String name) {
            if (d == null || d.isNegative() || d.isZero()) {
                throw new ValidationException(name + " must be positive");
            }
        }
    }
}
