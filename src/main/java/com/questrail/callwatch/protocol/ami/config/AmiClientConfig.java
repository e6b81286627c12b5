package com.questrail.callwatch.protocol.ami.config;

import com.questrail.callwatch.api.ConfigurationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Aggregated configuration for one manager connection.
 *
 * <p>Instances are always valid: the canonical constructor rejects anything the
 * session could not work with by throwing {@link ConfigurationException}.</p>
 */
public record AmiClientConfig(
    String host,
    int port,
    String username,
    String secret,
    Duration connectTimeout,
    Duration actionTimeout,
    ReconnectPolicy reconnectPolicy,
    KeepAlivePolicy keepAlivePolicy,
    CallTrackingPolicy callTrackingPolicy,
    boolean retryHangupOnTimeout
) {
    public static final int DEFAULT_PORT = 5038;

    public AmiClientConfig {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("host is required");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("port must be 1-65535, was " + port);
        }
        if (username == null || username.isBlank()) {
            throw new ConfigurationException("username is required");
        }
        if (secret == null || secret.isEmpty()) {
            throw new ConfigurationException("secret is required");
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(actionTimeout, "actionTimeout");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(keepAlivePolicy, "keepAlivePolicy");
        Objects.requireNonNull(callTrackingPolicy, "callTrackingPolicy");
        host = host.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings persisted by the host application.
     *
     * <p>Recognized keys: {@code ami.host}, {@code ami.port},
     * {@code ami.username}, {@code ami.secret},
     * {@code ami.connectTimeoutMillis}, {@code ami.actionTimeoutMillis},
     * {@code extensions.monitorAll}, {@code extensions.monitored}
     * (comma separated) and {@code extensions.pattern}. When
     * {@code extensions.monitorAll} is {@code false} the explicit list wins over
     * the pattern.</p>
     *
     * @throws ConfigurationException on a missing or malformed value
     */
    public static AmiClientConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");

        Builder b = builder()
            .withHost(props.getProperty("ami.host"))
            .withUsername(props.getProperty("ami.username"))
            .withSecret(props.getProperty("ami.secret"));

        String port = props.getProperty("ami.port");
        if (port != null) {
            b.withPort(parseInt("ami.port", port));
        }
        String connectMillis = props.getProperty("ami.connectTimeoutMillis");
        if (connectMillis != null) {
            b.withConnectTimeout(Duration.ofMillis(parseInt("ami.connectTimeoutMillis", connectMillis)));
        }
        String actionMillis = props.getProperty("ami.actionTimeoutMillis");
        if (actionMillis != null) {
            b.withActionTimeout(Duration.ofMillis(parseInt("ami.actionTimeoutMillis", actionMillis)));
        }

        boolean monitorAll = Boolean.parseBoolean(props.getProperty("extensions.monitorAll", "true").trim());
        if (!monitorAll) {
            b.withExtensions(extensionFilter(props));
        }
        return b.build();
    }

    private static ExtensionFilter extensionFilter(Properties props) {
        String monitored = props.getProperty("extensions.monitored", "");
        Set<String> extensions = new LinkedHashSet<>();
        Arrays.stream(monitored.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(extensions::add);
        if (!extensions.isEmpty()) {
            return ExtensionFilter.of(extensions);
        }

        String pattern = props.getProperty("extensions.pattern");
        if (pattern == null || pattern.isBlank()) {
            throw new ConfigurationException(
                "extensions.monitorAll is false but neither extensions.monitored nor extensions.pattern is set");
        }
        try {
            return ExtensionFilter.matching(Pattern.compile(pattern.trim()));
        }
        catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid extensions.pattern: " + pattern, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + value, e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new ConfigurationException(name + " must be > 0");
        }
    }

    @Override
    public String toString() {
        return "AmiClientConfig{" + username + "@" + host + ":" + port + "}";
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private String username;
        private String secret;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration actionTimeout = Duration.ofSeconds(5);
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private KeepAlivePolicy keepAlivePolicy = KeepAlivePolicy.defaults();
        private CallTrackingPolicy callTrackingPolicy = CallTrackingPolicy.defaults();
        private boolean retryHangupOnTimeout = true;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withSecret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withActionTimeout(Duration actionTimeout) {
            this.actionTimeout = actionTimeout;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder withKeepAlivePolicy(KeepAlivePolicy keepAlivePolicy) {
            this.keepAlivePolicy = keepAlivePolicy;
            return this;
        }

        public Builder withCallTrackingPolicy(CallTrackingPolicy callTrackingPolicy) {
            this.callTrackingPolicy = callTrackingPolicy;
            return this;
        }

        /**
         * Shorthand for replacing only the extension filter of the tracking policy.
         */
        public Builder withExtensions(ExtensionFilter extensions) {
            this.callTrackingPolicy = callTrackingPolicy.withExtensions(extensions);
            return this;
        }

        public Builder withRetryHangupOnTimeout(boolean retry) {
            this.retryHangupOnTimeout = retry;
            return this;
        }

        public AmiClientConfig build() {
            return new AmiClientConfig(host, port, username, secret, connectTimeout, actionTimeout,
                reconnectPolicy, keepAlivePolicy, callTrackingPolicy, retryHangupOnTimeout);
        }
    }
}
