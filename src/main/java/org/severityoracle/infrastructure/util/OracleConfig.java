package org.severityoracle.infrastructure.util;

import org.severityoracle.domain.impl.SeverityPolicy;
import org.severityoracle.domain.model.AggregationSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Startup configuration of the oracle server.
 * <p>
 * Values come from the classpath resource {@code oracle.properties}; any key can be overridden
 * with a JVM system property of the same name, e.g. {@code -Doracle.quorum=5}.
 */
public record OracleConfig(
        int port,
        String deployer,
        AggregationSettings settings,
        SeverityPolicy severityPolicy,
        CallbackRetry callbackRetry
) {
    public static final String RESOURCE = "oracle.properties";

    public OracleConfig {
        Objects.requireNonNull(deployer, "deployer");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(severityPolicy, "severityPolicy");
        Objects.requireNonNull(callbackRetry, "callbackRetry");
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("oracle.port must be within 0..65535, got " + port);
        }
        if (deployer.isBlank()) {
            throw new IllegalArgumentException("oracle.deployer must be non-blank.");
        }
    }

    /** Backoff for pushing results to callback consumers. */
    public record CallbackRetry(int attempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        public CallbackRetry {
            if (attempts < 1) {
                throw new IllegalArgumentException("oracle.callback.attempts must be >= 1.");
            }
            if (baseDelayMs < 0 || maxDelayMs < 0 || jitterMs < 0) {
                throw new IllegalArgumentException("oracle.callback delays must be >= 0.");
            }
        }
    }

    public OracleConfig withPort(int newPort) {
        return new OracleConfig(newPort, deployer, settings, severityPolicy, callbackRetry);
    }

    /** Defaults from the classpath resource, overridden by system properties. */
    public static OracleConfig load() {
        Properties props = new Properties();
        try (InputStream in = OracleConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("oracle.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static OracleConfig fromProperties(Properties p) {
        AggregationSettings settings = new AggregationSettings(
                intValue(p, "oracle.quorum", 3),
                intValue(p, "oracle.threshold.medium", 20),
                intValue(p, "oracle.threshold.large", 100));
        SeverityPolicy policy = new SeverityPolicy(
                boolValue(p, "oracle.severity.enforceMax", false),
                intValue(p, "oracle.severity.max", SeverityPolicy.UINT16_MAX));
        CallbackRetry retry = new CallbackRetry(
                intValue(p, "oracle.callback.attempts", 4),
                longValue(p, "oracle.callback.baseDelayMs", 200L),
                longValue(p, "oracle.callback.maxDelayMs", 1_600L),
                longValue(p, "oracle.callback.jitterMs", 100L));
        return new OracleConfig(
                intValue(p, "oracle.port", 4567),
                p.getProperty("oracle.deployer", "deployer").trim(),
                settings,
                policy,
                retry);
    }

    private static int intValue(Properties p, String key, int def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static long longValue(Properties p, String key, long def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static boolean boolValue(Properties p, String key, boolean def) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        String v = raw.trim().toLowerCase();
        if (!v.equals("true") && !v.equals("false")) {
            throw new IllegalArgumentException(key + " must be true or false, got '" + raw + "'");
        }
        return Boolean.parseBoolean(v);
    }
}
