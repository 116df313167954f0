package xzy.fz.agent.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

public final class ConfigLoader {
    static final String DEFAULT_RESOURCE = "/proxy-agent.properties";

    private ConfigLoader() {
    }

    public static AgentConfig load() {
        return load(null, Map.of());
    }

    public static AgentConfig load(Map<String, String> overrides) {
        return load(null, overrides);
    }

    /**
     * Layers the classpath defaults, then {@code extraConfig} when it exists, then {@code overrides}.
     */
    public static AgentConfig load(Path extraConfig, Map<String, String> overrides) {
        Properties props = classpathDefaults();
        if (extraConfig != null && Files.exists(extraConfig)) {
            readFile(extraConfig, props);
        }
        props.putAll(overrides);
        return fromProperties(props);
    }

    private static Properties classpathDefaults() {
        Properties defaults = new Properties();
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults;
            }
            defaults.load(in);
            return defaults;
        } catch (IOException ioe) {
            throw new IllegalStateException("Unable to read " + DEFAULT_RESOURCE, ioe);
        }
    }

    private static void readFile(Path file, Properties into) {
        try (InputStream in = Files.newInputStream(file)) {
            into.load(in);
        } catch (IOException ioe) {
            throw new IllegalStateException("Unable to read agent config " + file, ioe);
        }
    }

    public static AgentConfig fromProperties(Properties props) {
        return new AgentConfig(
                boolProp(props, "keepAlive.enabled", true),
                Duration.ofMillis(longProp(props, "keepAlive.intervalMillis", 1000L)),
                Duration.ofMillis(longProp(props, "connect.timeoutMillis", 10_000L)),
                intProp(props, "connect.maxResponseHeadBytes", 16_384),
                props.getProperty("socket.localAddress"),
                intProp(props, "sockets.maxPerKey", 10),
                Duration.ofMillis(longProp(props, "sockets.idleTimeoutMillis", 30_000L)),
                Duration.ofMillis(longProp(props, "sockets.sweepIntervalMillis", 60_000L)),
                boolProp(props, "socks.socketCache", false),
                boolProp(props, "dns.cache.enabled", true),
                Duration.ofMillis(longProp(props, "dns.cache.ttlMillis", 300_000L)),
                intProp(props, "dns.cache.maxSize", 1000),
                Duration.ofMillis(longProp(props, "tls.session.ttlMillis", 300_000L)),
                intProp(props, "tls.session.maxSize", 100),
                boolProp(props, "tls.insecure", false),
                intProp(props, "proxy.cache.maxSize", 100),
                Duration.ofMillis(longProp(props, "proxy.cache.ttlMillis", 0L)),
                intProp(props, "agent.cache.maxSize", 50),
                intProp(props, "url.cache.maxSize", 100),
                intProp(props, "header.cache.maxSize", 100),
                boolProp(props, "wire.logging", false));
    }

    private static int intProp(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        try {
            return value == null ? defaultValue : Integer.parseInt(value.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, nfe);
        }
    }

    private static long longProp(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        try {
            return value == null ? defaultValue : Long.parseLong(value.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalStateException("Invalid number for " + key + ": " + value, nfe);
        }
    }

    private static boolean boolProp(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
